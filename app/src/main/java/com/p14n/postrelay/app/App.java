package com.p14n.postrelay.app;

import com.p14n.postrelay.PostRelayAdapter;
import com.p14n.postrelay.data.ConfigData;
import com.p14n.postrelay.db.DatabaseSetup;

import com.zaxxer.hikari.HikariDataSource;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.instrumentation.jdbc.datasource.JdbcTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.IntStream;

/**
 * Demo host. Subscribes to {@code APP_READ_CHANNELS}, logs what arrives, and
 * broadcasts bursts to {@code APP_WRITE_CHANNELS} at a varying rate. Database
 * settings come from the {@code RELAY_*} environment variables.
 */
public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static String[] envVals(Map<String, String> env, String name) {
        var e = env.get(name);
        if (e != null && !e.isBlank()) {
            return e.split(",");
        }
        return new String[] {};
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> env = System.getenv();
        var cfg = ConfigData.fromEnvironment(env);
        var write = envVals(env, "APP_WRITE_CHANNELS");
        var read = envVals(env, "APP_READ_CHANNELS");
        var ot = Opentelemetry.createOrNoop("postrelay", env.get("APP_OTLP_ENDPOINT"));

        run(cfg, write, read, ot);
    }

    private static void run(ConfigData cfg, String[] write, String[] read, OpenTelemetry ot)
            throws InterruptedException {

        // callbacks are serialized onto one thread, as a host event loop would
        ExecutorService callbacks = Executors.newSingleThreadExecutor();
        HikariDataSource pool = DatabaseSetup.createPool(cfg);
        var ds = JdbcTelemetry.create(ot).wrap(pool);
        AtomicLong received = new AtomicLong();

        try (var adapter = new PostRelayAdapter(ds, cfg, callbacks, ot)) {
            Runtime.getRuntime().addShutdownHook(new Thread(adapter::shutdown, "postrelay-app-shutdown"));

            for (var channel : read) {
                adapter.subscribe(channel, payload -> {
                    long n = received.incrementAndGet();
                    logger.atDebug().addArgument(channel).addArgument(payload).log("{}: {}");
                    if (n % 100 == 0) {
                        logger.atInfo().addArgument(n).log("Received {} messages");
                    }
                }, () -> logger.atInfo().addArgument(channel).log("Subscribed to {}"));
            }
            if (read.length > 0 && !adapter.awaitListening(Duration.ofSeconds(cfg.startupTimeoutSeconds()))) {
                logger.atWarn().log("Listener not active yet; early broadcasts may be missed");
            }

            if (write.length > 0) {
                writeContinuously(adapter, write);
            } else {
                Thread.currentThread().join();
            }
        } finally {
            callbacks.shutdown();
            pool.close();
        }
    }

    private static void writeContinuously(PostRelayAdapter adapter, String[] write) throws InterruptedException {
        var gap = 1000;
        var direction = -1;
        while (!Thread.currentThread().isInterrupted()) {
            for (var channel : write) {
                IntStream.range(0, 10).forEachOrdered(n -> {
                    if (!adapter.broadcast(channel, UUID.randomUUID().toString())) {
                        logger.atWarn().addArgument(channel).log("Broadcast to {} failed");
                    }
                });
            }
            gap += direction * 10;
            if (gap < 10) {
                direction = 1;
            } else if (gap > 1000) {
                direction = -1;
            }
            Thread.sleep(gap);
        }
    }
}
