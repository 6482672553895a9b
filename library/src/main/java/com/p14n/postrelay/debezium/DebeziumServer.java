package com.p14n.postrelay.debezium;

import java.util.Properties;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.postrelay.data.RelayConfig;
import io.debezium.engine.DebeziumEngine;
import io.debezium.engine.format.Json;
import io.debezium.engine.ChangeEvent;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.io.IOException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a Debezium embedded engine that streams inserts on the messages table
 * through PostgreSQL logical replication (pgoutput).
 *
 * <p>
 * Each engine owns a replication slot named after the instance affinity and
 * drops it on stop. Offsets are held in memory only, so nothing about the
 * stream position survives the engine.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * DebeziumServer server = new DebeziumServer();
 * server.start(config, event -> queue.offer(event), (success, message, error) -> {
 * });
 * // ...
 * server.stop();
 * }</pre>
 */
public class DebeziumServer {
        private static final Logger logger = LoggerFactory.getLogger(DebeziumServer.class);

        public DebeziumServer() {
        }

        /**
         * Creates Debezium configuration properties for the messages table.
         *
         * <p>
         * Configures:
         * </p>
         * <ul>
         * <li>PostgreSQL connector with pgoutput plugin</li>
         * <li>In-memory offset storage</li>
         * <li>A filtered publication shared by every instance</li>
         * <li>A per-instance replication slot dropped on stop</li>
         * <li>Only insert operations, no snapshot of existing rows</li>
         * </ul>
         *
         * @param cfg relay configuration
         * @return Properties configured for Debezium PostgreSQL connector
         */
        public static Properties props(RelayConfig cfg) {
                final Properties props = new Properties();
                String slot = slotName(cfg.affinity());

                props.setProperty("name", "postrelay-" + cfg.affinity());
                props.setProperty("connector.class", "io.debezium.connector.postgresql.PostgresConnector");
                props.setProperty("offset.storage", "org.apache.kafka.connect.storage.MemoryOffsetBackingStore");
                props.setProperty("offset.flush.interval.ms", "1000");
                props.setProperty("poll.interval.ms",
                                String.valueOf(Math.max(10, Math.min(500, cfg.readMaxWait().toMillis()))));
                props.setProperty("database.hostname", cfg.dbHost());
                props.setProperty("plugin.name", "pgoutput");
                props.setProperty("database.port", String.valueOf(cfg.dbPort()));
                props.setProperty("database.user", cfg.dbUser());
                props.setProperty("database.password", cfg.dbPassword());
                props.setProperty("database.dbname", cfg.dbName());
                props.setProperty("table.include.list", cfg.qualifiedTableName());
                props.setProperty("topic.prefix", "postrelay");
                props.setProperty("publication.name", "postrelay_" + cfg.tableName());
                props.setProperty("publication.autocreate.mode", "filtered");
                props.setProperty("snapshot.mode", "no_data");
                props.setProperty("slot.name", slot);
                props.setProperty("slot.drop.on.stop", "true");
                props.setProperty("skipped.operations", "u,d,t");
                props.setProperty("tombstones.on.delete", "false");
                return props;
        }

        /**
         * Replication slot names only allow lower case letters, digits and
         * underscores.
         */
        static String slotName(String affinity) {
                String cleaned = affinity.toLowerCase().replaceAll("[^a-z0-9_]", "_");
                String name = "postrelay_" + cleaned;
                return name.length() > 63 ? name.substring(0, 63) : name;
        }

        private ExecutorService executor;
        private DebeziumEngine<ChangeEvent<String, String>> engine;

        /**
         * Starts the Debezium engine and waits until its task is running.
         *
         * @param cfg        Configuration for the Debezium engine
         * @param consumer   Consumer to process change events
         * @param completion notified when the engine stops, successfully or not
         * @throws IllegalStateException if the consumer or config is null, or
         *                               startup timeout is exceeded
         * @throws IOException           if the engine fails during startup
         * @throws InterruptedException  if startup is interrupted
         */
        public void start(RelayConfig cfg,
                        Consumer<ChangeEvent<String, String>> consumer,
                        DebeziumEngine.CompletionCallback completion) throws IOException, InterruptedException {
                if (consumer == null) {
                        throw new IllegalStateException("Change event consumer must be set before starting the engine");
                }
                if (cfg == null) {
                        throw new IllegalStateException("Config must be set before starting the engine");
                }
                logger.atInfo()
                                .addArgument(cfg.qualifiedTableName())
                                .addArgument(cfg.affinity())
                                .log("Starting Debezium engine for table {} with affinity {}");
                var started = new CountDownLatch(1);
                var startupFailure = new AtomicReference<Throwable>();
                engine = DebeziumEngine.create(Json.class)
                                .using(new DebeziumEngine.ConnectorCallback() {
                                        @Override
                                        public void taskStarted() {
                                                started.countDown();
                                        }
                                })
                                .using((success, message, error) -> {
                                        if (!success) {
                                                startupFailure.compareAndSet(null,
                                                                error != null ? error : new IOException(message));
                                        }
                                        started.countDown();
                                        if (completion != null) {
                                                completion.handle(success, message, error);
                                        }
                                })
                                .using(cfg.overrideProps() != null ? cfg.overrideProps() : props(cfg))
                                .notifying(consumer)
                                .build();
                executor = Executors.newSingleThreadExecutor(
                                new ThreadFactoryBuilder().setNameFormat("postrelay-debezium-%d").setDaemon(true)
                                                .build());
                executor.execute(engine);
                boolean ready;
                try {
                        ready = started.await(cfg.startupTimeoutSeconds(), TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                        logger.atWarn().log("Interrupted while waiting for Debezium engine to start; stopping it");
                        stopAfterFailedStart(e);
                        throw e;
                }
                if (!ready) {
                        logger.atError().log("Debezium engine failed to start within {} seconds",
                                        cfg.startupTimeoutSeconds());
                        stop();
                        throw new IllegalStateException("Debezium engine failed to start within "
                                        + cfg.startupTimeoutSeconds() + " seconds");
                }
                Throwable failure = startupFailure.get();
                if (failure != null) {
                        stop();
                        throw new IOException("Debezium engine failed to start", failure);
                }
                logger.atInfo().log("Debezium engine started successfully");
        }

        private void stopAfterFailedStart(Exception cause) {
                try {
                        stop();
                } catch (IOException | RuntimeException stopFailure) {
                        cause.addSuppressed(stopFailure);
                }
        }

        /**
         * Stops the Debezium engine and executor service. Safe to call more than
         * once.
         *
         * @throws IOException if engine shutdown fails
         */
        public synchronized void stop() throws IOException {
                if (executor != null) {
                        executor.shutdown();
                }
                try {
                        if (engine != null) {
                                engine.close();
                        }
                } finally {
                        engine = null;
                        if (executor != null) {
                                try {
                                        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                                                logger.warn("Debezium executor did not terminate in the specified time.");
                                                executor.shutdownNow();
                                        }
                                } catch (InterruptedException e) {
                                        executor.shutdownNow();
                                        Thread.currentThread().interrupt();
                                        logger.error("Shutdown interrupted", e);
                                }
                                executor = null;
                        }
                }
        }
}
