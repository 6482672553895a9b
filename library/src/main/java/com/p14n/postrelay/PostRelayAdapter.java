package com.p14n.postrelay;

import com.p14n.postrelay.broker.MessageSubscriber;
import com.p14n.postrelay.broker.SubscriberRegistry;
import com.p14n.postrelay.data.RelayConfig;
import com.p14n.postrelay.db.DatabaseSetup;
import com.p14n.postrelay.db.ExpiryReaper;
import com.p14n.postrelay.db.MessageStore;
import com.p14n.postrelay.listener.Listener;
import com.p14n.postrelay.listener.StoreEventSourceFactory;
import com.p14n.postrelay.telemetry.OpenTelemetryFunctions;
import com.p14n.postrelay.telemetry.RelayMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.Executor;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross-process publish/subscribe backed by a shared PostgreSQL table.
 *
 * <p>
 * Broadcasts are rows inserted into the table. Every adapter runs one
 * {@link Listener} that follows new rows, through logical replication when the
 * server has it enabled and by polling otherwise, and hands each payload to the
 * local subscribers of its channel. Subscriber callbacks always run on the
 * executor passed to the constructor.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * try (var adapter = new PostRelayAdapter(dataSource, config, callbackExecutor, openTelemetry)) {
 *     adapter.subscribe("chat", payload -> System.out.println(payload));
 *     adapter.broadcast("chat", "hello world");
 * }
 * }</pre>
 *
 * <p>
 * Delivery is at least once: a listener that reconnects may deliver a message
 * it had already delivered.
 * </p>
 */
public class PostRelayAdapter implements SubscriptionAdapter, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PostRelayAdapter.class);

    private final RelayConfig cfg;
    private final MessageStore store;
    private final SubscriberRegistry registry;
    private final ExpiryReaper reaper;
    private final RelayMetrics metrics;
    private final OpenTelemetry ot;
    private final Tracer tracer;
    private final Object listenerLock = new Object();
    private Listener listener;
    private boolean shutdown = false;

    /**
     * Creates the table if needed and starts the expiry sweep. Listening starts
     * on the first subscribe.
     *
     * @param ds               pool for the shared database
     * @param cfg              relay configuration
     * @param callbackExecutor where subscriber callbacks run
     * @param ot               OpenTelemetry for spans and metrics
     * @throws ChangeFeedRequiredException if the config requires a change feed
     *                                     and the server does not provide one
     * @throws RelayException              if the table cannot be created
     */
    public PostRelayAdapter(DataSource ds, RelayConfig cfg, Executor callbackExecutor, OpenTelemetry ot) {
        this.cfg = cfg;
        this.ot = ot;
        this.tracer = ot.getTracer("postrelay");
        this.metrics = new RelayMetrics(ot.getMeter("postrelay"));
        this.store = new MessageStore(ds, cfg);

        if (!store.supportsChangeFeed()) {
            if (cfg.requireChangeFeed()) {
                throw new ChangeFeedRequiredException();
            }
            logger.atWarn()
                    .log("Logical replication is not enabled (wal_level != logical); listeners will poll for messages");
        }

        new DatabaseSetup(ds, cfg).ensureSchema();
        this.registry = new SubscriberRegistry(callbackExecutor, metrics);
        this.reaper = new ExpiryReaper(store, cfg.expirySweepInterval()).start();

        logger.atInfo()
                .addArgument(cfg.qualifiedTableName())
                .addArgument(cfg.affinity())
                .log("Relay initialized on {} (affinity {})");
    }

    /**
     * The listener for this adapter, created and started on first call.
     *
     * @return the running listener
     * @throws IllegalStateException if the adapter has been shut down
     */
    public Listener listener() {
        synchronized (listenerLock) {
            if (shutdown) {
                throw new IllegalStateException("Adapter has been shut down");
            }
            if (listener == null) {
                listener = new Listener(registry, new StoreEventSourceFactory(store, registry), cfg, metrics, ot)
                        .start();
            }
            return listener;
        }
    }

    @Override
    public boolean broadcast(String channel, String payload) {
        try {
            long id = OpenTelemetryFunctions.processWithTelemetry(tracer, "broadcast_message", channel, () -> {
                try {
                    return store.insert(channel, payload, OpenTelemetryFunctions.serializeTraceContext(ot));
                } catch (SQLException e) {
                    throw new RelayException("Insert failed", e);
                }
            });
            metrics.recordBroadcast(channel, true);
            logger.atTrace()
                    .addArgument(id)
                    .addArgument(channel)
                    .log("Broadcast message {} on {}");
            return true;
        } catch (Exception e) {
            metrics.recordBroadcast(channel, false);
            Throwable cause = e instanceof RelayException && e.getCause() != null ? e.getCause() : e;
            logger.atWarn()
                    .setCause(cause)
                    .addArgument(channel)
                    .addArgument(cause.getClass().getSimpleName())
                    .addArgument(cause.getMessage())
                    .log("Broadcast to {} failed ({}): {}");
            return false;
        }
    }

    @Override
    public void subscribe(String channel, MessageSubscriber<String> subscriber, Runnable onSubscribed) {
        registry.addSubscriber(channel, subscriber, onSubscribed);
        listener();
    }

    @Override
    public void unsubscribe(String channel, MessageSubscriber<String> subscriber) {
        registry.removeSubscriber(channel, subscriber);
    }

    /**
     * Waits for the listener to start reading. Hosts that broadcast immediately
     * after subscribing use this so the first messages are not missed.
     *
     * @param timeout the longest to wait
     * @return true if the listener is reading
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitListening(Duration timeout) throws InterruptedException {
        return listener().awaitActive(timeout);
    }

    @Override
    public void shutdown() {
        Listener toStop;
        synchronized (listenerLock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            toStop = listener;
        }
        logger.atInfo().log("Shutting down relay");
        if (toStop != null) {
            toStop.shutdown();
        }
        reaper.close();
        registry.close();
    }

    @Override
    public void close() {
        shutdown();
    }

    MessageStore store() {
        return store;
    }

    SubscriberRegistry registry() {
        return registry;
    }
}
