package com.p14n.postrelay.listener;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.postrelay.broker.SubscriberRegistry;
import com.p14n.postrelay.data.BroadcastMessage;
import com.p14n.postrelay.data.RelayConfig;
import com.p14n.postrelay.data.ResumePosition;
import com.p14n.postrelay.telemetry.RelayMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.p14n.postrelay.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Background reader that turns inserts in the shared table into local
 * deliveries.
 *
 * <p>
 * One dedicated thread runs the loop
 * {@code CONNECTING -> ACTIVE -> (failure) BACKOFF -> CONNECTING}. Each
 * connection asks the store whether a change feed is available and opens a
 * change feed or polling reader accordingly, so a listener that started in
 * polling mode moves to the change feed without a restart once logical
 * replication is enabled.
 * </p>
 *
 * <p>
 * The resume position and the attempt counter are only written by the
 * listener thread. Every wait in the loop is bounded or waits on the shutdown
 * signal, so {@link #shutdown()} takes effect within about one read timeout.
 * Delivery is at least once: after a reconnect, messages newer than the last
 * recorded position may be delivered again.
 * </p>
 */
public class Listener implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Listener.class);

    public enum State {
        INITIAL,
        CONNECTING,
        ACTIVE,
        BACKOFF,
        SHUTTING_DOWN,
        TERMINATED
    }

    private final SubscriberRegistry registry;
    private final EventSourceFactory sourceFactory;
    private final ReconnectPolicy policy;
    private final Duration readMaxWait;
    private final Duration shutdownGrace;
    private final RelayMetrics metrics;
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final ShutdownSignal shutdownSignal = new ShutdownSignal();
    private final AtomicReference<EventSource> currentSource = new AtomicReference<>();
    private final Object stateLock = new Object();

    private volatile boolean running = false;
    private volatile State state = State.INITIAL;
    private volatile EventSource.Mode activeMode;
    private volatile int reconnectAttempts = 0;
    private volatile ResumePosition resumePosition;
    private ExecutorService executor;
    private boolean shutdownRequested = false;

    public Listener(SubscriberRegistry registry, EventSourceFactory sourceFactory, RelayConfig cfg,
            RelayMetrics metrics, OpenTelemetry ot) {
        this(registry, sourceFactory, ReconnectPolicy.from(cfg), cfg.readMaxWait(), cfg.shutdownGrace(), metrics,
                ot);
    }

    public Listener(SubscriberRegistry registry, EventSourceFactory sourceFactory, ReconnectPolicy policy,
            Duration readMaxWait, Duration shutdownGrace, RelayMetrics metrics, OpenTelemetry ot) {
        this.registry = registry;
        this.sourceFactory = sourceFactory;
        this.policy = policy;
        this.readMaxWait = readMaxWait;
        this.shutdownGrace = shutdownGrace;
        this.metrics = metrics;
        this.openTelemetry = ot;
        this.tracer = ot.getTracer("postrelay");
    }

    /**
     * Starts the listener thread.
     *
     * @return this listener
     * @throws IllegalStateException if already started or shut down
     */
    public synchronized Listener start() {
        if (executor != null || shutdownRequested) {
            throw new IllegalStateException("Listener already started");
        }
        running = true;
        setState(State.CONNECTING);
        executor = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("postrelay-listener-%d").setDaemon(true).build());
        executor.execute(this::listenLoop);
        logger.atInfo().log("Listener started");
        return this;
    }

    private void listenLoop() {
        try {
            while (running) {
                EventSource source = null;
                boolean failed = false;
                try {
                    setState(State.CONNECTING);
                    EventSource.Mode mode = sourceFactory.changeFeedSupported()
                            ? EventSource.Mode.CHANGE_FEED
                            : EventSource.Mode.POLLING;
                    source = sourceFactory.open(mode, resumePosition, shutdownSignal);
                    currentSource.set(source);
                    if (!running) {
                        break;
                    }
                    activeMode = source.mode();
                    setState(State.ACTIVE);
                    logger.atInfo().log("Listening for broadcasts using {}", activeMode);

                    readUntilYield(source);

                    if (running && source.shouldYield()) {
                        logger.atInfo().log("Reconnecting to switch from {}", source.mode());
                        metrics.recordReconnect("topology_change");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    if (running) {
                        logger.atWarn().log("Listener interrupted; stopping");
                    }
                    break;
                } catch (SQLException | IOException e) {
                    if (!running) {
                        break;
                    }
                    failed = true;
                    reconnectAttempts++;
                    logger.atWarn()
                            .addArgument(e.getClass().getSimpleName())
                            .addArgument(e.getMessage())
                            .log("Store error ({}): {}");
                    metrics.recordReconnect(e.getClass().getSimpleName());
                } catch (Exception e) {
                    if (!running) {
                        break;
                    }
                    failed = true;
                    reconnectAttempts++;
                    logger.atError()
                            .setCause(e)
                            .addArgument(e.getClass().getSimpleName())
                            .addArgument(e.getMessage())
                            .log("Unexpected listener error ({}): {}");
                    metrics.recordReconnect(e.getClass().getSimpleName());
                } finally {
                    currentSource.compareAndSet(source, null);
                    closeSource(source);
                    activeMode = null;
                }
                if (failed && running && backoff()) {
                    break;
                }
            }
        } finally {
            setState(State.TERMINATED);
            logger.atInfo().log("Listener stopped");
        }
    }

    private void readUntilYield(EventSource source)
            throws SQLException, IOException, InterruptedException {
        while (running && !source.shouldYield()) {
            List<BroadcastMessage> batch = source.readBatch(readMaxWait);
            for (BroadcastMessage message : batch) {
                if (!running) {
                    return;
                }
                dispatch(message);
            }
            ResumePosition position = source.position();
            if (position != null) {
                resumePosition = position;
            }
            reconnectAttempts = 0;
        }
    }

    private void dispatch(BroadcastMessage message) {
        String channel = message.channel();
        if (!registry.hasSubscribers(channel)) {
            return;
        }
        processWithTelemetry(openTelemetry, tracer, message, "dispatch_message", () -> {
            int delivered = registry.notify(channel, message.payload());
            if (delivered > 0) {
                metrics.recordDelivered(channel, message.payloadSize(), delivered);
                logger.atTrace()
                        .addArgument(message.id())
                        .addArgument(channel)
                        .addArgument(delivered)
                        .log("Dispatched message {} on {} to {} subscribers");
            }
            return delivered;
        });
    }

    /**
     * @return true if shutdown was signalled while waiting
     */
    private boolean backoff() {
        setState(State.BACKOFF);
        Duration delay = policy.delay(reconnectAttempts);
        logger.atDebug()
                .addArgument(delay.toMillis())
                .addArgument(reconnectAttempts)
                .log("Retrying in {} ms (attempt {})");
        try {
            return shutdownSignal.await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void closeSource(EventSource source) {
        if (source == null) {
            return;
        }
        try {
            source.close();
        } catch (Exception e) {
            logger.atDebug()
                    .addArgument(e.getClass().getSimpleName())
                    .addArgument(e.getMessage())
                    .log("Event source close warning ({}): {}");
        }
    }

    private void setState(State newState) {
        synchronized (stateLock) {
            if (state == State.TERMINATED) {
                return;
            }
            if (state == State.SHUTTING_DOWN && newState != State.TERMINATED) {
                return;
            }
            state = newState;
            stateLock.notifyAll();
        }
    }

    /**
     * Stops the listener thread. Waits up to the configured grace period for it
     * to finish and interrupts it after that. Safe to call more than once, and
     * on a listener that was never started.
     */
    public void shutdown() {
        ExecutorService toStop;
        synchronized (this) {
            if (shutdownRequested) {
                return;
            }
            shutdownRequested = true;
            toStop = executor;
        }
        logger.atInfo().log("Shutting down listener");
        running = false;
        setState(State.SHUTTING_DOWN);
        shutdownSignal.fire();
        closeSource(currentSource.getAndSet(null));

        if (toStop == null) {
            setState(State.TERMINATED);
            return;
        }
        toStop.shutdown();
        try {
            if (!toStop.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.atWarn()
                        .addArgument(shutdownGrace.toMillis())
                        .log("Listener did not stop within {} ms; interrupting");
                toStop.shutdownNow();
                if (!toStop.awaitTermination(1, TimeUnit.SECONDS)) {
                    logger.atWarn().log("Listener thread still running after interrupt");
                }
            }
        } catch (InterruptedException e) {
            toStop.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            setState(State.TERMINATED);
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Waits until the listener is reading from a source.
     *
     * @param timeout the longest to wait
     * @return true if the listener became active in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitActive(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (stateLock) {
            while (state != State.ACTIVE) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0 || state == State.TERMINATED) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(stateLock, remaining);
            }
            return true;
        }
    }

    public State state() {
        return state;
    }

    /**
     * @return the mode of the current source, or null when not active
     */
    public EventSource.Mode activeMode() {
        return activeMode;
    }

    public int reconnectAttempts() {
        return reconnectAttempts;
    }

    public ResumePosition resumePosition() {
        return resumePosition;
    }

    public boolean isRunning() {
        return running;
    }
}
