package com.p14n.postrelay.listener;

import com.p14n.postrelay.broker.SubscriberRegistry;
import com.p14n.postrelay.data.BroadcastMessage;
import com.p14n.postrelay.data.ResumePosition;
import com.p14n.postrelay.telemetry.RelayMetrics;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class ListenerTest {

    private static final Duration READ_WAIT = Duration.ofMillis(20);

    /**
     * Serves scripted steps: a list of messages, an exception to throw, or
     * YIELD to ask the listener to reconnect.
     */
    private static class ScriptedSource implements EventSource {
        static final Object YIELD = new Object();

        private final Mode mode;
        private final BlockingQueue<Object> steps;
        private final AtomicBoolean closed = new AtomicBoolean();
        private ResumePosition position;
        private volatile boolean yield;

        ScriptedSource(Mode mode, BlockingQueue<Object> steps, ResumePosition resume) {
            this.mode = mode;
            this.steps = steps;
            this.position = resume;
        }

        @Override
        public Mode mode() {
            return mode;
        }

        @Override
        @SuppressWarnings("unchecked")
        public List<BroadcastMessage> readBatch(Duration maxWait)
                throws SQLException, IOException, InterruptedException {
            Object step = steps.poll(maxWait.toMillis(), TimeUnit.MILLISECONDS);
            if (step == null) {
                return List.of();
            }
            if (step == YIELD) {
                yield = true;
                return List.of();
            }
            if (step instanceof SQLException) {
                throw (SQLException) step;
            }
            if (step instanceof IOException) {
                throw (IOException) step;
            }
            if (step instanceof RuntimeException) {
                throw (RuntimeException) step;
            }
            List<BroadcastMessage> batch = (List<BroadcastMessage>) step;
            if (!batch.isEmpty()) {
                position = ResumePosition.afterId(batch.get(batch.size() - 1).id());
            }
            return batch;
        }

        @Override
        public ResumePosition position() {
            return position;
        }

        @Override
        public boolean shouldYield() {
            return yield;
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }

    private static class FakeFactory implements EventSourceFactory {
        final AtomicBoolean changeFeed = new AtomicBoolean(false);
        final AtomicInteger failOpens = new AtomicInteger(0);
        final BlockingQueue<Object> steps = new LinkedBlockingQueue<>();
        final List<ResumePosition> resumes = Collections.synchronizedList(new ArrayList<>());
        final List<EventSource.Mode> modes = new CopyOnWriteArrayList<>();
        final List<ScriptedSource> opened = new CopyOnWriteArrayList<>();
        final List<Long> openedAt = new CopyOnWriteArrayList<>();

        @Override
        public boolean changeFeedSupported() {
            return changeFeed.get();
        }

        @Override
        public EventSource open(EventSource.Mode mode, ResumePosition resume, ShutdownSignal shutdown)
                throws SQLException {
            openedAt.add(System.nanoTime());
            modes.add(mode);
            resumes.add(resume);
            if (failOpens.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
                throw new SQLException("connection refused");
            }
            var source = new ScriptedSource(mode, steps, resume);
            opened.add(source);
            return source;
        }
    }

    private ExecutorService callbacks;
    private SubscriberRegistry registry;
    private FakeFactory factory;
    private Listener listener;

    @BeforeEach
    void setUp() {
        callbacks = Executors.newSingleThreadExecutor();
        registry = new SubscriberRegistry(callbacks, new RelayMetrics(OpenTelemetry.noop().getMeter("test")));
        factory = new FakeFactory();
    }

    @AfterEach
    void tearDown() {
        if (listener != null) {
            listener.shutdown();
        }
        registry.close();
        callbacks.shutdownNow();
    }

    private Listener listener(Duration baseDelay, Duration maxDelay, Duration grace) {
        listener = new Listener(registry, factory, new ReconnectPolicy(baseDelay, maxDelay), READ_WAIT, grace,
                new RelayMetrics(OpenTelemetry.noop().getMeter("test")), OpenTelemetry.noop());
        return listener;
    }

    private Listener listener() {
        return listener(Duration.ofMillis(10), Duration.ofMillis(40), Duration.ofSeconds(2));
    }

    private static BroadcastMessage message(long id, String channel, String payload) {
        return BroadcastMessage.create(id, channel, payload, Instant.now(), Instant.now().plusSeconds(60), null);
    }

    private static void eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met in time");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void dispatchesMessagesToSubscribersInOrder() throws InterruptedException {
        List<String> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        registry.addSubscriber("chat", m -> {
            received.add(m);
            latch.countDown();
        }, null);

        listener().start();
        assertTrue(listener.awaitActive(Duration.ofSeconds(2)));
        assertEquals(EventSource.Mode.POLLING, listener.activeMode());

        factory.steps.add(List.of(message(1, "chat", "a"), message(2, "other", "x"), message(3, "chat", "b")));
        factory.steps.add(List.of(message(4, "chat", "c")));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("a", "b", "c"), received);
        eventually(() -> listener.resumePosition() != null && listener.resumePosition().lastId() == 4);
    }

    @Test
    void retriesWithBackoffUntilOpenSucceeds() throws InterruptedException {
        factory.failOpens.set(3);

        listener().start();

        assertTrue(listener.awaitActive(Duration.ofSeconds(2)));
        assertEquals(4, factory.modes.size());
        eventually(() -> listener.reconnectAttempts() == 0);
    }

    @Test
    void firstRetryWaitsTwiceTheBaseDelay() throws InterruptedException {
        factory.failOpens.set(1);

        listener(Duration.ofMillis(200), Duration.ofSeconds(10), Duration.ofSeconds(2)).start();

        assertTrue(listener.awaitActive(Duration.ofSeconds(3)));
        assertEquals(2, factory.openedAt.size());
        long waited = factory.openedAt.get(1) - factory.openedAt.get(0);
        assertTrue(waited >= TimeUnit.MILLISECONDS.toNanos(390), "waited only " + waited + "ns");
    }

    @Test
    void attemptsGrowWhileStoreIsUnavailable() throws InterruptedException {
        factory.failOpens.set(Integer.MAX_VALUE);

        listener().start();

        eventually(() -> listener.reconnectAttempts() >= 3);
        assertNotEquals(Listener.State.ACTIVE, listener.state());
        assertTrue(factory.opened.isEmpty());
    }

    @Test
    void readFailureReconnectsFromLastPosition() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(2);
        registry.addSubscriber("chat", m -> latch.countDown(), null);

        listener().start();
        factory.steps.add(List.of(message(10, "chat", "before")));
        factory.steps.add(new SQLException("connection reset"));
        factory.steps.add(List.of(message(11, "chat", "after")));

        assertTrue(latch.await(3, TimeUnit.SECONDS));
        eventually(() -> factory.opened.size() >= 2);
        assertTrue(factory.opened.get(0).closed.get());
        assertNull(factory.resumes.get(0));
        assertEquals(ResumePosition.afterId(10), factory.resumes.get(1));
    }

    @Test
    void unexpectedErrorsAreContained() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        registry.addSubscriber("chat", m -> latch.countDown(), null);

        listener().start();
        factory.steps.add(new IllegalStateException("boom"));
        factory.steps.add(List.of(message(1, "chat", "still delivered")));

        assertTrue(latch.await(3, TimeUnit.SECONDS));
        assertTrue(listener.isRunning());
    }

    @Test
    void switchesToChangeFeedWhenSourceYields() throws InterruptedException {
        listener().start();
        assertTrue(listener.awaitActive(Duration.ofSeconds(2)));
        assertEquals(EventSource.Mode.POLLING, listener.activeMode());

        factory.changeFeed.set(true);
        factory.steps.add(ScriptedSource.YIELD);

        eventually(() -> listener.activeMode() == EventSource.Mode.CHANGE_FEED);
        assertEquals(List.of(EventSource.Mode.POLLING, EventSource.Mode.CHANGE_FEED), factory.modes);
        assertEquals(0, listener.reconnectAttempts());
    }

    @Test
    void shutdownStopsWithinGracePeriod() throws InterruptedException {
        listener(Duration.ofMillis(10), Duration.ofMillis(40), Duration.ofSeconds(1)).start();
        assertTrue(listener.awaitActive(Duration.ofSeconds(2)));

        long start = System.nanoTime();
        listener.shutdown();

        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(1));
        assertEquals(Listener.State.TERMINATED, listener.state());
        assertFalse(listener.isRunning());
        assertTrue(factory.opened.get(0).closed.get());
    }

    @Test
    void shutdownInterruptsBackoffWait() throws InterruptedException {
        factory.failOpens.set(Integer.MAX_VALUE);
        listener(Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(2)).start();
        eventually(() -> listener.state() == Listener.State.BACKOFF);

        long start = System.nanoTime();
        listener.shutdown();

        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(2));
        assertEquals(Listener.State.TERMINATED, listener.state());
    }

    @Test
    void shutdownWithoutStartIsSafe() {
        var neverStarted = listener();
        assertEquals(Listener.State.INITIAL, neverStarted.state());

        neverStarted.shutdown();
        neverStarted.shutdown();

        assertEquals(Listener.State.TERMINATED, neverStarted.state());
        assertThrows(IllegalStateException.class, neverStarted::start);
    }

    @Test
    void awaitActiveReturnsFalseAfterShutdown() throws InterruptedException {
        factory.failOpens.set(Integer.MAX_VALUE);
        listener().start();
        listener.shutdown();

        assertFalse(listener.awaitActive(Duration.ofMillis(200)));
    }
}
