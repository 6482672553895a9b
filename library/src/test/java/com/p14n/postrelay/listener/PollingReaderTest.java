package com.p14n.postrelay.listener;

import com.p14n.postrelay.broker.SubscriberRegistry;
import com.p14n.postrelay.data.BroadcastMessage;
import com.p14n.postrelay.data.ConfigData;
import com.p14n.postrelay.data.ResumePosition;
import com.p14n.postrelay.db.DatabaseSetup;
import com.p14n.postrelay.db.MessageStore;
import com.p14n.postrelay.telemetry.RelayMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class PollingReaderTest {

    private static final Duration WAIT = Duration.ofMillis(100);
    private static final AtomicInteger tables = new AtomicInteger();
    private static EmbeddedPostgres pg;

    private ConfigData cfg;
    private MessageStore store;
    private SubscriberRegistry registry;
    private ShutdownSignal shutdown;

    @BeforeAll
    static void startDatabase() throws IOException {
        pg = EmbeddedPostgres.start();
    }

    @AfterAll
    static void stopDatabase() throws IOException {
        if (pg != null) {
            pg.close();
        }
    }

    @BeforeEach
    void setUp() {
        useConfig(config().build());
        registry = new SubscriberRegistry(Runnable::run, new RelayMetrics(OpenTelemetry.noop().getMeter("test")));
        shutdown = new ShutdownSignal();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private ConfigData.Builder config() {
        return ConfigData.builder("poll", "localhost", pg.getPort(), "postgres", "postgres", "postgres")
                .tableName("polled_" + tables.incrementAndGet())
                .pollInterval(Duration.ofMillis(10))
                .pollBatchLimit(3);
    }

    private void useConfig(ConfigData c) {
        cfg = c;
        new DatabaseSetup(pg.getPostgresDatabase(), cfg).ensureSchema();
        store = new MessageStore(pg.getPostgresDatabase(), cfg);
    }

    private static List<String> payloads(List<BroadcastMessage> messages) {
        return messages.stream().map(BroadcastMessage::payload).toList();
    }

    @Test
    void startsAfterExistingMessages() throws SQLException, InterruptedException {
        store.insert("chat", "before1", null);
        store.insert("chat", "before2", null);

        PollingReader reader = PollingReader.open(store, cfg, registry, shutdown, null);
        store.insert("chat", "after", null);

        assertEquals(List.of("after"), payloads(reader.readBatch(WAIT)));
        assertEquals(EventSource.Mode.POLLING, reader.mode());
        assertFalse(reader.shouldYield());
    }

    @Test
    void resumesFromPosition() throws SQLException, InterruptedException {
        long first = store.insert("chat", "one", null);
        store.insert("chat", "two", null);
        store.insert("chat", "three", null);

        PollingReader reader = PollingReader.open(store, cfg, registry, shutdown, ResumePosition.afterId(first));

        assertEquals(List.of("two", "three"), payloads(reader.readBatch(WAIT)));
    }

    @Test
    void drainsBacklogInBatchesWithoutGapsOrRepeats() throws SQLException, InterruptedException {
        PollingReader reader = PollingReader.open(store, cfg, registry, shutdown, null);
        List<Long> inserted = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            inserted.add(store.insert("chat", "m" + i, null));
        }

        List<Long> seen = new ArrayList<>();
        List<BroadcastMessage> batch;
        do {
            batch = reader.readBatch(WAIT);
            assertTrue(batch.size() <= cfg.pollBatchLimit());
            batch.forEach(m -> seen.add(m.id()));
        } while (!batch.isEmpty());

        assertEquals(inserted, seen);
        assertEquals(inserted.get(6), reader.cursor());
        assertEquals(inserted.get(6), reader.position().lastId());
    }

    @Test
    void messagesInsertedBetweenPollsAreNotSkipped() throws SQLException, InterruptedException {
        PollingReader reader = PollingReader.open(store, cfg, registry, shutdown, null);
        long a = store.insert("chat", "a", null);
        assertEquals(List.of("a"), payloads(reader.readBatch(WAIT)));

        long b = store.insert("chat", "b", null);
        List<BroadcastMessage> next = reader.readBatch(WAIT);
        assertEquals(List.of("b"), payloads(next));
        assertTrue(b > a);
        assertTrue(reader.readBatch(WAIT).isEmpty());
    }

    @Test
    void channelFilteringSkipsUnsubscribedChannels() throws SQLException, InterruptedException {
        useConfig(config().channelFiltering(true).build());
        PollingReader reader = PollingReader.open(store, cfg, registry, shutdown, null);

        store.insert("a", "ignored while nobody listens", null);
        assertTrue(reader.readBatch(WAIT).isEmpty());

        registry.addSubscriber("a", m -> {
        }, null);
        store.insert("a", "wanted", null);
        store.insert("b", "unwanted", null);

        assertEquals(List.of("wanted"), payloads(reader.readBatch(WAIT)));
    }

    @Test
    void shutdownInterruptsPollWait() throws SQLException, InterruptedException {
        useConfig(config().pollInterval(Duration.ofSeconds(20)).build());
        PollingReader reader = PollingReader.open(store, cfg, registry, shutdown, null);
        assertTrue(reader.readBatch(WAIT).isEmpty());

        shutdown.fire();
        long start = System.nanoTime();
        assertTrue(reader.readBatch(WAIT).isEmpty());
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
    }
}
