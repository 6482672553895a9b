package com.p14n.postrelay.listener;

import com.p14n.postrelay.data.BroadcastMessage;
import com.p14n.postrelay.data.ConfigData;
import com.p14n.postrelay.data.ResumePosition;
import com.p14n.postrelay.db.MessageStore;
import com.p14n.postrelay.debezium.DebeziumServer;

import io.debezium.engine.ChangeEvent;
import io.debezium.engine.Header;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Exercises the reader without an engine: events and completions are pushed
 * in the way the engine thread would.
 */
class ChangeFeedStreamTest {

    private static final Duration WAIT = Duration.ofMillis(50);
    private static final Instant CREATED = Instant.parse("2024-05-01T10:15:30Z");

    private final ConfigData cfg = ConfigData.builder("stream", "localhost", 5432, "postgres", "postgres",
            "postgres").build();
    private final ChangeFeedReader reader = new ChangeFeedReader(cfg, new DebeziumServer(),
            ResumePosition.afterId(1));

    @AfterEach
    void close() {
        reader.close();
    }

    private static ChangeEvent<String, String> insert(long id) {
        String value = """
                {"schema":{},"payload":{
                  "before":null,
                  "after":{"id":%d,"channel":"chat","payload":"m%d",
                           "created_at":"2024-05-01T10:15:30Z",
                           "expires_at":"2024-05-01T10:20:30Z",
                           "traceparent":null},
                  "source":{"lsn":%d,"table":"broadcast_messages"},
                  "op":"c"}}
                """.formatted(id, id, 1000 + id);
        return new ChangeEvent<>() {
            @Override
            public String key() {
                return null;
            }

            @Override
            public String value() {
                return value;
            }

            @Override
            public <H> List<Header<H>> headers() {
                return List.of();
            }

            @Override
            public String destination() {
                return "postrelay.postrelay.broadcast_messages";
            }

            @Override
            public Integer partition() {
                return null;
            }
        };
    }

    private static BroadcastMessage stored(long id) {
        return BroadcastMessage.create(id, "chat", "m" + id, CREATED, CREATED.plusSeconds(300), null);
    }

    private static List<Long> ids(List<BroadcastMessage> batch) {
        List<Long> ids = new ArrayList<>();
        for (BroadcastMessage m : batch) {
            ids.add(m.id());
        }
        return ids;
    }

    @Test
    void engineFailureKillsReader() {
        reader.onCompletion(false, "boom", null);

        IOException first = assertThrows(IOException.class, () -> reader.readBatch(WAIT));
        assertTrue(first.getMessage().contains("boom"));
        assertThrows(IOException.class, () -> reader.readBatch(WAIT));
    }

    @Test
    void engineErrorIsReportedAsCause() {
        var cause = new IllegalStateException("slot dropped");
        reader.onCompletion(false, "connector stopped", cause);

        IOException e = assertThrows(IOException.class, () -> reader.readBatch(WAIT));
        assertSame(cause, e.getCause());
    }

    @Test
    void failureWinsOverQueuedEvents() {
        reader.accept(insert(2));
        reader.onCompletion(false, "boom", null);

        assertThrows(IOException.class, () -> reader.readBatch(WAIT));
    }

    @Test
    void cleanStopAlsoEndsReader() {
        reader.onCompletion(true, null, null);

        assertThrows(IOException.class, () -> reader.readBatch(WAIT));
    }

    @Test
    void closedReaderIgnoresCompletion() throws Exception {
        reader.close();
        reader.onCompletion(false, "stopping", null);

        assertTrue(reader.readBatch(WAIT).isEmpty());
    }

    @Test
    void streamEventsForCaughtUpRowsAreDropped() throws Exception {
        MessageStore store = mock(MessageStore.class);
        when(store.queryAfter(anyLong(), anyInt())).thenReturn(List.of(stored(2), stored(3)));
        reader.catchUp(store, 1);

        // id 3 committed while the slot was being created, so it arrives twice
        reader.accept(insert(3));
        reader.accept(insert(4));

        assertEquals(List.of(2L, 3L), ids(reader.readBatch(WAIT)));
        assertEquals(List.of(4L), ids(reader.readBatch(WAIT)));
        assertTrue(reader.readBatch(WAIT).isEmpty());
        assertEquals(4, reader.position().lastId());
        assertEquals("1004", reader.position().lsn());
    }

    @Test
    void catchUpPagesUntilShortBatch() throws Exception {
        var small = cfg.toBuilder().pollBatchLimit(2).build();
        var paged = new ChangeFeedReader(small, new DebeziumServer(), ResumePosition.afterId(1));
        MessageStore store = mock(MessageStore.class);
        when(store.queryAfter(1, 2)).thenReturn(List.of(stored(2), stored(3)));
        when(store.queryAfter(3, 2)).thenReturn(List.of(stored(4)));

        paged.catchUp(store, 1);

        assertEquals(List.of(2L, 3L), ids(paged.readBatch(WAIT)));
        assertEquals(List.of(4L), ids(paged.readBatch(WAIT)));
        assertEquals(4, paged.position().lastId());
        paged.close();
    }
}
