package com.p14n.postrelay.listener;

import com.p14n.postrelay.data.BroadcastMessage;
import com.p14n.postrelay.data.RelayConfig;
import com.p14n.postrelay.data.ResumePosition;
import com.p14n.postrelay.db.MessageStore;
import com.p14n.postrelay.debezium.DebeziumServer;
import com.p14n.postrelay.debezium.InsertEvent;

import io.debezium.engine.ChangeEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.p14n.postrelay.debezium.Functions.changeEventToInsert;

/**
 * Streams inserts on the messages table from a Debezium engine.
 *
 * <p>
 * The engine thread decodes change events and queues them; the listener
 * thread takes them with a bounded wait. A reader is single use: once the
 * engine reports a failure every further read throws and the listener opens a
 * new reader.
 * </p>
 *
 * <p>
 * A new replication slot only sees changes made after it was created, so a
 * reader opened with a resume position first queries the table for anything
 * newer than that position and serves those rows ahead of the stream. Stream
 * events for rows already served that way are dropped.
 * </p>
 */
public class ChangeFeedReader implements EventSource {

    private static final Logger logger = LoggerFactory.getLogger(ChangeFeedReader.class);
    private static final int QUEUE_CAPACITY = 10_000;
    private static final long OFFER_WAIT_MS = 100;

    private final RelayConfig cfg;
    private final DebeziumServer server;
    private final BlockingQueue<InsertEvent> queue = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final Deque<BroadcastMessage> catchup = new ArrayDeque<>();
    private final Set<Long> caughtUpIds = new HashSet<>();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ResumePosition position;

    ChangeFeedReader(RelayConfig cfg, DebeziumServer server, ResumePosition resumeFrom) {
        this.cfg = cfg;
        this.server = server;
        this.position = resumeFrom;
    }

    /**
     * Starts the engine and, when resuming, loads the rows inserted since
     * {@code resumeFrom}.
     */
    public static ChangeFeedReader open(MessageStore store, RelayConfig cfg, DebeziumServer server,
            ResumePosition resumeFrom) throws IOException, InterruptedException, SQLException {
        ChangeFeedReader reader = new ChangeFeedReader(cfg, server, resumeFrom);
        server.start(cfg, reader::accept, reader::onCompletion);
        if (resumeFrom != null) {
            try {
                reader.catchUp(store, resumeFrom.lastId());
            } catch (SQLException | RuntimeException e) {
                reader.close();
                throw e;
            }
        }
        return reader;
    }

    void catchUp(MessageStore store, long after) throws SQLException {
        int limit = cfg.pollBatchLimit();
        long cursor = after;
        List<BroadcastMessage> batch;
        do {
            batch = store.queryAfter(cursor, limit);
            for (BroadcastMessage m : batch) {
                catchup.add(m);
                caughtUpIds.add(m.id());
                cursor = m.id();
            }
        } while (batch.size() >= limit);
        if (!catchup.isEmpty()) {
            logger.atInfo()
                    .addArgument(catchup.size())
                    .addArgument(after)
                    .log("Caught up {} messages after id {}");
        }
    }

    // Runs on the Debezium engine thread
    void accept(ChangeEvent<String, String> record) {
        InsertEvent insert;
        try {
            insert = changeEventToInsert(record);
        } catch (Exception e) {
            logger.atError().setCause(e).log("Failed to decode change event");
            return;
        }
        if (insert == null) {
            return;
        }
        try {
            while (!closed.get()) {
                if (queue.offer(insert, OFFER_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // Runs on the Debezium engine thread when the engine stops
    void onCompletion(boolean success, String message, Throwable error) {
        if (closed.get()) {
            return;
        }
        Throwable cause = error != null ? error
                : new IOException("Change feed stopped" + (message != null ? ": " + message : ""));
        failure.compareAndSet(null, cause);
        if (!success) {
            logger.atWarn().log("Change feed engine failed: {}", message);
        }
    }

    @Override
    public Mode mode() {
        return Mode.CHANGE_FEED;
    }

    @Override
    public List<BroadcastMessage> readBatch(Duration maxWait) throws IOException, InterruptedException {
        checkFailure();
        int limit = cfg.pollBatchLimit();
        List<BroadcastMessage> out = new ArrayList<>();
        while (!catchup.isEmpty() && out.size() < limit) {
            serve(out, catchup.poll(), null);
        }
        if (!out.isEmpty()) {
            return out;
        }

        InsertEvent first = queue.poll(maxWait.toNanos(), TimeUnit.NANOSECONDS);
        if (first == null) {
            checkFailure();
            return out;
        }
        List<InsertEvent> events = new ArrayList<>();
        events.add(first);
        queue.drainTo(events, limit - 1);
        for (InsertEvent e : events) {
            if (caughtUpIds.remove(e.message().id())) {
                continue;
            }
            serve(out, e.message(), e.lsn());
        }
        return out;
    }

    private void serve(List<BroadcastMessage> out, BroadcastMessage message, String lsn) {
        out.add(message);
        position = position == null ? new ResumePosition(message.id(), lsn) : position.advance(message, lsn);
    }

    private void checkFailure() throws IOException {
        Throwable t = failure.get();
        if (t != null) {
            if (t instanceof IOException) {
                throw (IOException) t;
            }
            throw new IOException("Change feed failed: " + t.getMessage(), t);
        }
    }

    @Override
    public ResumePosition position() {
        return position;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            server.stop();
        } catch (Exception e) {
            logger.atDebug()
                    .addArgument(e.getClass().getSimpleName())
                    .addArgument(e.getMessage())
                    .log("Change feed close warning ({}): {}");
        }
        queue.clear();
    }
}
