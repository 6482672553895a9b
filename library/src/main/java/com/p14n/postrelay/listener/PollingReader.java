package com.p14n.postrelay.listener;

import com.p14n.postrelay.broker.SubscriberRegistry;
import com.p14n.postrelay.data.BroadcastMessage;
import com.p14n.postrelay.data.RelayConfig;
import com.p14n.postrelay.data.ResumePosition;
import com.p14n.postrelay.db.MessageStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Discovers new messages with ascending range queries when logical
 * replication is not available.
 *
 * <p>
 * The cursor starts at the newest id in the table when the reader is opened,
 * so older history is never replayed, and then follows the last id returned.
 * A full batch is followed immediately by another query; a short one by a
 * pause of the poll interval. Before every query the reader checks whether a
 * change feed has become available and, if so, asks the listener to switch.
 * </p>
 */
public class PollingReader implements EventSource {

    private static final Logger logger = LoggerFactory.getLogger(PollingReader.class);

    private final MessageStore store;
    private final RelayConfig cfg;
    private final SubscriberRegistry registry;
    private final ShutdownSignal shutdown;
    private long cursor;
    private boolean lastBatchFull = true;
    private boolean yield = false;
    private ResumePosition position;

    PollingReader(MessageStore store, RelayConfig cfg, SubscriberRegistry registry, ShutdownSignal shutdown,
            long cursor) {
        this.store = store;
        this.cfg = cfg;
        this.registry = registry;
        this.shutdown = shutdown;
        this.cursor = cursor;
        this.position = ResumePosition.afterId(cursor);
    }

    /**
     * Opens a reader positioned after {@code resume}, or after the newest
     * message when there is nothing to resume from.
     */
    public static PollingReader open(MessageStore store, RelayConfig cfg, SubscriberRegistry registry,
            ShutdownSignal shutdown, ResumePosition resume) throws SQLException {
        long start = resume != null ? resume.lastId() : store.latestId();
        logger.atDebug().log("Polling from id {}", start);
        return new PollingReader(store, cfg, registry, shutdown, start);
    }

    @Override
    public Mode mode() {
        return Mode.POLLING;
    }

    @Override
    public List<BroadcastMessage> readBatch(Duration maxWait) throws SQLException, InterruptedException {
        if (!lastBatchFull && shutdown.await(cfg.pollInterval())) {
            return List.of();
        }
        if (store.supportsChangeFeed()) {
            logger.atInfo().log("Logical replication is now available; leaving polling mode");
            yield = true;
            return List.of();
        }

        Collection<String> channels = null;
        if (cfg.channelFiltering()) {
            Set<String> subscribed = registry.channels();
            if (subscribed.isEmpty()) {
                // Nothing to deliver; keep the cursor at the head so a later
                // subscriber does not receive older messages
                cursor = Math.max(cursor, store.latestId());
                position = ResumePosition.afterId(cursor);
                lastBatchFull = false;
                return List.of();
            }
            channels = subscribed;
        }

        List<BroadcastMessage> messages = store.queryAfter(cursor, cfg.pollBatchLimit(), channels);
        if (!messages.isEmpty()) {
            cursor = messages.get(messages.size() - 1).id();
            position = ResumePosition.afterId(cursor);
        }
        lastBatchFull = messages.size() >= cfg.pollBatchLimit();
        return messages;
    }

    @Override
    public ResumePosition position() {
        return position;
    }

    @Override
    public boolean shouldYield() {
        return yield;
    }

    long cursor() {
        return cursor;
    }

    @Override
    public void close() {
    }
}
