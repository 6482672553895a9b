package com.p14n.postrelay.db;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes expired broadcasts. PostgreSQL has no TTL index, so
 * this sweep is the table's expiry mechanism; nothing else deletes rows.
 */
public class ExpiryReaper implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExpiryReaper.class);

    private final MessageStore store;
    private final Duration interval;
    private ScheduledExecutorService executor;

    public ExpiryReaper(MessageStore store, Duration interval) {
        this.store = store;
        this.interval = interval;
    }

    public synchronized ExpiryReaper start() {
        if (executor != null) {
            throw new IllegalStateException("Already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("postrelay-expiry-%d").setDaemon(true).build());
        long millis = interval.toMillis();
        executor.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        logger.atDebug().log("Expiry sweep scheduled every {} ms", millis);
        return this;
    }

    /**
     * Runs one sweep. Failures are logged and left for the next run.
     *
     * @return rows deleted, or -1 if the sweep failed
     */
    public int sweep() {
        try {
            int deleted = store.deleteExpired();
            if (deleted > 0) {
                logger.atDebug().log("Deleted {} expired messages", deleted);
            }
            return deleted;
        } catch (Exception e) {
            logger.atWarn().setCause(e).log("Expiry sweep failed");
            return -1;
        }
    }

    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }
}
