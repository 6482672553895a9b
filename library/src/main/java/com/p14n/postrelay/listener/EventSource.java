package com.p14n.postrelay.listener;

import com.p14n.postrelay.data.BroadcastMessage;
import com.p14n.postrelay.data.ResumePosition;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * A way of discovering newly inserted messages. The listener drives exactly
 * one source at a time and replaces it after any failure.
 */
public interface EventSource extends AutoCloseable {

    enum Mode {
        CHANGE_FEED,
        POLLING
    }

    Mode mode();

    /**
     * Returns the next messages in ascending id order, waiting at most
     * {@code maxWait} (polling sources may also wait their poll interval). An
     * empty list means nothing arrived and is not an error.
     *
     * @param maxWait the longest a change feed read may block
     * @return the messages read, never null
     * @throws SQLException         if a store query fails
     * @throws IOException          if the change feed has failed
     * @throws InterruptedException if the listener thread is interrupted
     */
    List<BroadcastMessage> readBatch(Duration maxWait) throws SQLException, IOException, InterruptedException;

    /**
     * The position after the last message returned by {@link #readBatch}.
     *
     * @return the position, or null if nothing has been read yet
     */
    ResumePosition position();

    /**
     * Whether the listener should close this source and reconnect, because a
     * better source has become available.
     *
     * @return true to switch sources
     */
    default boolean shouldYield() {
        return false;
    }

    /**
     * Releases the source. May be called more than once, from any thread, and
     * never throws.
     */
    @Override
    void close();
}
