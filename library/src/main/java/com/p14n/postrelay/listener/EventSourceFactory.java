package com.p14n.postrelay.listener;

import com.p14n.postrelay.data.ResumePosition;

import java.io.IOException;
import java.sql.SQLException;

/**
 * Creates the event source for each connection attempt.
 */
public interface EventSourceFactory {

    /**
     * Whether the store can currently provide a change feed. Asked before every
     * connection attempt.
     *
     * @return true if a change feed can be opened
     */
    boolean changeFeedSupported();

    /**
     * Opens a source of the requested mode.
     *
     * @param mode     the kind of source to open
     * @param resume   where the previous source left off, or null on the first
     *                 connection
     * @param shutdown fires when the listener shuts down; sources wait on it
     *                 instead of sleeping
     * @return an open source
     * @throws IOException          if the change feed cannot be started
     * @throws SQLException         if the store cannot be queried
     * @throws InterruptedException if interrupted while opening
     */
    EventSource open(EventSource.Mode mode, ResumePosition resume, ShutdownSignal shutdown)
            throws IOException, SQLException, InterruptedException;
}
