package com.p14n.postrelay.listener;

import com.p14n.postrelay.broker.SubscriberRegistry;
import com.p14n.postrelay.data.RelayConfig;
import com.p14n.postrelay.data.ResumePosition;
import com.p14n.postrelay.db.MessageStore;

import java.io.IOException;
import java.sql.SQLException;

/**
 * Opens change feed or polling readers against the message store.
 */
public class StoreEventSourceFactory implements EventSourceFactory {

    private final MessageStore store;
    private final RelayConfig cfg;
    private final SubscriberRegistry registry;

    public StoreEventSourceFactory(MessageStore store, SubscriberRegistry registry) {
        this.store = store;
        this.cfg = store.config();
        this.registry = registry;
    }

    @Override
    public boolean changeFeedSupported() {
        return store.supportsChangeFeed();
    }

    @Override
    public EventSource open(EventSource.Mode mode, ResumePosition resume, ShutdownSignal shutdown)
            throws IOException, SQLException, InterruptedException {
        if (mode == EventSource.Mode.CHANGE_FEED) {
            return store.openChangeFeed(resume);
        }
        return PollingReader.open(store, cfg, registry, shutdown, resume);
    }
}
