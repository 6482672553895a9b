package com.p14n.postrelay;

/**
 * Thrown at startup when a change feed is mandatory but the server is not
 * running with {@code wal_level = logical}.
 */
public class ChangeFeedRequiredException extends RelayException {

    public ChangeFeedRequiredException() {
        super("PostgreSQL logical replication (wal_level=logical) is required for the change feed");
    }

    public ChangeFeedRequiredException(String message) {
        super(message);
    }
}
