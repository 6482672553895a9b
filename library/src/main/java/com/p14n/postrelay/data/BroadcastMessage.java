package com.p14n.postrelay.data;

import java.time.Instant;

/**
 * A broadcast persisted in the messages table. Rows are never updated; they
 * are read by every listener and removed only once {@code expiresAt} has
 * passed.
 */
public record BroadcastMessage(long id,
        String channel,
        String payload,
        Instant createdAt,
        Instant expiresAt,
        String traceparent) implements Traceable {

    /**
     * Creates a message read back from the store.
     *
     * @throws IllegalArgumentException if the channel is null or empty
     */
    public static BroadcastMessage create(long id, String channel, String payload, Instant createdAt,
            Instant expiresAt, String traceparent) {
        if (channel == null || channel.isEmpty()) {
            throw new IllegalArgumentException("channel cannot be null or empty");
        }
        return new BroadcastMessage(id, channel, payload, createdAt, expiresAt, traceparent);
    }

    public int payloadSize() {
        return payload == null ? 0 : payload.length();
    }
}
