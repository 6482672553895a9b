package com.p14n.postrelay;

import com.p14n.postrelay.broker.MessageSubscriber;

/**
 * The contract a host pub/sub framework uses to fan messages out across
 * processes.
 */
public interface SubscriptionAdapter {

    /**
     * Persists a message so that every listening process delivers it to its
     * local subscribers of {@code channel}.
     *
     * @param channel the channel to broadcast on
     * @param payload the message body
     * @return true if the message was stored, false if the broadcast failed
     */
    boolean broadcast(String channel, String payload);

    /**
     * Registers a subscriber for a channel and starts listening if this is the
     * first use.
     *
     * @param channel      the channel to subscribe to
     * @param subscriber   receives each payload broadcast to the channel
     * @param onSubscribed run once, synchronously, after registration; may be
     *                     null
     */
    void subscribe(String channel, MessageSubscriber<String> subscriber, Runnable onSubscribed);

    default void subscribe(String channel, MessageSubscriber<String> subscriber) {
        subscribe(channel, subscriber, null);
    }

    /**
     * Removes exactly this subscriber from the channel. Does nothing if it was
     * not registered.
     */
    void unsubscribe(String channel, MessageSubscriber<String> subscriber);

    /**
     * Stops listening and releases background threads. Safe to call more than
     * once.
     */
    void shutdown();
}
