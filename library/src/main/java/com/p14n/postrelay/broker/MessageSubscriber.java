package com.p14n.postrelay.broker;

/**
 * Receives payloads broadcast to a channel.
 * Subscribers are matched by identity when unsubscribing, so keep the
 * reference that was passed to subscribe.
 *
 * @param <T> The type of messages this subscriber handles
 */
@FunctionalInterface
public interface MessageSubscriber<T> {

    /**
     * Called on the host callback context for every message on the channel.
     *
     * @param message The message to process
     */
    void onMessage(T message);

    /**
     * Called on the host callback context when {@link #onMessage} threw.
     *
     * @param error The error that occurred
     */
    default void onError(Throwable error) {
    }
}
