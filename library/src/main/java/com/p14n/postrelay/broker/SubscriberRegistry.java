package com.p14n.postrelay.broker;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.postrelay.telemetry.RelayMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel to subscriber mapping for one process.
 *
 * <p>
 * Subscribe and unsubscribe may be called from any thread while the listener
 * thread reads the map on every dispatch. Updates for a channel are applied
 * atomically through {@link ConcurrentHashMap#compute}, and a channel entry
 * exists only while it has at least one subscriber.
 * </p>
 *
 * <p>
 * Subscribers are never called on the thread that calls {@link #notify};
 * every delivery is handed to the callback executor supplied by the host.
 * </p>
 */
public class SubscriberRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SubscriberRegistry.class);

    private final ConcurrentHashMap<String, Set<MessageSubscriber<String>>> channelSubscribers = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Executor callbackExecutor;
    private final RelayMetrics metrics;

    public SubscriberRegistry(Executor callbackExecutor, RelayMetrics metrics) {
        if (callbackExecutor == null) {
            throw new IllegalArgumentException("Callback executor cannot be null");
        }
        this.callbackExecutor = callbackExecutor;
        this.metrics = metrics;
    }

    /**
     * Registers a subscriber.
     *
     * @param channel      the channel to subscribe to
     * @param subscriber   the subscriber to add
     * @param onSubscribed run once, synchronously, after registration; may be
     *                     null
     * @return true if the subscriber was added, false if it was already present
     */
    public boolean addSubscriber(String channel, MessageSubscriber<String> subscriber, Runnable onSubscribed) {
        if (closed.get()) {
            throw new IllegalStateException("Registry is closed");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("Channel cannot be null");
        }

        boolean[] added = new boolean[1];
        boolean[] newChannel = new boolean[1];
        channelSubscribers.compute(channel, (k, subscribers) -> {
            if (subscribers == null) {
                subscribers = new CopyOnWriteArraySet<>();
                newChannel[0] = true;
            }
            added[0] = subscribers.add(subscriber);
            return subscribers;
        });

        if (added[0]) {
            metrics.recordSubscriberAdded(channel, newChannel[0]);
            logger.atDebug()
                    .addArgument(channel)
                    .addArgument(channelSubscribers.size())
                    .log("Subscribed to {} ({} channels)");
        }
        if (onSubscribed != null) {
            onSubscribed.run();
        }
        return added[0];
    }

    /**
     * Removes exactly this subscriber from the channel. Does nothing if it was
     * not registered.
     *
     * @param channel    the channel to unsubscribe from
     * @param subscriber the subscriber to remove
     * @return true if the subscriber was removed
     */
    public boolean removeSubscriber(String channel, MessageSubscriber<String> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("Channel cannot be null");
        }

        boolean[] removed = new boolean[1];
        boolean[] channelGone = new boolean[1];
        channelSubscribers.computeIfPresent(channel, (k, subscribers) -> {
            removed[0] = subscribers.remove(subscriber);
            if (subscribers.isEmpty()) {
                channelGone[0] = true;
                return null;
            }
            return subscribers;
        });

        if (removed[0]) {
            metrics.recordSubscriberRemoved(channel, channelGone[0]);
            logger.atDebug()
                    .addArgument(channel)
                    .addArgument(channelSubscribers.size())
                    .log("Unsubscribed from {} ({} channels)");
        }
        return removed[0];
    }

    /**
     * Hands the payload to every subscriber of the channel through the
     * callback executor. A channel without subscribers is ignored.
     *
     * @param channel the channel the message was broadcast to
     * @param payload the payload
     * @return the number of subscribers the payload was handed to
     */
    public int notify(String channel, String payload) {
        Set<MessageSubscriber<String>> subscribers = channelSubscribers.get(channel);
        if (subscribers == null) {
            return 0;
        }
        int count = 0;
        for (MessageSubscriber<String> subscriber : subscribers) {
            try {
                callbackExecutor.execute(() -> invoke(channel, subscriber, payload));
                count++;
            } catch (RejectedExecutionException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(channel)
                        .log("Callback executor rejected delivery on {}");
            }
        }
        return count;
    }

    private void invoke(String channel, MessageSubscriber<String> subscriber, String payload) {
        try {
            subscriber.onMessage(payload);
        } catch (Exception e) {
            logger.atError()
                    .setCause(e)
                    .addArgument(channel)
                    .log("Subscriber on {} failed to handle message");
            try {
                subscriber.onError(e);
            } catch (Exception onErrorFailure) {
                logger.atWarn()
                        .setCause(onErrorFailure)
                        .addArgument(channel)
                        .log("Subscriber on {} failed in onError");
            }
        }
    }

    public boolean hasSubscribers(String channel) {
        return channelSubscribers.containsKey(channel);
    }

    public int subscriberCount(String channel) {
        Set<MessageSubscriber<String>> subscribers = channelSubscribers.get(channel);
        return subscribers == null ? 0 : subscribers.size();
    }

    public int channelCount() {
        return channelSubscribers.size();
    }

    /**
     * @return a snapshot of the channels that currently have subscribers
     */
    public Set<String> channels() {
        return Set.copyOf(channelSubscribers.keySet());
    }

    @Override
    public void close() {
        closed.set(true);
        channelSubscribers.clear();
    }
}
