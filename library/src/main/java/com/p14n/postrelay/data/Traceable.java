package com.p14n.postrelay.data;

/**
 * Interface for messages that carry a distributed trace context across
 * processes.
 *
 * <p>
 * Key attributes:
 * </p>
 * <ul>
 * <li>{@code id}: store-assigned identifier of the message</li>
 * <li>{@code channel}: the broadcast group the message belongs to</li>
 * <li>{@code traceparent}: W3C trace context of the broadcasting process</li>
 * </ul>
 */
public interface Traceable {

    /**
     * Returns the store-assigned identifier.
     *
     * @return the identifier
     */
    long id();

    /**
     * Returns the channel the message was broadcast to.
     *
     * @return the channel name
     */
    String channel();

    /**
     * Returns the trace parent captured when the message was broadcast, or null
     * if none was active.
     *
     * @return the trace parent string
     */
    String traceparent();
}
