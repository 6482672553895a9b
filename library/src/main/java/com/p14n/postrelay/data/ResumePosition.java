package com.p14n.postrelay.data;

/**
 * Where a listener should continue reading after a reconnect. Held in memory
 * only; a restarted process starts from the head of the table again.
 *
 * @param lastId id of the last message handed to the subscriber registry
 * @param lsn    replication log position reported for that message by the
 *               change feed, or null when it was read by polling
 */
public record ResumePosition(long lastId, String lsn) {

    public static ResumePosition afterId(long lastId) {
        return new ResumePosition(lastId, null);
    }

    public ResumePosition advance(BroadcastMessage message, String lsn) {
        if (message.id() <= lastId) {
            return this;
        }
        return new ResumePosition(message.id(), lsn);
    }
}
