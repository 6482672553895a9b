package com.p14n.postrelay.debezium;

import com.p14n.postrelay.data.BroadcastMessage;

/**
 * A message decoded from a change event together with the log position it
 * was read at.
 */
public record InsertEvent(BroadcastMessage message, String lsn) {
}
