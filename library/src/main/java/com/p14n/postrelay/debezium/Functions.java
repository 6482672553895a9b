package com.p14n.postrelay.debezium;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.postrelay.data.BroadcastMessage;
import io.debezium.engine.ChangeEvent;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Converts Debezium change events into {@link InsertEvent}s.
 *
 * <p>
 * The JSON value is expected to carry the standard envelope, either wrapped
 * in a {@code schema}/{@code payload} pair or bare:
 * </p>
 * <ul>
 * <li>payload.op - operation code, only {@code c} is kept</li>
 * <li>payload.after - the inserted row</li>
 * <li>payload.source.lsn - log position of the change</li>
 * </ul>
 */
public class Functions {

    private Functions() {
    }

    private final static ObjectMapper mapper = new ObjectMapper();

    private static String safeText(JsonNode j) {
        if (j != null && !j.isNull()) {
            return j.asText();
        }
        return null;
    }

    private static Instant safeInstant(JsonNode j) {
        String text = safeText(j);
        if (text == null) {
            return null;
        }
        if (j.isNumber()) {
            // io.debezium.time.MicroTimestamp style values
            return Instant.EPOCH.plusNanos(j.asLong() * 1000L);
        }
        return OffsetDateTime.parse(text).toInstant();
    }

    /**
     * Converts a change event into an insert, or null for anything else
     * (updates, deletes, tombstones, heartbeats).
     *
     * @param record the change event from the engine
     * @return the decoded insert, or null
     * @throws IOException if the value is not valid JSON
     */
    public static InsertEvent changeEventToInsert(ChangeEvent<String, String> record) throws IOException {
        if (record == null || record.value() == null) {
            return null;
        }
        return valueToInsert(record.value());
    }

    static InsertEvent valueToInsert(String value) throws IOException {
        var root = mapper.readTree(value);
        var payload = root.has("schema") && root.has("payload") ? root.get("payload") : root;
        if (payload == null || payload.isNull()) {
            return null;
        }
        var op = safeText(payload.get("op"));
        var r = payload.get("after");
        if (!"c".equals(op) || r == null || r.isNull()) {
            return null;
        }
        var source = payload.get("source");
        var lsn = source != null ? safeText(source.get("lsn")) : null;
        var message = BroadcastMessage.create(
                r.get("id").asLong(),
                safeText(r.get("channel")),
                safeText(r.get("payload")),
                safeInstant(r.get("created_at")),
                safeInstant(r.get("expires_at")),
                safeText(r.get("traceparent")));
        return new InsertEvent(message, lsn);
    }
}
