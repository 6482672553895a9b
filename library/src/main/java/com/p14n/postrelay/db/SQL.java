package com.p14n.postrelay.db;

import com.p14n.postrelay.data.BroadcastMessage;

import java.sql.*;

public class SQL {

    public static final String COLS = "id, channel, payload, created_at, expires_at, traceparent";

    public static BroadcastMessage messageFromResultSet(ResultSet rs) throws SQLException {
        return BroadcastMessage.create(
                rs.getLong("id"),
                rs.getString("channel"),
                rs.getString("payload"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("expires_at")),
                rs.getString("traceparent"));
    }

    private static java.time.Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    public static void handleSQLException(SQLException e, Connection conn) {
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    conn.rollback();
                }
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
        }
    }

    public static void checkIdentifier(String kind, String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException(kind + " name cannot be null or empty");
        }
        if (!name.matches("^[A-Za-z_][A-Za-z0-9_]*$")) {
            throw new IllegalArgumentException(kind + " name is not a valid SQL identifier");
        }
    }

}
