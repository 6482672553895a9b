package com.p14n.postrelay.db;

import com.p14n.postrelay.data.BroadcastMessage;
import com.p14n.postrelay.data.RelayConfig;
import com.p14n.postrelay.data.ResumePosition;
import com.p14n.postrelay.debezium.DebeziumServer;
import com.p14n.postrelay.listener.ChangeFeedReader;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Operations against the shared messages table.
 *
 * <p>
 * Holds no mutable state of its own; every call borrows a connection from the
 * pool, so a single instance can be used by any number of broadcasting
 * threads and by the listener at the same time.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * MessageStore store = new MessageStore(dataSource, config);
 * long id = store.insert("chat", "hello world", null);
 * List<BroadcastMessage> newer = store.queryAfter(id - 1, 100);
 * }</pre>
 */
public class MessageStore {

    private static final Logger logger = LoggerFactory.getLogger(MessageStore.class);

    private final DataSource ds;
    private final RelayConfig cfg;
    private final String table;

    public MessageStore(DataSource ds, RelayConfig cfg) {
        SQL.checkIdentifier("Schema", cfg.schemaName());
        SQL.checkIdentifier("Table", cfg.tableName());
        this.ds = ds;
        this.cfg = cfg;
        this.table = cfg.qualifiedTableName();
    }

    /**
     * Inserts a broadcast. The expiry time is computed from the database clock
     * so that it agrees with {@link #deleteExpired()}.
     *
     * @param channel     the channel to broadcast to
     * @param payload     the opaque payload
     * @param traceparent the broadcaster's trace context, may be null
     * @return the store-assigned id
     * @throws SQLException if the insert was not acknowledged
     */
    public long insert(String channel, String payload, String traceparent) throws SQLException {
        if (channel == null || channel.isEmpty()) {
            throw new IllegalArgumentException("Channel cannot be null or empty");
        }
        String sql = String.format(
                "INSERT INTO %s (channel, payload, created_at, expires_at, traceparent) "
                        + "VALUES (?, ?, now(), now() + (? * interval '1 millisecond'), ?) RETURNING id",
                table);

        try (Connection conn = ds.getConnection()) {
            if (cfg.synchronousCommit()) {
                return executeInsert(conn, sql, channel, payload, traceparent);
            }
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("SET LOCAL synchronous_commit TO OFF");
                long id = executeInsert(conn, sql, channel, payload, traceparent);
                conn.commit();
                return id;
            } catch (SQLException e) {
                SQL.handleSQLException(e, conn);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        }
    }

    private long executeInsert(Connection conn, String sql, String channel, String payload, String traceparent)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, channel);
            stmt.setString(2, payload);
            stmt.setLong(3, cfg.expiration().toMillis());
            stmt.setString(4, traceparent);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Insert into " + table + " returned no id");
                }
                return rs.getLong(1);
            }
        }
    }

    public List<BroadcastMessage> queryAfter(long cursor, int limit) throws SQLException {
        return queryAfter(cursor, limit, null);
    }

    /**
     * Fetches messages with an id greater than {@code cursor}, ascending.
     *
     * @param cursor   the last id already seen
     * @param limit    maximum rows to return
     * @param channels restricts the result to these channels when not null
     * @return the messages in id order
     * @throws SQLException if the query fails
     */
    public List<BroadcastMessage> queryAfter(long cursor, int limit, Collection<String> channels)
            throws SQLException {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be greater than zero");
        }
        String filter = channels == null ? "" : " AND channel = ANY(?)";
        String sql = String.format("SELECT %s FROM %s WHERE id > ?%s ORDER BY id LIMIT ?",
                SQL.COLS, table, filter);

        List<BroadcastMessage> messages = new ArrayList<>();
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            int i = 1;
            stmt.setLong(i++, cursor);
            if (channels != null) {
                Array array = conn.createArrayOf("varchar", channels.toArray());
                stmt.setArray(i++, array);
            }
            stmt.setInt(i, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    messages.add(SQL.messageFromResultSet(rs));
                }
            }
        }
        logger.atTrace().log("Fetched {} messages after {}", messages.size(), cursor);
        return messages;
    }

    /**
     * The highest id currently in the table.
     *
     * @return the latest id, or 0 if the table is empty
     * @throws SQLException if the query fails
     */
    public long latestId() throws SQLException {
        String sql = String.format("SELECT MAX(id) FROM %s", table);
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql);
                ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return rs.getLong(1);
            }
            return 0;
        }
    }

    /**
     * Whether the server can feed inserts through logical replication.
     * Failures of the check itself count as "no".
     *
     * @return true if {@code wal_level} is {@code logical}
     */
    public boolean supportsChangeFeed() {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SHOW wal_level")) {
            return rs.next() && "logical".equalsIgnoreCase(rs.getString(1));
        } catch (SQLException e) {
            logger.atWarn()
                    .addArgument(e.getClass().getSimpleName())
                    .addArgument(e.getMessage())
                    .log("Unable to check replication status ({}): {}");
            return false;
        }
    }

    /**
     * Removes every message whose expiry time has passed.
     *
     * @return the number of rows removed
     * @throws SQLException if the delete fails
     */
    public int deleteExpired() throws SQLException {
        String sql = String.format("DELETE FROM %s WHERE expires_at <= now()", table);
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            return stmt.executeUpdate();
        }
    }

    /**
     * Starts a change feed on the messages table.
     *
     * @param resumeFrom position to catch up from, or null to start at the
     *                   current end of the log
     * @return an open feed
     * @throws IOException          if the engine fails to start
     * @throws InterruptedException if interrupted while waiting for startup
     * @throws SQLException         if the catch-up query fails
     */
    public ChangeFeedReader openChangeFeed(ResumePosition resumeFrom)
            throws IOException, InterruptedException, SQLException {
        return ChangeFeedReader.open(this, cfg, new DebeziumServer(), resumeFrom);
    }

    public RelayConfig config() {
        return cfg;
    }
}
