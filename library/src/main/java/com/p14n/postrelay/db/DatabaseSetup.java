package com.p14n.postrelay.db;

import com.p14n.postrelay.RelayException;
import com.p14n.postrelay.data.RelayConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static com.p14n.postrelay.db.SQL.checkIdentifier;

public class DatabaseSetup {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseSetup.class);
    private static final String DUPLICATE_OBJECT = "42P07";

    private final DataSource ds;
    private final String schema;
    private final String table;

    public DatabaseSetup(DataSource ds, RelayConfig cfg) {
        this(ds, cfg.schemaName(), cfg.tableName());
    }

    public DatabaseSetup(DataSource ds, String schema, String table) {
        checkIdentifier("Schema", schema);
        checkIdentifier("Table", table);
        this.ds = ds;
        this.schema = schema;
        this.table = table;
    }

    /**
     * Creates the schema, the messages table and its indexes. Safe to run from
     * every process on every start.
     */
    public DatabaseSetup ensureSchema() {
        createSchemaIfNotExists();
        createMessagesTableIfNotExists();
        createExpiryIndex();
        createChannelIndex();
        return this;
    }

    public DatabaseSetup createSchemaIfNotExists() {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            logger.atInfo().log("Schema {} creation completed successfully", schema);

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating schema {}", schema);
            throw new RelayException("Failed to create schema", e);
        }
        return this;
    }

    public DatabaseSetup createMessagesTableIfNotExists() {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement()) {

            String sql = String.format("""
                    CREATE TABLE IF NOT EXISTS %s.%s (
                        id bigint GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                        channel VARCHAR(1024) NOT NULL,
                        payload TEXT,
                        created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT current_timestamp,
                        expires_at TIMESTAMP WITH TIME ZONE NOT NULL,
                        traceparent VARCHAR(255)
                    )""", schema, table);

            stmt.execute(sql);
            logger.atInfo().log("Messages table {}.{} creation completed successfully", schema, table);

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating messages table {}.{}", schema, table);
            throw new RelayException("Failed to create messages table", e);
        }
        return this;
    }

    public DatabaseSetup createExpiryIndex() {
        createIndex(table + "_auto_expire", "expires_at");
        return this;
    }

    public DatabaseSetup createChannelIndex() {
        createIndex(table + "_channel_id", "channel, id");
        return this;
    }

    // Index failures are logged, never thrown
    private void createIndex(String name, String columns) {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute(String.format("CREATE INDEX IF NOT EXISTS %s ON %s.%s (%s)",
                    name, schema, table, columns));
            logger.atDebug().log("Index {} ensured", name);

        } catch (SQLException e) {
            if (DUPLICATE_OBJECT.equals(e.getSQLState())
                    || (e.getMessage() != null && e.getMessage().contains("already exists"))) {
                logger.atDebug().log("Index {} already exists", name);
            } else {
                logger.atWarn().setCause(e).log("Failed to create index {}: {}", name, e.getMessage());
            }
        }
    }

    public static HikariDataSource createPool(RelayConfig cfg) {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(cfg.jdbcUrl());
        ds.setUsername(cfg.dbUser());
        ds.setPassword(cfg.dbPassword());
        ds.setPoolName("postrelay-" + cfg.affinity());
        return ds;
    }
}
