package com.p14n.postrelay.data;

import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for a relay adapter: where the shared table lives, how long
 * broadcasts are kept and how the listener reads, backs off and shuts down.
 */
public interface RelayConfig {
    /**
     * Gets the identifier of this instance. Used to name the replication slot
     * owned by this process's change feed.
     *
     * @return The affinity string identifier
     */
    String affinity();

    /**
     * Gets the database host address.
     *
     * @return The database host address
     */
    String dbHost();

    /**
     * Gets the database port number.
     *
     * @return The database port number
     */
    int dbPort();

    /**
     * Gets the database username.
     *
     * @return The database username
     */
    String dbUser();

    /**
     * Gets the database password.
     *
     * @return The database password
     */
    String dbPassword();

    /**
     * Gets the database name.
     *
     * @return The database name
     */
    String dbName();

    /**
     * Gets the schema holding the messages table.
     *
     * @return The schema name
     */
    String schemaName();

    /**
     * Gets the name of the messages table.
     *
     * @return The table name
     */
    String tableName();

    /**
     * Gets how long a broadcast is kept before the expiry sweep removes it.
     *
     * @return The message time-to-live
     */
    Duration expiration();

    /**
     * Gets the backoff delay after the first failure.
     *
     * @return The initial reconnect delay
     */
    Duration reconnectDelay();

    /**
     * Gets the upper bound of the backoff delay.
     *
     * @return The maximum reconnect delay
     */
    Duration maxReconnectDelay();

    /**
     * Gets the pause between polls that returned less than a full batch.
     *
     * @return The poll interval
     */
    Duration pollInterval();

    /**
     * Gets the maximum number of rows fetched per poll.
     *
     * @return The batch limit
     */
    int pollBatchLimit();

    /**
     * Gets the longest a single change feed read may block.
     *
     * @return The read timeout
     */
    Duration readMaxWait();

    /**
     * Whether startup must fail when the server cannot provide a change feed.
     * When false the listener polls until logical replication becomes
     * available.
     *
     * @return true if a change feed is mandatory
     */
    boolean requireChangeFeed();

    /**
     * Whether polling queries are restricted to channels with local
     * subscribers.
     *
     * @return true to filter by channel
     */
    boolean channelFiltering();

    /**
     * Whether a broadcast waits for its commit record to be flushed.
     *
     * @return false to insert with {@code synchronous_commit} off
     */
    boolean synchronousCommit();

    /**
     * Gets the period of the expiry sweep.
     *
     * @return The sweep interval
     */
    Duration expirySweepInterval();

    /**
     * Gets how long shutdown waits for the listener thread before interrupting
     * it.
     *
     * @return The grace period
     */
    Duration shutdownGrace();

    /**
     * Gets additional Debezium properties replacing the generated defaults.
     *
     * @return Properties object containing override values, or null
     */
    Properties overrideProps();

    /**
     * Gets the startup timeout in seconds for the change feed engine.
     * Default is 30 seconds.
     *
     * @return The startup timeout in seconds
     */
    default int startupTimeoutSeconds() {
        return 30;
    }

    /**
     * Constructs the JDBC URL for database connection.
     *
     * @return The complete JDBC URL string
     */
    default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }

    /**
     * The schema-qualified messages table.
     *
     * @return schema.table
     */
    default String qualifiedTableName() {
        return schemaName() + "." + tableName();
    }
}
