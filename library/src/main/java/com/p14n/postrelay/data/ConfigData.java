package com.p14n.postrelay.data;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

public record ConfigData(String affinity,
        String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        String schemaName,
        String tableName,
        Duration expiration,
        Duration reconnectDelay,
        Duration maxReconnectDelay,
        Duration pollInterval,
        int pollBatchLimit,
        Duration readMaxWait,
        boolean requireChangeFeed,
        boolean channelFiltering,
        boolean synchronousCommit,
        Duration expirySweepInterval,
        Duration shutdownGrace,
        Properties overrideProps) implements RelayConfig {

    public static final String DEFAULT_SCHEMA = "postrelay";
    public static final String DEFAULT_TABLE = "broadcast_messages";

    public ConfigData {
        if (pollBatchLimit <= 0) {
            throw new IllegalArgumentException("pollBatchLimit must be greater than zero");
        }
        if (reconnectDelay.isNegative() || reconnectDelay.isZero()) {
            throw new IllegalArgumentException("reconnectDelay must be positive");
        }
        if (maxReconnectDelay.compareTo(reconnectDelay) < 0) {
            throw new IllegalArgumentException("maxReconnectDelay must not be less than reconnectDelay");
        }
    }

    public ConfigData(String affinity,
            String dbHost,
            int dbPort,
            String dbUser,
            String dbPassword,
            String dbName) {
        this(affinity, dbHost, dbPort, dbUser, dbPassword, dbName, DEFAULT_SCHEMA, DEFAULT_TABLE,
                Duration.ofSeconds(300), Duration.ofSeconds(1), Duration.ofSeconds(60), Duration.ofMillis(500), 200,
                Duration.ofSeconds(1), false, false, true, Duration.ofSeconds(60), Duration.ofSeconds(5), null);
    }

    public static Builder builder(String affinity, String dbHost, int dbPort, String dbUser, String dbPassword,
            String dbName) {
        return new Builder(affinity, dbHost, dbPort, dbUser, dbPassword, dbName);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Reads a configuration from {@code RELAY_*} variables. Only the database
     * variables are required; everything else falls back to the defaults.
     *
     * @param env usually {@code System.getenv()}
     * @return the configuration
     */
    public static ConfigData fromEnvironment(Map<String, String> env) {
        String affinity = env.getOrDefault("RELAY_AFFINITY", randomAffinity());
        Builder b = builder(affinity,
                required(env, "RELAY_DB_HOST"),
                Integer.parseInt(env.getOrDefault("RELAY_DB_PORT", "5432")),
                required(env, "RELAY_DB_USER"),
                required(env, "RELAY_DB_PASSWORD"),
                required(env, "RELAY_DB_NAME"));
        if (env.containsKey("RELAY_SCHEMA")) {
            b.schemaName(env.get("RELAY_SCHEMA"));
        }
        if (env.containsKey("RELAY_TABLE")) {
            b.tableName(env.get("RELAY_TABLE"));
        }
        if (env.containsKey("RELAY_EXPIRATION_SECONDS")) {
            b.expiration(Duration.ofSeconds(Long.parseLong(env.get("RELAY_EXPIRATION_SECONDS"))));
        }
        if (env.containsKey("RELAY_RECONNECT_DELAY_MS")) {
            b.reconnectDelay(Duration.ofMillis(Long.parseLong(env.get("RELAY_RECONNECT_DELAY_MS"))));
        }
        if (env.containsKey("RELAY_MAX_RECONNECT_DELAY_MS")) {
            b.maxReconnectDelay(Duration.ofMillis(Long.parseLong(env.get("RELAY_MAX_RECONNECT_DELAY_MS"))));
        }
        if (env.containsKey("RELAY_POLL_INTERVAL_MS")) {
            b.pollInterval(Duration.ofMillis(Long.parseLong(env.get("RELAY_POLL_INTERVAL_MS"))));
        }
        if (env.containsKey("RELAY_POLL_BATCH_LIMIT")) {
            b.pollBatchLimit(Integer.parseInt(env.get("RELAY_POLL_BATCH_LIMIT")));
        }
        if (env.containsKey("RELAY_REQUIRE_CHANGE_FEED")) {
            b.requireChangeFeed(Boolean.parseBoolean(env.get("RELAY_REQUIRE_CHANGE_FEED")));
        }
        if (env.containsKey("RELAY_CHANNEL_FILTERING")) {
            b.channelFiltering(Boolean.parseBoolean(env.get("RELAY_CHANNEL_FILTERING")));
        }
        if (env.containsKey("RELAY_SYNCHRONOUS_COMMIT")) {
            b.synchronousCommit(Boolean.parseBoolean(env.get("RELAY_SYNCHRONOUS_COMMIT")));
        }
        return b.build();
    }

    public static String randomAffinity() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private static String required(Map<String, String> env, String key) {
        String v = env.get(key);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException(key + " must be set");
        }
        return v;
    }

    public static final class Builder {
        private final String affinity;
        private final String dbHost;
        private final int dbPort;
        private final String dbUser;
        private final String dbPassword;
        private final String dbName;
        private String schemaName = DEFAULT_SCHEMA;
        private String tableName = DEFAULT_TABLE;
        private Duration expiration = Duration.ofSeconds(300);
        private Duration reconnectDelay = Duration.ofSeconds(1);
        private Duration maxReconnectDelay = Duration.ofSeconds(60);
        private Duration pollInterval = Duration.ofMillis(500);
        private int pollBatchLimit = 200;
        private Duration readMaxWait = Duration.ofSeconds(1);
        private boolean requireChangeFeed = false;
        private boolean channelFiltering = false;
        private boolean synchronousCommit = true;
        private Duration expirySweepInterval = Duration.ofSeconds(60);
        private Duration shutdownGrace = Duration.ofSeconds(5);
        private Properties overrideProps;

        private Builder(String affinity, String dbHost, int dbPort, String dbUser, String dbPassword,
                String dbName) {
            this.affinity = affinity;
            this.dbHost = dbHost;
            this.dbPort = dbPort;
            this.dbUser = dbUser;
            this.dbPassword = dbPassword;
            this.dbName = dbName;
        }

        private Builder(ConfigData c) {
            this(c.affinity, c.dbHost, c.dbPort, c.dbUser, c.dbPassword, c.dbName);
            this.schemaName = c.schemaName;
            this.tableName = c.tableName;
            this.expiration = c.expiration;
            this.reconnectDelay = c.reconnectDelay;
            this.maxReconnectDelay = c.maxReconnectDelay;
            this.pollInterval = c.pollInterval;
            this.pollBatchLimit = c.pollBatchLimit;
            this.readMaxWait = c.readMaxWait;
            this.requireChangeFeed = c.requireChangeFeed;
            this.channelFiltering = c.channelFiltering;
            this.synchronousCommit = c.synchronousCommit;
            this.expirySweepInterval = c.expirySweepInterval;
            this.shutdownGrace = c.shutdownGrace;
            this.overrideProps = c.overrideProps;
        }

        public Builder schemaName(String schemaName) {
            this.schemaName = schemaName;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder expiration(Duration expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder reconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
            return this;
        }

        public Builder maxReconnectDelay(Duration maxReconnectDelay) {
            this.maxReconnectDelay = maxReconnectDelay;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder pollBatchLimit(int pollBatchLimit) {
            this.pollBatchLimit = pollBatchLimit;
            return this;
        }

        public Builder readMaxWait(Duration readMaxWait) {
            this.readMaxWait = readMaxWait;
            return this;
        }

        public Builder requireChangeFeed(boolean requireChangeFeed) {
            this.requireChangeFeed = requireChangeFeed;
            return this;
        }

        public Builder channelFiltering(boolean channelFiltering) {
            this.channelFiltering = channelFiltering;
            return this;
        }

        public Builder synchronousCommit(boolean synchronousCommit) {
            this.synchronousCommit = synchronousCommit;
            return this;
        }

        public Builder expirySweepInterval(Duration expirySweepInterval) {
            this.expirySweepInterval = expirySweepInterval;
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder overrideProps(Properties overrideProps) {
            this.overrideProps = overrideProps;
            return this;
        }

        public ConfigData build() {
            return new ConfigData(affinity, dbHost, dbPort, dbUser, dbPassword, dbName, schemaName, tableName,
                    expiration, reconnectDelay, maxReconnectDelay, pollInterval, pollBatchLimit, readMaxWait,
                    requireChangeFeed, channelFiltering, synchronousCommit, expirySweepInterval, shutdownGrace,
                    overrideProps);
        }
    }
}
