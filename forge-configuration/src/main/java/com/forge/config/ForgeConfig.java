package com.forge.config;

import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the Forge workflow worker.
 * <p>
 * DB (run ledger): FORGE_DB_HOST, FORGE_DB_PORT, FORGE_DB_NAME, FORGE_DB_USER, FORGE_DB_PASSWORD;
 * persistence is enabled with FORGE_RUN_LEDGER. Workflow files: FORGE_WORKFLOW_DIR.
 * Events: FORGE_CACHE_HOST, FORGE_CACHE_PORT, FORGE_EVENTS_ENABLED, FORGE_EVENTS_CHANNEL.
 * Execution: FORGE_GROUP_PARALLELISM, FORGE_FAIL_ON_NODE_ERROR.
 */
public final class ForgeConfig {

    static final String ENV_DB_HOST = "FORGE_DB_HOST";
    static final String ENV_DB_PORT = "FORGE_DB_PORT";
    static final String ENV_DB_NAME = "FORGE_DB_NAME";
    static final String ENV_DB_USER = "FORGE_DB_USER";
    static final String ENV_DB_PASSWORD = "FORGE_DB_PASSWORD";
    static final String ENV_RUN_LEDGER = "FORGE_RUN_LEDGER";
    static final String ENV_WORKFLOW_DIR = "FORGE_WORKFLOW_DIR";
    static final String ENV_CACHE_HOST = "FORGE_CACHE_HOST";
    static final String ENV_CACHE_PORT = "FORGE_CACHE_PORT";
    static final String ENV_EVENTS_ENABLED = "FORGE_EVENTS_ENABLED";
    static final String ENV_EVENTS_CHANNEL = "FORGE_EVENTS_CHANNEL";
    static final String ENV_GROUP_PARALLELISM = "FORGE_GROUP_PARALLELISM";
    static final String ENV_FAIL_ON_NODE_ERROR = "FORGE_FAIL_ON_NODE_ERROR";

    /** Default false: without a database the worker keeps executions in memory. */
    private static final boolean DEFAULT_RUN_LEDGER = false;
    private static final String DEFAULT_DB_NAME = "forge";
    private static final String DEFAULT_DB_USER = "forge";
    private static final String DEFAULT_WORKFLOW_DIR = "workflows";
    private static final String DEFAULT_EVENTS_CHANNEL = "forge:workflow:events";
    private static final boolean DEFAULT_FAIL_ON_NODE_ERROR = false;

    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;
    private final boolean runLedgerEnabled;
    private final String workflowDir;
    private final String cacheHost;
    private final int cachePort;
    private final boolean eventsEnabled;
    private final String eventsChannel;
    private final int groupParallelism;
    private final boolean failOnNodeError;

    private ForgeConfig(Builder b) {
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName != null ? b.dbName : DEFAULT_DB_NAME;
        this.dbUser = b.dbUser != null ? b.dbUser : DEFAULT_DB_USER;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.runLedgerEnabled = b.runLedgerEnabled;
        this.workflowDir = b.workflowDir;
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.eventsEnabled = b.eventsEnabled;
        this.eventsChannel = b.eventsChannel;
        this.groupParallelism = b.groupParallelism > 0 ? b.groupParallelism : defaultParallelism();
        this.failOnNodeError = b.failOnNodeError;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    /** Database name for the run ledger (FORGE_DB_NAME). Default "forge". */
    public String getDbName() {
        return dbName;
    }

    /** Database user for the run ledger (FORGE_DB_USER). Default "forge". */
    public String getDbUser() {
        return dbUser;
    }

    /** Database password for the run ledger (FORGE_DB_PASSWORD). Default "". */
    public String getDbPassword() {
        return dbPassword;
    }

    /** JDBC URL built from host, port and database name. */
    public String getJdbcUrl() {
        return "jdbc:postgresql://" + dbHost + ":" + dbPort + "/" + dbName;
    }

    /**
     * Whether the run ledger is enabled (FORGE_RUN_LEDGER). When true, workflows, executions and
     * node logs are read from / written to PostgreSQL; otherwise in-memory stores are used.
     */
    public boolean isRunLedgerEnabled() {
        return runLedgerEnabled;
    }

    /** Directory holding {@code <workflowId>.json} files (FORGE_WORKFLOW_DIR). Default {@code workflows}. */
    public String getWorkflowDir() {
        return workflowDir;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /** Whether lifecycle events are also published to Redis (FORGE_EVENTS_ENABLED). */
    public boolean isEventsEnabled() {
        return eventsEnabled;
    }

    /** Redis pub/sub channel for lifecycle events. Default {@code forge:workflow:events}. */
    public String getEventsChannel() {
        return eventsChannel;
    }

    /** Worker threads used to run the members of one parallel group. Default: available processors. */
    public int getGroupParallelism() {
        return groupParallelism;
    }

    /**
     * When true, a failed node result turns into an orchestration fault after its group completes
     * and the execution is marked failed. Default false: node failures stay inside the result.
     */
    public boolean isFailOnNodeError() {
        return failOnNodeError;
    }

    public static ForgeConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reads from the given map (tests, embedded use). */
    public static ForgeConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .dbHost(get(env, ENV_DB_HOST, "localhost"))
                .dbPort(parseInt(env.get(ENV_DB_PORT), 5432))
                .dbName(get(env, ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(get(env, ENV_DB_USER, DEFAULT_DB_USER))
                .dbPassword(get(env, ENV_DB_PASSWORD, ""))
                .runLedgerEnabled(parseBoolean(env.get(ENV_RUN_LEDGER), DEFAULT_RUN_LEDGER))
                .workflowDir(get(env, ENV_WORKFLOW_DIR, DEFAULT_WORKFLOW_DIR))
                .cacheHost(get(env, ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(env.get(ENV_CACHE_PORT), 6379))
                .eventsEnabled(parseBoolean(env.get(ENV_EVENTS_ENABLED), false))
                .eventsChannel(get(env, ENV_EVENTS_CHANNEL, DEFAULT_EVENTS_CHANNEL))
                .groupParallelism(parseInt(env.get(ENV_GROUP_PARALLELISM), 0))
                .failOnNodeError(parseBoolean(env.get(ENV_FAIL_ON_NODE_ERROR), DEFAULT_FAIL_ON_NODE_ERROR))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int defaultParallelism() {
        return Math.max(2, Runtime.getRuntime().availableProcessors());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String dbHost = "localhost";
        private int dbPort = 5432;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private boolean runLedgerEnabled = DEFAULT_RUN_LEDGER;
        private String workflowDir = DEFAULT_WORKFLOW_DIR;
        private String cacheHost = "localhost";
        private int cachePort = 6379;
        private boolean eventsEnabled;
        private String eventsChannel = DEFAULT_EVENTS_CHANNEL;
        private int groupParallelism;
        private boolean failOnNodeError = DEFAULT_FAIL_ON_NODE_ERROR;

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder runLedgerEnabled(boolean runLedgerEnabled) {
            this.runLedgerEnabled = runLedgerEnabled;
            return this;
        }

        public Builder workflowDir(String workflowDir) {
            this.workflowDir = workflowDir != null ? workflowDir : DEFAULT_WORKFLOW_DIR;
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder eventsEnabled(boolean eventsEnabled) {
            this.eventsEnabled = eventsEnabled;
            return this;
        }

        public Builder eventsChannel(String eventsChannel) {
            this.eventsChannel = eventsChannel != null ? eventsChannel : DEFAULT_EVENTS_CHANNEL;
            return this;
        }

        /** Values below 1 select the default (available processors, at least 2). */
        public Builder groupParallelism(int groupParallelism) {
            this.groupParallelism = groupParallelism;
            return this;
        }

        public Builder failOnNodeError(boolean failOnNodeError) {
            this.failOnNodeError = failOnNodeError;
            return this;
        }

        public ForgeConfig build() {
            return new ForgeConfig(this);
        }
    }
}
