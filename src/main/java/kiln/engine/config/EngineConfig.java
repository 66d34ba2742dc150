package kiln.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Configuration holder for the engine, its HTTP API and the task history store.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Pool settings
    private int maxWorkers = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    private Duration taskTimeout = Duration.ofMillis(30_000);
    private Duration idleTimeout = Duration.ofMillis(60_000);
    private int retryAttempts = 3; // advisory, see DESIGN.md
    private boolean enableMetrics = true;
    private Duration metricsInterval = Duration.ofMillis(5_000);
    private Duration idleCheckInterval = Duration.ofSeconds(10);
    private Duration shutdownGracePeriod = Duration.ofSeconds(5);
    private boolean recycleWorkerOnTimeout = false;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String apiKey = null; // If set, POST endpoints require X-Kiln-Key header

    // History settings
    private boolean historyEnabled = false;
    private String databaseUrl = "jdbc:h2:mem:kiln-history;DB_CLOSE_DELAY=-1";
    private int databasePoolSize = 4;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String maxWorkers = System.getenv("KILN_MAX_WORKERS");
        if (maxWorkers != null && !maxWorkers.isBlank()) {
            config.withMaxWorkers(Integer.parseInt(maxWorkers.trim()));
        }

        String taskTimeout = System.getenv("KILN_TASK_TIMEOUT_MS");
        if (taskTimeout != null && !taskTimeout.isBlank()) {
            config.withTaskTimeout(Duration.ofMillis(Long.parseLong(taskTimeout.trim())));
        }

        String idleTimeout = System.getenv("KILN_IDLE_TIMEOUT_MS");
        if (idleTimeout != null && !idleTimeout.isBlank()) {
            config.withIdleTimeout(Duration.ofMillis(Long.parseLong(idleTimeout.trim())));
        }

        String retryAttempts = System.getenv("KILN_RETRY_ATTEMPTS");
        if (retryAttempts != null && !retryAttempts.isBlank()) {
            config.withRetryAttempts(Integer.parseInt(retryAttempts.trim()));
        }

        String enableMetrics = System.getenv("KILN_ENABLE_METRICS");
        if (enableMetrics != null && !enableMetrics.isBlank()) {
            config.enableMetrics = Boolean.parseBoolean(enableMetrics.trim());
        }

        String port = System.getenv("KILN_PORT");
        if (port != null && !port.isBlank()) {
            config.withServerPort(Integer.parseInt(port.trim()));
        }

        String apiKey = System.getenv("KILN_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        String historyEnabled = System.getenv("KILN_HISTORY_ENABLED");
        if (historyEnabled != null && !historyEnabled.isBlank()) {
            config.historyEnabled = Boolean.parseBoolean(historyEnabled.trim());
        }

        String dbUrl = System.getenv("KILN_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        return config;
    }

    /**
     * Load settings from an INI file with optional [pool], [server] and [history]
     * sections. Missing keys keep their defaults.
     */
    public static EngineConfig fromIni(File file) throws IOException {
        Ini ini = new Ini(file);
        EngineConfig config = new EngineConfig();

        Profile.Section pool = ini.get("pool");
        if (pool != null) {
            String v;
            if ((v = opt(pool, "max_workers")) != null)
                config.withMaxWorkers(Integer.parseInt(v));
            if ((v = opt(pool, "task_timeout_ms")) != null)
                config.withTaskTimeout(Duration.ofMillis(Long.parseLong(v)));
            if ((v = opt(pool, "idle_timeout_ms")) != null)
                config.withIdleTimeout(Duration.ofMillis(Long.parseLong(v)));
            if ((v = opt(pool, "retry_attempts")) != null)
                config.withRetryAttempts(Integer.parseInt(v));
            if ((v = opt(pool, "enable_metrics")) != null)
                config.withMetricsEnabled(Boolean.parseBoolean(v));
            if ((v = opt(pool, "metrics_interval_ms")) != null)
                config.withMetricsInterval(Duration.ofMillis(Long.parseLong(v)));
            if ((v = opt(pool, "idle_check_interval_ms")) != null)
                config.withIdleCheckInterval(Duration.ofMillis(Long.parseLong(v)));
            if ((v = opt(pool, "shutdown_grace_ms")) != null)
                config.withShutdownGracePeriod(Duration.ofMillis(Long.parseLong(v)));
            if ((v = opt(pool, "recycle_worker_on_timeout")) != null)
                config.withRecycleWorkerOnTimeout(Boolean.parseBoolean(v));
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            String v;
            if ((v = opt(server, "host")) != null)
                config.serverHost = v;
            if ((v = opt(server, "port")) != null)
                config.withServerPort(Integer.parseInt(v));
            if ((v = opt(server, "api_key")) != null)
                config.apiKey = v;
        }

        Profile.Section history = ini.get("history");
        if (history != null) {
            String v;
            if ((v = opt(history, "enabled")) != null)
                config.historyEnabled = Boolean.parseBoolean(v);
            if ((v = opt(history, "database_url")) != null)
                config.databaseUrl = v;
            if ((v = opt(history, "pool_size")) != null)
                config.withDatabasePoolSize(Integer.parseInt(v));
        }

        return config;
    }

    // Getters
    public int maxWorkers() {
        return maxWorkers;
    }

    public Duration taskTimeout() {
        return taskTimeout;
    }

    public Duration idleTimeout() {
        return idleTimeout;
    }

    public int retryAttempts() {
        return retryAttempts;
    }

    public boolean metricsEnabled() {
        return enableMetrics;
    }

    public Duration metricsInterval() {
        return metricsInterval;
    }

    public Duration idleCheckInterval() {
        return idleCheckInterval;
    }

    public Duration shutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public boolean recycleWorkerOnTimeout() {
        return recycleWorkerOnTimeout;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean historyEnabled() {
        return historyEnabled;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    // Fluent setters for testing/customization
    public EngineConfig withMaxWorkers(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1");
        }
        this.maxWorkers = maxWorkers;
        return this;
    }

    public EngineConfig withTaskTimeout(Duration timeout) {
        this.taskTimeout = requirePositive(timeout, "taskTimeout");
        return this;
    }

    public EngineConfig withIdleTimeout(Duration timeout) {
        this.idleTimeout = requirePositive(timeout, "idleTimeout");
        return this;
    }

    public EngineConfig withRetryAttempts(int attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("retryAttempts must not be negative");
        }
        this.retryAttempts = attempts;
        return this;
    }

    public EngineConfig withMetricsEnabled(boolean enabled) {
        this.enableMetrics = enabled;
        return this;
    }

    public EngineConfig withMetricsInterval(Duration interval) {
        this.metricsInterval = requirePositive(interval, "metricsInterval");
        return this;
    }

    public EngineConfig withIdleCheckInterval(Duration interval) {
        this.idleCheckInterval = requirePositive(interval, "idleCheckInterval");
        return this;
    }

    public EngineConfig withShutdownGracePeriod(Duration grace) {
        this.shutdownGracePeriod = requirePositive(grace, "shutdownGracePeriod");
        return this;
    }

    /**
     * Drop the worker running a task that timed out and let a fresh worker
     * take the queue. The old worker is only interrupted: a handler that
     * ignores interrupts keeps its thread busy until it returns, so for that
     * long the live worker threads can exceed {@link #maxWorkers()}. Off by
     * default.
     */
    public EngineConfig withRecycleWorkerOnTimeout(boolean recycle) {
        this.recycleWorkerOnTimeout = recycle;
        return this;
    }

    public EngineConfig withServerPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("serverPort out of range: " + port);
        }
        this.serverPort = port;
        return this;
    }

    public EngineConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public EngineConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public EngineConfig withHistoryEnabled(boolean enabled) {
        this.historyEnabled = enabled;
        return this;
    }

    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withDatabasePoolSize(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("databasePoolSize must be at least 1");
        }
        this.databasePoolSize = size;
        return this;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "maxWorkers=" + maxWorkers +
                ", taskTimeout=" + taskTimeout.toMillis() + "ms" +
                ", idleTimeout=" + idleTimeout.toMillis() + "ms" +
                ", retryAttempts=" + retryAttempts +
                ", metrics=" + enableMetrics +
                ", recycleOnTimeout=" + recycleWorkerOnTimeout +
                ", serverPort=" + serverPort +
                ", history=" + historyEnabled +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
