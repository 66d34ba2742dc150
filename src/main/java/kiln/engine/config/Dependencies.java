package kiln.engine.config;

import kiln.engine.api.v1.HealthController;
import kiln.engine.api.v1.HistoryController;
import kiln.engine.api.v1.MetricsController;
import kiln.engine.api.v1.TaskController;
import kiln.engine.core.PoolCoordinator;
import kiln.engine.event.PoolEventBus;
import kiln.engine.handler.TaskHandlerRegistry;
import kiln.engine.repository.TaskHistoryRepository;
import kiln.engine.server.EngineHttpServer;
import kiln.engine.server.RouterHandler;
import kiln.engine.service.FileTaskService;
import kiln.engine.service.TaskHistoryRecorder;
import kiln.engine.store.Database;
import kiln.engine.store.JdbcTaskHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the pool, its services and the HTTP API.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.httpServer().start();
 * FileTaskService files = deps.fileTaskService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final PoolEventBus events;
    private final TaskHandlerRegistry handlers;
    private final PoolCoordinator pool;
    private final FileTaskService fileTaskService;

    // History (only when enabled)
    private final Database database;
    private final TaskHistoryRepository historyRepository;
    private final TaskHistoryRecorder historyRecorder;

    // Controllers
    private final HealthController healthController;
    private final MetricsController metricsController;
    private final TaskController taskController;
    private final HistoryController historyController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private EngineHttpServer httpServer;

    private Dependencies(EngineConfig config, TaskHandlerRegistry handlers) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.events = new PoolEventBus();
        this.handlers = handlers;

        if (config.historyEnabled()) {
            this.database = new Database(config);
            this.historyRepository = new JdbcTaskHistoryRepository(database);
            this.historyRecorder = new TaskHistoryRecorder(historyRepository);
            events.subscribe(historyRecorder);
        } else {
            this.database = null;
            this.historyRepository = null;
            this.historyRecorder = null;
        }

        this.pool = new PoolCoordinator(config, handlers, events);
        this.fileTaskService = new FileTaskService(pool);

        this.healthController = new HealthController(pool);
        this.metricsController = new MetricsController(pool);
        this.taskController = new TaskController(pool);
        this.historyController = historyRepository != null ? new HistoryController(historyRepository) : null;

        log.info("Dependencies initialized with handlers {}", handlers.types());
    }

    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, TaskHandlerRegistry.defaults());
    }

    /**
     * Create dependencies with a custom handler set.
     */
    public static Dependencies create(EngineConfig config, TaskHandlerRegistry handlers) {
        return new Dependencies(config, handlers);
    }

    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    public EngineConfig config() {
        return config;
    }

    public PoolEventBus events() {
        return events;
    }

    public TaskHandlerRegistry handlers() {
        return handlers;
    }

    public PoolCoordinator pool() {
        return pool;
    }

    public FileTaskService fileTaskService() {
        return fileTaskService;
    }

    /** Null when history is disabled. */
    public TaskHistoryRepository historyRepository() {
        return historyRepository;
    }

    /** Null when history is disabled. */
    public TaskHistoryRecorder historyRecorder() {
        return historyRecorder;
    }

    /** Null when history is disabled. */
    public Database database() {
        return database;
    }

    public HealthController healthController() {
        return healthController;
    }

    public MetricsController metricsController() {
        return metricsController;
    }

    public TaskController taskController() {
        return taskController;
    }

    /**
     * RouterHandler with every controller registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(metricsController)
                    .registerController(taskController);
            if (historyController != null) {
                routerHandler.registerController(historyController);
            }
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * HTTP server bound to the configured host and port; not started.
     */
    public synchronized EngineHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new EngineHttpServer(config.serverHost(), config.serverPort(), routerHandler());
        }
        return httpServer;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (httpServer != null) {
            try {
                httpServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        try {
            pool.shutdown();
        } catch (Exception e) {
            log.warn("Error shutting down worker pool: {}", e.getMessage());
        }

        if (historyRecorder != null) {
            historyRecorder.close();
        }
        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
