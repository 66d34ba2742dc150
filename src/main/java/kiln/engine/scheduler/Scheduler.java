package kiln.engine.scheduler;

import kiln.engine.config.EngineConfig;
import kiln.engine.metrics.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background periodic jobs of the pool:
 * - MetricsCollector: samples pool and worker counters (when metrics are enabled)
 * - IdleWorkerReaper: retires workers idle longer than idleTimeout
 *
 * Runs on its own thread so it never competes with the coordinator loop.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final MetricsCollector metricsCollector;
    private final Runnable idleReaper;
    private final EngineConfig config;

    private volatile boolean running = false;

    /**
     * @param metricsCollector sampler, or null when metrics are disabled
     * @param idleReaper       runnable that retires idle workers
     * @param config           configuration
     */
    public Scheduler(MetricsCollector metricsCollector, Runnable idleReaper, EngineConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "kiln-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.metricsCollector = metricsCollector;
        this.idleReaper = idleReaper;
        this.config = config;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        if (metricsCollector != null) {
            long metricsIntervalMs = config.metricsInterval().toMillis();
            executor.scheduleAtFixedRate(
                    metricsCollector,
                    metricsIntervalMs,
                    metricsIntervalMs,
                    TimeUnit.MILLISECONDS);
            log.info("Metrics sampling every {}ms", metricsIntervalMs);
        }

        long idleCheckMs = config.idleCheckInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("idle-reaper", idleReaper),
                idleCheckMs,
                idleCheckMs,
                TimeUnit.MILLISECONDS);
        log.info("Idle worker reaper scheduled every {}ms", idleCheckMs);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.debug("Scheduler stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
