package kiln.engine.metrics;

import kiln.engine.model.PoolMetrics;
import kiln.engine.model.WorkerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Periodic sampler over the pool's counters.
 * Only reads; the counters themselves are maintained by the coordinator as
 * tasks finish.
 */
public class MetricsCollector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    private final MetricsSource source;

    private volatile MetricsSnapshot latest;

    public MetricsCollector(MetricsSource source) {
        this.source = source;
    }

    @Override
    public void run() {
        try {
            sample();
        } catch (Exception e) {
            log.error("Metrics sampling error", e);
        }
    }

    /**
     * Take a sample now and keep it as the latest.
     */
    public MetricsSnapshot sample() {
        PoolMetrics pool = source.poolMetrics();
        List<WorkerMetrics> workers = source.workerMetrics();
        Instant now = Instant.now();

        double window = 0.0;
        MetricsSnapshot previous = latest;
        if (previous != null) {
            long elapsedMs = Duration.between(previous.sampledAt(), now).toMillis();
            long delta = pool.completedTasks() - previous.pool().completedTasks();
            // retired workers take their counters with them, so delta can go negative
            if (elapsedMs > 0 && delta > 0) {
                window = delta * 1000.0 / elapsedMs;
            }
        }

        MetricsSnapshot snapshot = new MetricsSnapshot(now, pool, workers, window);
        latest = snapshot;

        log.debug("Pool: workers {}/{} active, queued={}, pending={}, completed={}, failed={}, avg={}ms, {}/s",
                pool.activeWorkers(), pool.totalWorkers(), pool.queuedTasks(), pool.pendingTasks(),
                pool.completedTasks(), pool.failedTasks(),
                String.format("%.1f", pool.averageTaskDurationMs()),
                String.format("%.2f", window));
        return snapshot;
    }

    public Optional<MetricsSnapshot> latest() {
        return Optional.ofNullable(latest);
    }
}
