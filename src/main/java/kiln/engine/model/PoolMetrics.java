package kiln.engine.model;

/**
 * Pool-wide aggregates, computed on demand from the per-worker counters.
 * {@code completedTasks} counts every finished task, failed ones included.
 */
public record PoolMetrics(
        int activeWorkers,
        int totalWorkers,
        int queuedTasks,
        int pendingTasks,
        long completedTasks,
        long failedTasks,
        double averageTaskDurationMs,
        double throughputPerSecond,
        long uptimeMs) {
}
