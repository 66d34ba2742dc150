package kiln.engine.metrics;

import kiln.engine.model.PoolMetrics;
import kiln.engine.model.WorkerMetrics;

import java.time.Instant;
import java.util.List;

/**
 * One periodic sample. {@code windowThroughputPerSecond} covers only the time
 * since the previous sample, unlike the lifetime figure in {@code pool}.
 */
public record MetricsSnapshot(
        Instant sampledAt,
        PoolMetrics pool,
        List<WorkerMetrics> workers,
        double windowThroughputPerSecond) {
}
