package kiln.engine.metrics;

import kiln.engine.model.PoolMetrics;
import kiln.engine.model.WorkerMetrics;

import java.util.List;

/**
 * Read-only view the collector samples from.
 */
public interface MetricsSource {

    PoolMetrics poolMetrics();

    List<WorkerMetrics> workerMetrics();
}
