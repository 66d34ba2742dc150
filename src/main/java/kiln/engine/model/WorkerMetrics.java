package kiln.engine.model;

import java.time.Instant;

/**
 * Point-in-time view of one worker's counters.
 */
public record WorkerMetrics(
        String workerId,
        boolean active,
        String currentTaskId,
        long tasksCompleted,
        long tasksSuccessful,
        long tasksFailed,
        long totalDurationMs,
        double averageTaskDurationMs,
        Instant lastTaskTime) {
}
