package kiln.engine.model;

import java.time.Instant;

/**
 * One settled task as stored by the history recorder.
 */
public record TaskHistoryEntry(
        String taskId,
        String taskType,
        TaskOutcome outcome,
        String workerId,
        long durationMs,
        String errorMessage,
        Instant finishedAt) {
}
