package kiln.engine.event;

import kiln.engine.model.TaskResult;

import java.time.Instant;

/**
 * One lifecycle event. Fields that do not apply to the event type are null.
 */
public record PoolEvent(
        PoolEventType type,
        String workerId,
        String taskId,
        String taskType,
        TaskResult result,
        String message,
        Instant timestamp) {

    public static PoolEvent worker(PoolEventType type, String workerId, String message) {
        return new PoolEvent(type, workerId, null, null, null, message, Instant.now());
    }

    public static PoolEvent task(PoolEventType type, String taskType, TaskResult result) {
        return new PoolEvent(type, result.workerId(), result.id(), taskType, result, result.error(), Instant.now());
    }

    public static PoolEvent pool(PoolEventType type, String message) {
        return new PoolEvent(type, null, null, null, null, message, Instant.now());
    }
}
