package kiln.engine.model;

import kiln.engine.exception.TaskException;

/**
 * Outcome of one task execution.
 * {@code result} is set only on success, {@code error} only on failure.
 * {@code durationMs} counts execution time on the worker, not time spent queued.
 */
public record TaskResult(
        String id,
        boolean success,
        Object result,
        String error,
        long durationMs,
        String workerId) {

    public static TaskResult success(String id, Object result, long durationMs, String workerId) {
        return new TaskResult(id, true, result, null, durationMs, workerId);
    }

    public static TaskResult failure(String id, String error, long durationMs, String workerId) {
        return new TaskResult(id, false, null, error, durationMs, workerId);
    }

    /**
     * Failure result built from the exception a task future was rejected with.
     * Duration and worker id are kept when the exception knows them.
     */
    public static TaskResult failure(String id, Throwable error) {
        if (error instanceof TaskException te) {
            return new TaskResult(id, false, null, te.getMessage(), te.durationMs(), te.workerId());
        }
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        return new TaskResult(id, false, null, message, 0, null);
    }
}
