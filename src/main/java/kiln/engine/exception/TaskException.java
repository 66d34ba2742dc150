package kiln.engine.exception;

/**
 * Base class for every error a task future can be rejected with.
 * Carries the task id and, when the task reached a worker, the worker id and
 * the time it spent executing.
 */
public abstract class TaskException extends RuntimeException {

    private final String taskId;
    private final String workerId;
    private final long durationMs;

    protected TaskException(String taskId, String message) {
        this(taskId, message, null, 0, null);
    }

    protected TaskException(String taskId, String message, String workerId, long durationMs, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
        this.workerId = workerId;
        this.durationMs = durationMs;
    }

    public String taskId() {
        return taskId;
    }

    /** Worker that ran the task, or null if it never reached one. */
    public String workerId() {
        return workerId;
    }

    public long durationMs() {
        return durationMs;
    }
}
