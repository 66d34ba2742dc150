package kiln.engine.exception;

/**
 * The handler ran and threw.
 */
public class TaskExecutionException extends TaskException {

    public TaskExecutionException(String taskId, String message, String workerId, long durationMs, Throwable cause) {
        super(taskId, message, workerId, durationMs, cause);
    }
}
