package kiln.engine.exception;

/**
 * The worker running the task died before reporting a result.
 */
public class WorkerCrashedException extends TaskException {

    public WorkerCrashedException(String taskId, String workerId, long durationMs, Throwable cause) {
        super(taskId, "Worker " + workerId + " crashed while running task " + taskId
                + (cause != null ? ": " + cause : ""), workerId, durationMs, cause);
    }
}
