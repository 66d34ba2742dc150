package kiln.engine.exception;

/**
 * No handler is registered for the task's type.
 */
public class UnknownTaskTypeException extends TaskException {

    private final String taskType;

    public UnknownTaskTypeException(String taskId, String taskType) {
        super(taskId, "Unknown task type: " + taskType);
        this.taskType = taskType;
    }

    private UnknownTaskTypeException(UnknownTaskTypeException source, String workerId, long durationMs) {
        super(source.taskId(), source.getMessage(), workerId, durationMs, null);
        this.taskType = source.taskType;
    }

    public String taskType() {
        return taskType;
    }

    /** Same error, annotated with where it was detected. */
    public UnknownTaskTypeException reportedBy(String workerId, long durationMs) {
        return new UnknownTaskTypeException(this, workerId, durationMs);
    }
}
