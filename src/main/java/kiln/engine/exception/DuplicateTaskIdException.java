package kiln.engine.exception;

/**
 * A task with the same id is still queued or executing.
 */
public class DuplicateTaskIdException extends TaskException {

    public DuplicateTaskIdException(String taskId) {
        super(taskId, "Task id already in flight: " + taskId);
    }
}
