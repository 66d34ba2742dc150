package kiln.engine.exception;

/**
 * The pool is shutting down: the task was rejected at submission or dropped
 * from the queue or pending registry during the drain.
 */
public class PoolShuttingDownException extends TaskException {

    public PoolShuttingDownException(String taskId) {
        super(taskId, "Worker pool is shutting down");
    }
}
