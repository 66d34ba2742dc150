package kiln.engine.exception;

import java.time.Duration;

/**
 * The task's deadline passed before a result arrived.
 */
public class TaskTimeoutException extends TaskException {

    private final Duration timeout;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super(taskId, "Task " + taskId + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
