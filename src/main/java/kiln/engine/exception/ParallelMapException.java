package kiln.engine.exception;

/**
 * A parallel map was aborted because one of its items failed.
 * The cause is the error the item's task was rejected with.
 */
public class ParallelMapException extends TaskException {

    private final int itemIndex;

    public ParallelMapException(String taskId, int itemIndex, Throwable cause) {
        super(taskId, "Task failed for item " + itemIndex + ": " + cause.getMessage(),
                workerIdOf(cause), durationOf(cause), cause);
        this.itemIndex = itemIndex;
    }

    public int itemIndex() {
        return itemIndex;
    }

    private static String workerIdOf(Throwable cause) {
        return cause instanceof TaskException ? ((TaskException) cause).workerId() : null;
    }

    private static long durationOf(Throwable cause) {
        return cause instanceof TaskException ? ((TaskException) cause).durationMs() : 0;
    }
}
