package kiln.engine.core;

/**
 * Message a worker thread posts to the coordinator loop.
 * {@code result} is set for {@link Kind#TASK_COMPLETED}, {@code failure} for
 * {@link Kind#TASK_FAILED} and {@link Kind#WORKER_CRASHED}.
 */
record WorkerMessage(
        Kind kind,
        String workerId,
        String taskId,
        Object result,
        Throwable failure,
        long durationMs) {

    enum Kind {
        TASK_COMPLETED,
        TASK_FAILED,
        WORKER_CRASHED,
        WORKER_EXITED
    }

    static WorkerMessage completed(String workerId, String taskId, Object result, long durationMs) {
        return new WorkerMessage(Kind.TASK_COMPLETED, workerId, taskId, result, null, durationMs);
    }

    static WorkerMessage failed(String workerId, String taskId, Exception error, long durationMs) {
        return new WorkerMessage(Kind.TASK_FAILED, workerId, taskId, null, error, durationMs);
    }

    static WorkerMessage crashed(String workerId, String taskId, Throwable error, long durationMs) {
        return new WorkerMessage(Kind.WORKER_CRASHED, workerId, taskId, null, error, durationMs);
    }

    static WorkerMessage exited(String workerId) {
        return new WorkerMessage(Kind.WORKER_EXITED, workerId, null, null, null, 0);
    }
}
