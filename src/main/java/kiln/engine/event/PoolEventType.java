package kiln.engine.event;

/**
 * Lifecycle events published by the pool.
 */
public enum PoolEventType {
    WORKER_CREATED,
    /** A worker died or could not be created */
    WORKER_ERROR,
    /** A worker left the pool (crash, idle reclamation, recycling or shutdown) */
    WORKER_EXITED,
    TASK_COMPLETED,
    TASK_FAILED,
    TASK_TIMED_OUT,
    SHUTDOWN_STARTED,
    SHUTDOWN_COMPLETED
}
