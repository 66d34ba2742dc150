package kiln.engine.model;

/**
 * How a task settled, as recorded in the task history.
 */
public enum TaskOutcome {
    /** Handler returned a result */
    COMPLETED,
    /** Handler threw, the type was unknown, or the worker crashed */
    FAILED,
    /** Deadline passed before a result arrived */
    TIMED_OUT
}
