package kiln.engine.core;

import kiln.engine.metrics.WorkerCounters;
import kiln.engine.model.Task;
import kiln.engine.model.WorkerMetrics;

import java.time.Instant;

/**
 * Coordinator-side record of one pool member. Mutated only on the loop; the
 * volatile fields let metrics readers see a consistent enough view.
 */
final class WorkerInfo {

    private final Worker worker;
    private final WorkerCounters counters = new WorkerCounters();
    private final Instant createdAt = Instant.now();

    private volatile boolean active = false;
    private volatile Task currentTask;
    private volatile Instant lastUsed = createdAt;

    WorkerInfo(Worker worker) {
        this.worker = worker;
    }

    String id() {
        return worker.id();
    }

    Worker worker() {
        return worker;
    }

    WorkerCounters counters() {
        return counters;
    }

    boolean active() {
        return active;
    }

    Task currentTask() {
        return currentTask;
    }

    Instant lastUsed() {
        return lastUsed;
    }

    void bind(Task task) {
        this.currentTask = task;
        this.active = true;
    }

    /**
     * Mark idle and return the task that was bound, if any.
     */
    Task release() {
        Task task = currentTask;
        currentTask = null;
        active = false;
        lastUsed = Instant.now();
        return task;
    }

    boolean isRunning(Task task) {
        return active && currentTask == task;
    }

    WorkerMetrics toMetrics() {
        Task task = currentTask;
        return new WorkerMetrics(
                id(),
                active,
                task != null ? task.id() : null,
                counters.tasksCompleted(),
                counters.tasksSuccessful(),
                counters.tasksFailed(),
                counters.totalDurationMs(),
                counters.averageTaskDurationMs(),
                counters.lastTaskTime());
    }
}
