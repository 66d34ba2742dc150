package kiln.engine.core;

import kiln.engine.model.Task;
import kiln.engine.model.TaskResult;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Correlates an admitted task with its caller's future and deadline.
 */
final class PendingEntry {

    private final Task task;
    private final CompletableFuture<TaskResult> future;
    private final Instant submittedAt;
    private final Duration timeout;
    private ScheduledFuture<?> timer;

    PendingEntry(Task task, CompletableFuture<TaskResult> future, Instant submittedAt, Duration timeout) {
        this.task = task;
        this.future = future;
        this.submittedAt = submittedAt;
        this.timeout = timeout;
    }

    Task task() {
        return task;
    }

    String taskId() {
        return task.id();
    }

    Instant submittedAt() {
        return submittedAt;
    }

    Duration timeout() {
        return timeout;
    }

    Instant deadline() {
        return submittedAt.plus(timeout);
    }

    void arm(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    void resolve(TaskResult result) {
        disarm();
        future.complete(result);
    }

    void reject(Throwable error) {
        disarm();
        future.completeExceptionally(error);
    }

    private void disarm() {
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
