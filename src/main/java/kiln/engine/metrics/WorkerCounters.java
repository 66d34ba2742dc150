package kiln.engine.metrics;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters for one worker. Written only by the coordinator loop,
 * readable from any thread.
 */
public final class WorkerCounters {

    private final AtomicLong tasksCompleted = new AtomicLong();
    private final AtomicLong tasksSuccessful = new AtomicLong();
    private final AtomicLong tasksFailed = new AtomicLong();
    private final AtomicLong totalDurationMs = new AtomicLong();
    private volatile Instant lastTaskTime;

    /**
     * Record one finished task. Failures count towards {@code tasksCompleted} too.
     */
    public void record(long durationMs, boolean success) {
        totalDurationMs.addAndGet(Math.max(0, durationMs));
        if (success) {
            tasksSuccessful.incrementAndGet();
        } else {
            tasksFailed.incrementAndGet();
        }
        tasksCompleted.incrementAndGet();
        lastTaskTime = Instant.now();
    }

    public long tasksCompleted() {
        return tasksCompleted.get();
    }

    public long tasksSuccessful() {
        return tasksSuccessful.get();
    }

    public long tasksFailed() {
        return tasksFailed.get();
    }

    public long totalDurationMs() {
        return totalDurationMs.get();
    }

    public double averageTaskDurationMs() {
        long completed = tasksCompleted.get();
        return completed == 0 ? 0.0 : (double) totalDurationMs.get() / completed;
    }

    /** Time the last task finished, or null if none has. */
    public Instant lastTaskTime() {
        return lastTaskTime;
    }
}
