package kiln.engine.service;

import kiln.engine.event.PoolEvent;
import kiln.engine.event.PoolEventListener;
import kiln.engine.model.TaskHistoryEntry;
import kiln.engine.model.TaskOutcome;
import kiln.engine.repository.TaskHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Event listener that writes every settled task to the history repository.
 * Inserts run on a dedicated thread so the publisher never waits on JDBC.
 */
public class TaskHistoryRecorder implements PoolEventListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskHistoryRecorder.class);

    private final TaskHistoryRepository repository;
    private final ExecutorService writer;

    public TaskHistoryRecorder(TaskHistoryRepository repository) {
        this.repository = repository;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "kiln-history");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void onEvent(PoolEvent event) {
        TaskOutcome outcome = switch (event.type()) {
            case TASK_COMPLETED -> TaskOutcome.COMPLETED;
            case TASK_FAILED -> TaskOutcome.FAILED;
            case TASK_TIMED_OUT -> TaskOutcome.TIMED_OUT;
            default -> null;
        };
        if (outcome == null) {
            return;
        }

        TaskHistoryEntry entry = new TaskHistoryEntry(
                event.taskId(),
                event.taskType(),
                outcome,
                event.workerId(),
                event.result() != null ? event.result().durationMs() : 0,
                event.result() != null ? event.result().error() : event.message(),
                event.timestamp() != null ? event.timestamp() : Instant.now());

        try {
            writer.execute(() -> write(entry));
        } catch (RejectedExecutionException e) {
            log.warn("History recorder closed, dropping {} for task {}", outcome, entry.taskId());
        }
    }

    private void write(TaskHistoryEntry entry) {
        try {
            repository.save(entry);
        } catch (RuntimeException e) {
            log.error("Failed to record history for task {}", entry.taskId(), e);
        }
    }

    /**
     * Wait until every entry handed over so far has been written.
     */
    public boolean flush(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            writer.submit(() -> { }).get(timeout, unit);
            return true;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("History flush did not complete: {}", e.toString());
            return false;
        }
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
                log.warn("History recorder forcefully stopped");
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
