package kiln.engine.service;

import kiln.engine.event.PoolEvent;
import kiln.engine.event.PoolEventType;
import kiln.engine.model.TaskHistoryEntry;
import kiln.engine.model.TaskOutcome;
import kiln.engine.model.TaskResult;
import kiln.engine.repository.TaskHistoryRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskHistoryRecorderTest {

    private static final class InMemoryRepository implements TaskHistoryRepository {
        final List<TaskHistoryEntry> saved = Collections.synchronizedList(new ArrayList<>());
        boolean failing;

        @Override
        public void save(TaskHistoryEntry entry) {
            if (failing) {
                throw new IllegalStateException("disk full");
            }
            saved.add(entry);
        }

        @Override
        public List<TaskHistoryEntry> findRecent(int limit) {
            return List.copyOf(saved);
        }

        @Override
        public List<TaskHistoryEntry> findByTaskId(String taskId) {
            return saved.stream().filter(e -> e.taskId().equals(taskId)).toList();
        }

        @Override
        public Map<TaskOutcome, Integer> countByOutcome() {
            return Map.of();
        }
    }

    private final InMemoryRepository repository = new InMemoryRepository();
    private final TaskHistoryRecorder recorder = new TaskHistoryRecorder(repository);

    @AfterEach
    void tearDown() {
        recorder.close();
    }

    @Test
    void recordsSettledTasksOnly() throws Exception {
        recorder.onEvent(PoolEvent.task(PoolEventType.TASK_COMPLETED, "hash_file",
                TaskResult.success("t1", "abc", 7, "worker-1")));
        recorder.onEvent(PoolEvent.task(PoolEventType.TASK_FAILED, "hash_file",
                TaskResult.failure("t2", "no such file", 3, "worker-2")));
        recorder.onEvent(PoolEvent.task(PoolEventType.TASK_TIMED_OUT, "gate",
                TaskResult.failure("t3", "timed out", 0, null)));
        recorder.onEvent(PoolEvent.worker(PoolEventType.WORKER_CREATED, "worker-1", null));
        recorder.onEvent(PoolEvent.pool(PoolEventType.SHUTDOWN_STARTED, "bye"));

        assertTrue(recorder.flush(5, TimeUnit.SECONDS));

        assertEquals(3, repository.saved.size());
        TaskHistoryEntry completed = repository.saved.get(0);
        assertEquals(TaskOutcome.COMPLETED, completed.outcome());
        assertEquals("worker-1", completed.workerId());
        assertEquals(7, completed.durationMs());
        assertNull(completed.errorMessage());

        TaskHistoryEntry failed = repository.saved.get(1);
        assertEquals(TaskOutcome.FAILED, failed.outcome());
        assertEquals("no such file", failed.errorMessage());

        assertEquals(TaskOutcome.TIMED_OUT, repository.saved.get(2).outcome());
        assertEquals("gate", repository.saved.get(2).taskType());
    }

    @Test
    void repositoryFailureDoesNotStopRecording() throws Exception {
        repository.failing = true;
        recorder.onEvent(PoolEvent.task(PoolEventType.TASK_COMPLETED, "echo", TaskResult.success("t1", 1, 1, "w")));
        assertTrue(recorder.flush(5, TimeUnit.SECONDS));

        repository.failing = false;
        recorder.onEvent(PoolEvent.task(PoolEventType.TASK_COMPLETED, "echo", TaskResult.success("t2", 1, 1, "w")));
        assertTrue(recorder.flush(5, TimeUnit.SECONDS));

        assertEquals(List.of("t2"), repository.saved.stream().map(TaskHistoryEntry::taskId).toList());
    }

    @Test
    void eventsAfterCloseAreDropped() {
        recorder.close();
        assertDoesNotThrow(() -> recorder.onEvent(PoolEvent.task(PoolEventType.TASK_COMPLETED, "echo",
                TaskResult.success("t1", 1, 1, "w"))));
        assertTrue(repository.saved.isEmpty());
    }
}
