package kiln.engine.core;

import kiln.engine.exception.TaskTimeoutException;
import kiln.engine.model.Task;
import kiln.engine.model.TaskResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class PendingRegistryTest {

    private static PendingEntry entry(Task task) {
        return new PendingEntry(task, new CompletableFuture<>(), Instant.now(), Duration.ofSeconds(1));
    }

    @Test
    void registerRejectsSameId() {
        PendingRegistry registry = new PendingRegistry();
        assertTrue(registry.register(entry(Task.of("a", "echo", null))));
        assertFalse(registry.register(entry(Task.of("a", "echo", null))));
        assertEquals(1, registry.size());
    }

    @Test
    void removalHappensOnlyOnce() {
        PendingRegistry registry = new PendingRegistry();
        Task task = Task.of("a", "echo", null);
        PendingEntry entry = entry(task);
        registry.register(entry);

        assertSame(entry, registry.removeFor(task));
        assertNull(registry.removeFor(task));
        assertFalse(registry.remove(entry));
        assertEquals(0, registry.size());
    }

    @Test
    void removeForIgnoresNewerEntryWithSameId() {
        PendingRegistry registry = new PendingRegistry();
        Task expired = Task.of("a", "echo", "old");
        Task resubmitted = Task.of("a", "echo", "new");
        registry.register(entry(resubmitted));

        assertNull(registry.removeFor(expired));
        assertTrue(registry.contains("a"));
    }

    @Test
    void settlingIsFirstWins() {
        Task task = Task.of("a", "echo", null);
        PendingEntry entry = entry(task);
        CompletableFuture<TaskResult> future = new CompletableFuture<>();
        PendingEntry tracked = new PendingEntry(task, future, entry.submittedAt(), entry.timeout());

        tracked.reject(new TaskTimeoutException("a", Duration.ofSeconds(1)));
        tracked.resolve(TaskResult.success("a", "late", 5, "worker-1"));

        assertTrue(future.isCompletedExceptionally());
        assertEquals(entry.submittedAt().plusSeconds(1), tracked.deadline());
    }

    @Test
    void drainEmptiesRegistry() {
        PendingRegistry registry = new PendingRegistry();
        registry.register(entry(Task.of("a", "echo", null)));
        registry.register(entry(Task.of("b", "echo", null)));

        List<PendingEntry> drained = registry.drain();
        assertEquals(2, drained.size());
        assertEquals(0, registry.size());
        assertFalse(registry.contains("a"));
    }
}
