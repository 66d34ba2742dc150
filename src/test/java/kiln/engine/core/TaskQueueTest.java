package kiln.engine.core;

import kiln.engine.model.Task;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueTest {

    private static Task task(String id, int priority) {
        return Task.builder().id(id).type("echo").priority(priority).build();
    }

    @Test
    void higherPriorityFirstThenSubmissionOrder() {
        TaskQueue queue = new TaskQueue();
        queue.offer(task("a", 0));
        queue.offer(task("b", 0));
        queue.offer(task("c", 5));
        queue.offer(task("d", 0));
        queue.offer(task("e", 5));
        queue.offer(task("f", -1));

        assertEquals(6, queue.size());
        assertEquals("c", queue.poll().id());
        assertEquals("e", queue.poll().id());
        assertEquals("a", queue.poll().id());
        assertEquals("b", queue.poll().id());
        assertEquals("d", queue.poll().id());
        assertEquals("f", queue.poll().id());
        assertNull(queue.poll());
        assertTrue(queue.isEmpty());
        assertEquals(0, queue.size());
    }

    @Test
    void equalPrioritiesStayFifoAcrossInterleavedPolls() {
        TaskQueue queue = new TaskQueue();
        for (int i = 0; i < 20; i++) {
            queue.offer(task("t" + i, 1));
        }
        assertEquals("t0", queue.poll().id());
        queue.offer(task("late", 1));
        for (int i = 1; i < 20; i++) {
            assertEquals("t" + i, queue.poll().id());
        }
        assertEquals("late", queue.poll().id());
    }

    @Test
    void removeMatchesExactInstance() {
        TaskQueue queue = new TaskQueue();
        Task original = task("x", 0);
        Task sameId = task("x", 0);
        queue.offer(original);

        assertFalse(queue.remove(sameId));
        assertEquals(1, queue.size());
        assertTrue(queue.remove(original));
        assertEquals(0, queue.size());
    }

    @Test
    void drainReturnsDispatchOrder() {
        TaskQueue queue = new TaskQueue();
        queue.offer(task("low", 0));
        queue.offer(task("high", 9));
        queue.offer(task("mid", 3));

        assertEquals(3, queue.size());

        List<String> drained = queue.drain().stream().map(Task::id).toList();
        assertEquals(List.of("high", "mid", "low"), drained);
        assertTrue(queue.isEmpty());
    }
}
