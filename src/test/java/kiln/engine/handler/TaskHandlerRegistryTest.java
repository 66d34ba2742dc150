package kiln.engine.handler;

import kiln.engine.exception.UnknownTaskTypeException;
import kiln.engine.model.Task;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskHandlerRegistryTest {

    record Pair(int a, int b) {
    }

    @Test
    void defaultsRegisterFileHandlers() {
        TaskHandlerRegistry registry = TaskHandlerRegistry.defaults();
        assertEquals(List.of("hash_file", "compress_file", "analyze_code", "search_in_file"),
                List.copyOf(registry.types()));
        assertTrue(registry.supports("hash_file"));
        assertFalse(registry.supports("resize_image"));
    }

    @Test
    void duplicateTypeIsRejected() {
        TaskHandlerRegistry.Builder builder = TaskHandlerRegistry.builder()
                .register(TaskHandler.of("echo", Object.class, p -> p));
        assertThrows(IllegalArgumentException.class,
                () -> builder.register(TaskHandler.of("echo", Object.class, p -> p)));
    }

    @Test
    void unknownTypeThrows() {
        TaskHandlerRegistry registry = TaskHandlerRegistry.builder().build();
        UnknownTaskTypeException ex = assertThrows(UnknownTaskTypeException.class,
                () -> registry.execute(Task.of("t1", "missing", null)));
        assertEquals("t1", ex.taskId());
    }

    @Test
    void dataIsConvertedToPayloadType() throws Exception {
        TaskHandlerRegistry registry = TaskHandlerRegistry.builder()
                .register(TaskHandler.of("sum", Pair.class, p -> p.a() + p.b()))
                .build();

        assertEquals(5, registry.execute(Task.of("t1", "sum", Map.of("a", 2, "b", 3))));
        assertEquals(7, registry.execute(Task.of("t2", "sum", new Pair(3, 4))));
    }

    @Test
    void unconvertibleDataFailsWithIllegalArgument() {
        TaskHandlerRegistry registry = TaskHandlerRegistry.builder()
                .register(TaskHandler.of("sum", Pair.class, p -> p.a() + p.b()))
                .build();
        assertThrows(IllegalArgumentException.class,
                () -> registry.execute(Task.of("t1", "sum", "not a pair")));
    }
}
