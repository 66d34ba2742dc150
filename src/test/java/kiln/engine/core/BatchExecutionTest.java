package kiln.engine.core;

import kiln.engine.config.EngineConfig;
import kiln.engine.event.PoolEventBus;
import kiln.engine.exception.ParallelMapException;
import kiln.engine.exception.TaskExecutionException;
import kiln.engine.handler.TaskHandler;
import kiln.engine.handler.TaskHandlerRegistry;
import kiln.engine.model.Task;
import kiln.engine.model.TaskResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BatchExecutionTest {

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private final List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
    private final CountDownLatch hold = new CountDownLatch(1);
    private PoolCoordinator pool;

    @BeforeEach
    void setUp() {
        TaskHandlerRegistry registry = TaskHandlerRegistry.builder()
                .register(TaskHandler.of("square", Integer.class, this::square))
                .register(TaskHandler.of("hold", String.class, value -> {
                    if (!hold.await(10, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("never released");
                    }
                    return value;
                }))
                .register(TaskHandler.of("fail", String.class, message -> {
                    throw new IllegalStateException(message);
                }))
                .build();
        EngineConfig config = EngineConfig.defaults()
                .withMaxWorkers(4)
                .withTaskTimeout(Duration.ofSeconds(5))
                .withMetricsEnabled(false);
        pool = new PoolCoordinator(config, registry, new PoolEventBus());
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    private Integer square(Integer n) throws InterruptedException {
        seen.add(n);
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            Thread.sleep(20);
            if (n < 0) {
                throw new IllegalArgumentException("negative: " + n);
            }
            return n * n;
        } finally {
            running.decrementAndGet();
        }
    }

    @Test
    @DisplayName("executeBatch keeps input order and reports failures as results")
    void batchSettlesEverything() throws Exception {
        List<Task> tasks = List.of(
                Task.of("b1", "square", 3),
                Task.of("b2", "fail", "bad input"),
                Task.builder().type("square").data(5).build());

        List<TaskResult> results = pool.executeBatch(tasks).get(5, TimeUnit.SECONDS);

        assertEquals(3, results.size());
        assertTrue(results.get(0).success());
        assertEquals("b1", results.get(0).id());
        assertEquals(9, results.get(0).result());

        assertFalse(results.get(1).success());
        assertEquals("b2", results.get(1).id());
        assertTrue(results.get(1).error().contains("bad input"));
        assertNotNull(results.get(1).workerId());

        assertTrue(results.get(2).success());
        assertNotNull(results.get(2).id());
        assertEquals(25, results.get(2).result());
    }

    @Test
    void emptyBatchCompletesImmediately() throws Exception {
        assertEquals(List.of(), pool.executeBatch(List.of()).get(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("parallelMap preserves order and respects concurrency")
    void parallelMapOrderAndConcurrency() throws Exception {
        List<Integer> items = IntStream.range(0, 10).boxed().collect(Collectors.toList());

        List<Integer> squares = pool.parallelMap(items, "square", n -> n, 3, Integer.class)
                .get(10, TimeUnit.SECONDS);

        assertEquals(items.stream().map(n -> n * n).collect(Collectors.toList()), squares);
        assertTrue(maxRunning.get() <= 3, "max concurrency was " + maxRunning.get());
    }

    @Test
    void parallelMapDefaultsToPoolSize() throws Exception {
        List<Integer> squares = pool.parallelMap(List.of(1, 2, 3, 4, 5, 6), "square", n -> n, Integer.class)
                .get(10, TimeUnit.SECONDS);

        assertEquals(List.of(1, 4, 9, 16, 25, 36), squares);
        assertTrue(maxRunning.get() <= 4);
    }

    @Test
    void parallelMapOfNothingIsEmpty() throws Exception {
        assertEquals(List.of(), pool.parallelMap(List.<Integer>of(), "square", n -> n, 2, Integer.class)
                .get(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("a failing item aborts the map and later chunks are never submitted")
    void parallelMapAbortsOnFailure() {
        List<Integer> items = List.of(1, 2, -3, 4, 5, 6, 7);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> pool.parallelMap(items, "square", n -> n, 3, Integer.class).get(10, TimeUnit.SECONDS));

        ParallelMapException cause = assertInstanceOf(ParallelMapException.class, ex.getCause());
        assertEquals(2, cause.itemIndex());
        assertInstanceOf(TaskExecutionException.class, cause.getCause());
        assertTrue(cause.getMessage().contains("item 2"));

        // the first chunk is 1, 2, -3; nothing after it ran
        assertFalse(seen.contains(4));
        assertFalse(seen.contains(7));
    }

    @Test
    void parallelMapIgnoresCallerIdsThatLookLikeItsOwn() throws Exception {
        CompletableFuture<Object> first = pool.submit(Task.of("map-1-0", "hold", "mine"));
        CompletableFuture<Object> second = pool.submit(Task.of("map-1-1", "hold", "mine too"));

        List<Integer> squares = pool.parallelMap(List.of(2, 3), "square", n -> n, 2, Integer.class)
                .get(5, TimeUnit.SECONDS);
        assertEquals(List.of(4, 9), squares);

        hold.countDown();
        assertEquals("mine", first.get(5, TimeUnit.SECONDS));
        assertEquals("mine too", second.get(5, TimeUnit.SECONDS));
    }

    @Test
    void parallelMapRejectsBadConcurrency() {
        assertThrows(IllegalArgumentException.class,
                () -> pool.parallelMap(List.of(1), "square", n -> n, 0, Integer.class));
    }

    @Test
    void parallelMapFailsOnWrongResultType() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> pool.parallelMap(List.of(2), "square", n -> n, 1, String.class).get(5, TimeUnit.SECONDS));
        ParallelMapException cause = assertInstanceOf(ParallelMapException.class, ex.getCause());
        assertEquals(0, cause.itemIndex());
    }
}
