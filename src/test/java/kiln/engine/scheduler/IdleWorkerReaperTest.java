package kiln.engine.scheduler;

import kiln.engine.config.EngineConfig;
import kiln.engine.core.PoolCoordinator;
import kiln.engine.event.PoolEventBus;
import kiln.engine.handler.TaskHandler;
import kiln.engine.handler.TaskHandlerRegistry;
import kiln.engine.model.Task;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IdleWorkerReaperTest {

    private PoolCoordinator pool;

    private PoolCoordinator start(Duration idleTimeout, Duration checkInterval) {
        TaskHandlerRegistry registry = TaskHandlerRegistry.builder()
                .register(TaskHandler.of("echo", Object.class, p -> p))
                .build();
        EngineConfig config = EngineConfig.defaults()
                .withMaxWorkers(2)
                .withIdleTimeout(idleTimeout)
                .withIdleCheckInterval(checkInterval)
                .withMetricsEnabled(false);
        pool = new PoolCoordinator(config, registry, new PoolEventBus());
        return pool;
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void retiresWorkersIdleLongerThanTimeout() throws Exception {
        start(Duration.ofMillis(50), Duration.ofMinutes(10));
        pool.submit(Task.of("t1", "echo", 1)).get(5, TimeUnit.SECONDS);
        assertEquals(1, pool.poolMetrics().totalWorkers());

        IdleWorkerReaper reaper = new IdleWorkerReaper(pool, pool.config());
        Thread.sleep(150);

        assertEquals(1, reaper.reapIdleWorkers());
        assertEquals(0, pool.poolMetrics().totalWorkers());

        // pool still works and spawns a fresh worker
        assertEquals(2, pool.submit(Task.of("t2", "echo", 2)).get(5, TimeUnit.SECONDS));
        assertEquals("worker-2", pool.workerMetrics().get(0).workerId());
    }

    @Test
    void keepsRecentlyUsedWorkers() throws Exception {
        start(Duration.ofMinutes(1), Duration.ofMinutes(10));
        pool.submit(Task.of("t1", "echo", 1)).get(5, TimeUnit.SECONDS);

        assertEquals(0, new IdleWorkerReaper(pool, pool.config()).reapIdleWorkers());
        assertEquals(1, pool.poolMetrics().totalWorkers());
    }

    @Test
    void scheduledReaperRunsInBackground() throws Exception {
        start(Duration.ofMillis(20), Duration.ofMillis(50));
        pool.submit(Task.of("t1", "echo", 1)).get(5, TimeUnit.SECONDS);

        long deadline = System.currentTimeMillis() + 5_000;
        while (pool.poolMetrics().totalWorkers() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(0, pool.poolMetrics().totalWorkers());
    }

    @Test
    void doesNothingAfterShutdown() throws Exception {
        start(Duration.ofMillis(1), Duration.ofMinutes(10));
        pool.shutdown();
        assertEquals(0, new IdleWorkerReaper(pool, pool.config()).reapIdleWorkers());
    }
}
