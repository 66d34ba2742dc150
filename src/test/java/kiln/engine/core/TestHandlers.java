package kiln.engine.core;

import kiln.engine.handler.TaskHandler;
import kiln.engine.handler.TaskHandlerRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Controllable handlers for pool tests.
 *
 * gate    - payload is a key; blocks until {@link #open(String)} is called for it
 * echo    - returns the payload
 * fail    - throws IllegalStateException with the payload as message
 * crash   - throws an Error, killing the worker thread
 */
public final class TestHandlers {

    private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
    private final List<String> started = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();

    public TaskHandlerRegistry registry() {
        return TaskHandlerRegistry.builder()
                .register(TaskHandler.of("gate", String.class, this::gate))
                .register(TaskHandler.of("echo", Object.class, payload -> payload))
                .register(TaskHandler.of("fail", String.class, message -> {
                    throw new IllegalStateException(message);
                }))
                .register(TaskHandler.of("crash", String.class, message -> {
                    throw new Error(message);
                }))
                .build();
    }

    private String gate(String key) throws InterruptedException {
        started.add(key);
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            if (!gate0(key).await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate " + key + " never opened");
            }
            return key;
        } finally {
            running.decrementAndGet();
        }
    }

    private CountDownLatch gate0(String key) {
        return gates.computeIfAbsent(key, k -> new CountDownLatch(1));
    }

    public void open(String key) {
        gate0(key).countDown();
    }

    public void openAll(String... keys) {
        for (String key : keys) {
            open(key);
        }
    }

    /** Keys in the order their tasks started executing. */
    public List<String> started() {
        synchronized (started) {
            return new ArrayList<>(started);
        }
    }

    public int running() {
        return running.get();
    }

    public int maxRunning() {
        return maxRunning.get();
    }

    public static void await(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting: " + message);
            }
            Thread.sleep(10);
        }
    }
}
