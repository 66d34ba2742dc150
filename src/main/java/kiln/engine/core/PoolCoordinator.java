package kiln.engine.core;

import kiln.engine.config.EngineConfig;
import kiln.engine.event.PoolEvent;
import kiln.engine.event.PoolEventBus;
import kiln.engine.event.PoolEventType;
import kiln.engine.exception.DuplicateTaskIdException;
import kiln.engine.exception.ParallelMapException;
import kiln.engine.exception.PoolShuttingDownException;
import kiln.engine.exception.TaskException;
import kiln.engine.exception.TaskExecutionException;
import kiln.engine.exception.TaskTimeoutException;
import kiln.engine.exception.UnknownTaskTypeException;
import kiln.engine.exception.WorkerCrashedException;
import kiln.engine.handler.TaskHandlerRegistry;
import kiln.engine.metrics.MetricsCollector;
import kiln.engine.metrics.MetricsSnapshot;
import kiln.engine.metrics.MetricsSource;
import kiln.engine.model.PoolMetrics;
import kiln.engine.model.Task;
import kiln.engine.model.TaskResult;
import kiln.engine.model.WorkerMetrics;
import kiln.engine.scheduler.IdleWorkerReaper;
import kiln.engine.scheduler.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded worker pool with a priority queue, per-task timeouts and crash
 * isolation.
 *
 * All pool state (worker set, queue, pending registry) is mutated on a single
 * coordinator thread. Callers and worker threads only post work onto it, so
 * admission, dispatch, completion, timeouts and shutdown never interleave.
 * Futures are completed on that thread too; dependent stages must not block.
 * A task's event is published before its future settles.
 */
public class PoolCoordinator implements MetricsSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PoolCoordinator.class);

    private final EngineConfig config;
    private final TaskHandlerRegistry handlers;
    private final PoolEventBus events;

    private final ScheduledExecutorService loop;
    private volatile Thread loopThread;

    private final TaskQueue queue = new TaskQueue();
    private final PendingRegistry pending = new PendingRegistry();
    private final Map<String, WorkerInfo> workers = new ConcurrentHashMap<>();
    private final AtomicInteger workerSequence = new AtomicInteger();

    private final MetricsCollector metricsCollector;
    private final Scheduler scheduler;
    private final Instant startedAt = Instant.now();

    private volatile boolean shuttingDown = false;
    private final AtomicBoolean shutdownCalled = new AtomicBoolean(false);

    public PoolCoordinator(EngineConfig config, TaskHandlerRegistry handlers, PoolEventBus events) {
        this.config = Objects.requireNonNull(config, "config");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.events = Objects.requireNonNull(events, "events");
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "kiln-coordinator");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        // cancelled timeout timers leave the work queue immediately
        executor.setRemoveOnCancelPolicy(true);
        this.loop = executor;
        this.metricsCollector = new MetricsCollector(this);
        this.scheduler = new Scheduler(
                config.metricsEnabled() ? metricsCollector : null,
                new IdleWorkerReaper(this, config),
                config);
        this.scheduler.start();

        log.info("Worker pool started: maxWorkers={}, taskTimeout={}ms, retryAttempts={} (advisory)",
                config.maxWorkers(), config.taskTimeout().toMillis(), config.retryAttempts());
    }

    // ---- Submission -------------------------------------------------------

    /**
     * Submit a task and get its handler's result.
     * The future fails with a {@link TaskException} subtype on timeout,
     * handler failure, unknown type, worker crash, duplicate id or shutdown.
     */
    public CompletableFuture<Object> submit(Task task) {
        return submitForResult(task).thenApply(TaskResult::result);
    }

    /**
     * Same as {@link #submit(Task)} but completes with the full result,
     * including duration and worker id. A task without an id gets one here.
     */
    public CompletableFuture<TaskResult> submitForResult(Task task) {
        Objects.requireNonNull(task, "task");
        Task admitted = task.hasId() ? task : task.withId(newTaskId());
        if (shuttingDown) {
            return CompletableFuture.failedFuture(new PoolShuttingDownException(admitted.id()));
        }

        CompletableFuture<TaskResult> future = new CompletableFuture<>();
        try {
            loop.execute(() -> admit(admitted, future));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new PoolShuttingDownException(admitted.id()));
        }
        return future;
    }

    /**
     * Submit every task and collect all outcomes in input order. Never fails:
     * a failed task shows up as an unsuccessful {@link TaskResult}.
     */
    public CompletableFuture<List<TaskResult>> executeBatch(List<Task> tasks) {
        List<CompletableFuture<TaskResult>> futures = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            Task withId = task.hasId() ? task : task.withId(newTaskId());
            futures.add(submitForResult(withId)
                    .exceptionally(e -> TaskResult.failure(withId.id(), unwrap(e))));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(v -> {
                    List<TaskResult> results = new ArrayList<>(futures.size());
                    for (CompletableFuture<TaskResult> f : futures) {
                        results.add(f.join());
                    }
                    return results;
                });
    }

    /**
     * {@link #parallelMap(List, String, Function, int, Class)} with one chunk
     * per {@code maxWorkers} items.
     */
    public <T, R> CompletableFuture<List<R>> parallelMap(List<T> items, String taskType,
            Function<? super T, ?> toPayload, Class<R> resultType) {
        return parallelMap(items, taskType, toPayload, config.maxWorkers(), resultType);
    }

    /**
     * Run one task of {@code taskType} per item, {@code concurrency} at a time.
     * Each chunk settles fully before the next is submitted. The first failed
     * item, in input order, fails the whole map with {@link ParallelMapException}
     * and no further chunks are submitted. {@code result[i]} belongs to
     * {@code items[i]}.
     */
    public <T, R> CompletableFuture<List<R>> parallelMap(List<T> items, String taskType,
            Function<? super T, ?> toPayload, int concurrency, Class<R> resultType) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(toPayload, "toPayload");
        Objects.requireNonNull(resultType, "resultType");
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }

        MapRun<T, R> run = new MapRun<>(items, taskType, toPayload, concurrency, resultType);
        log.debug("parallelMap run {}: {} x {} in chunks of {}", run.prefix, items.size(), taskType, concurrency);
        run.next(0);
        return run.out;
    }

    private final class MapRun<T, R> {
        final String prefix = "map-" + UUID.randomUUID();
        final List<T> items;
        final String taskType;
        final Function<? super T, ?> toPayload;
        final int concurrency;
        final Class<R> resultType;
        final List<R> results;
        final CompletableFuture<List<R>> out = new CompletableFuture<>();

        MapRun(List<T> items, String taskType, Function<? super T, ?> toPayload,
                int concurrency, Class<R> resultType) {
            this.items = items;
            this.taskType = taskType;
            this.toPayload = toPayload;
            this.concurrency = concurrency;
            this.resultType = resultType;
            this.results = new ArrayList<>(items.size());
        }

        String taskId(int index) {
            return prefix + "-" + index;
        }

        void next(int start) {
            if (start >= items.size()) {
                out.complete(results);
                return;
            }
            int end = Math.min(start + concurrency, items.size());

            List<Task> chunk = new ArrayList<>(end - start);
            for (int i = start; i < end; i++) {
                try {
                    chunk.add(Task.builder()
                            .id(taskId(i))
                            .type(taskType)
                            .data(toPayload.apply(items.get(i)))
                            .build());
                } catch (RuntimeException e) {
                    out.completeExceptionally(new ParallelMapException(taskId(i), i, e));
                    return;
                }
            }

            List<CompletableFuture<TaskResult>> futures = new ArrayList<>(chunk.size());
            for (Task task : chunk) {
                futures.add(submitForResult(task));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                    .whenComplete((v, ignored) -> collect(start, end, futures));
        }

        private void collect(int start, int end, List<CompletableFuture<TaskResult>> futures) {
            for (int i = start; i < end; i++) {
                try {
                    Object value = futures.get(i - start).join().result();
                    results.add(resultType.cast(value));
                } catch (CompletionException | CancellationException | ClassCastException e) {
                    out.completeExceptionally(new ParallelMapException(taskId(i), i, unwrap(e)));
                    return;
                }
            }
            next(end);
        }
    }

    // ---- Loop-side protocol -------------------------------------------------

    private void admit(Task task, CompletableFuture<TaskResult> future) {
        if (shuttingDown) {
            future.completeExceptionally(new PoolShuttingDownException(task.id()));
            return;
        }

        Duration timeout = task.timeout() != null ? task.timeout() : config.taskTimeout();
        PendingEntry entry = new PendingEntry(task, future, Instant.now(), timeout);
        if (isExecuting(task.id()) || !pending.register(entry)) {
            log.warn("Rejected duplicate task id {}", task.id());
            future.completeExceptionally(new DuplicateTaskIdException(task.id()));
            return;
        }
        entry.arm(loop.schedule(() -> onTimeout(entry), timeout.toMillis(), TimeUnit.MILLISECONDS));
        queue.offer(task);
        log.debug("Admitted task {} ({}, priority {}), queue={}", task.id(), task.type(), task.priority(), queue.size());

        dispatch();
    }

    /** True while a worker still runs a task with this id, including one that already timed out. */
    private boolean isExecuting(String taskId) {
        for (WorkerInfo info : workers.values()) {
            Task running = info.currentTask();
            if (running != null && running.id().equals(taskId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Hand queued tasks to idle or new workers until the queue is empty or
     * the pool is at capacity with every worker busy.
     */
    private void dispatch() {
        while (!shuttingDown && !queue.isEmpty()) {
            WorkerInfo worker = findIdleWorker();
            if (worker == null) {
                if (workers.size() >= config.maxWorkers()) {
                    return;
                }
                worker = createWorker();
                if (worker == null) {
                    return;
                }
            }

            Task task = queue.poll();
            worker.bind(task);
            worker.worker().assign(task);
            log.debug("Dispatched task {} to {}", task.id(), worker.id());
        }
    }

    private WorkerInfo findIdleWorker() {
        for (WorkerInfo info : workers.values()) {
            if (!info.active()) {
                return info;
            }
        }
        return null;
    }

    private WorkerInfo createWorker() {
        Worker worker = new Worker(workerSequence.incrementAndGet(), handlers, this::post);
        try {
            worker.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            log.error("Failed to start {}", worker.id(), e);
            events.publish(PoolEvent.worker(PoolEventType.WORKER_ERROR, worker.id(),
                    "Failed to start worker: " + e));
            return null;
        }

        WorkerInfo info = new WorkerInfo(worker);
        workers.put(info.id(), info);
        log.info("Created {} ({}/{})", info.id(), workers.size(), config.maxWorkers());
        events.publish(PoolEvent.worker(PoolEventType.WORKER_CREATED, info.id(), null));
        return info;
    }

    /**
     * Sink for worker threads. After the loop has stopped, messages are dropped.
     */
    private void post(WorkerMessage message) {
        try {
            loop.execute(() -> onWorkerMessage(message));
        } catch (RejectedExecutionException e) {
            log.debug("Dropped {} from {}: pool stopped", message.kind(), message.workerId());
        }
    }

    private void onWorkerMessage(WorkerMessage message) {
        switch (message.kind()) {
            case TASK_COMPLETED -> onTaskCompleted(message);
            case TASK_FAILED -> onTaskFailed(message);
            case WORKER_CRASHED -> onWorkerCrashed(message);
            case WORKER_EXITED -> onWorkerExited(message);
        }
    }

    private void onTaskCompleted(WorkerMessage message) {
        WorkerInfo info = workers.get(message.workerId());
        if (info == null) {
            log.debug("Ignoring result of {} from retired {}", message.taskId(), message.workerId());
            return;
        }
        Task task = info.release();
        info.counters().record(message.durationMs(), true);

        PendingEntry entry = task != null ? pending.removeFor(task) : null;
        if (entry == null) {
            log.debug("Discarding late result of task {} from {}", message.taskId(), message.workerId());
        } else {
            TaskResult result = TaskResult.success(task.id(), message.result(), message.durationMs(), info.id());
            events.publish(PoolEvent.task(PoolEventType.TASK_COMPLETED, task.type(), result));
            entry.resolve(result);
        }

        dispatch();
    }

    private void onTaskFailed(WorkerMessage message) {
        WorkerInfo info = workers.get(message.workerId());
        if (info == null) {
            log.debug("Ignoring failure of {} from retired {}", message.taskId(), message.workerId());
            return;
        }
        Task task = info.release();
        info.counters().record(message.durationMs(), false);

        PendingEntry entry = task != null ? pending.removeFor(task) : null;
        if (entry == null) {
            log.debug("Discarding late failure of task {} from {}", message.taskId(), message.workerId());
        } else {
            TaskException error = toTaskError(message);
            log.warn("Task {} failed on {} after {}ms: {}", task.id(), info.id(), message.durationMs(), error.getMessage());
            events.publish(PoolEvent.task(PoolEventType.TASK_FAILED, task.type(), TaskResult.failure(task.id(), error)));
            entry.reject(error);
        }

        dispatch();
    }

    private TaskException toTaskError(WorkerMessage message) {
        Throwable failure = message.failure();
        if (failure instanceof UnknownTaskTypeException unknown) {
            return unknown.reportedBy(message.workerId(), message.durationMs());
        }
        String text = failure.getMessage() != null ? failure.getMessage() : failure.toString();
        return new TaskExecutionException(message.taskId(), text, message.workerId(), message.durationMs(), failure);
    }

    private void onWorkerCrashed(WorkerMessage message) {
        WorkerInfo info = workers.remove(message.workerId());
        if (info == null) {
            return;
        }
        handleCrash(info, message.durationMs(), message.failure());
    }

    private void onWorkerExited(WorkerMessage message) {
        WorkerInfo info = workers.remove(message.workerId());
        if (info == null) {
            // retired, recycled or already handled as a crash
            return;
        }
        handleCrash(info, 0, new IllegalStateException("worker thread exited unexpectedly"));
    }

    private void handleCrash(WorkerInfo info, long durationMs, Throwable cause) {
        Task task = info.release();
        log.error("{} crashed{}: {}", info.id(), task != null ? " running task " + task.id() : "", cause.toString());
        info.worker().terminate();

        PendingEntry entry = null;
        WorkerCrashedException error = null;
        if (task != null) {
            info.counters().record(durationMs, false);
            entry = pending.removeFor(task);
            if (entry != null) {
                error = new WorkerCrashedException(task.id(), info.id(), durationMs, cause);
                events.publish(PoolEvent.task(PoolEventType.TASK_FAILED, task.type(), TaskResult.failure(task.id(), error)));
            }
        }
        events.publish(PoolEvent.worker(PoolEventType.WORKER_ERROR, info.id(), cause.toString()));
        events.publish(PoolEvent.worker(PoolEventType.WORKER_EXITED, info.id(), "crashed"));
        if (entry != null) {
            entry.reject(error);
        }

        dispatch();
    }

    private void onTimeout(PendingEntry entry) {
        if (!pending.remove(entry)) {
            return;
        }
        Task task = entry.task();
        boolean wasQueued = queue.remove(task);

        TaskTimeoutException error = new TaskTimeoutException(task.id(), entry.timeout());
        log.warn("Task {} timed out after {}ms ({})", task.id(), entry.timeout().toMillis(),
                wasQueued ? "still queued" : "running");
        events.publish(PoolEvent.task(PoolEventType.TASK_TIMED_OUT, task.type(), TaskResult.failure(task.id(), error)));

        if (!wasQueued && config.recycleWorkerOnTimeout()) {
            recycleWorkerRunning(task);
        }
        entry.reject(error);
    }

    private void recycleWorkerRunning(Task task) {
        for (WorkerInfo info : workers.values()) {
            if (info.isRunning(task)) {
                workers.remove(info.id());
                info.release();
                info.counters().record(0, false);
                info.worker().terminate();
                log.info("Recycled {} after task {} timed out", info.id(), task.id());
                events.publish(PoolEvent.worker(PoolEventType.WORKER_EXITED, info.id(), "recycled after timeout"));
                dispatch();
                return;
            }
        }
    }

    /**
     * Retire idle workers whose last task finished before {@code idleSince}.
     * Busy workers are never touched.
     *
     * @return future of the number of workers retired
     */
    public CompletableFuture<Integer> retireIdleWorkers(Instant idleSince) {
        if (shuttingDown) {
            return CompletableFuture.completedFuture(0);
        }
        try {
            return CompletableFuture.supplyAsync(() -> retireIdle(idleSince), loop);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(0);
        }
    }

    private int retireIdle(Instant idleSince) {
        int retired = 0;
        for (WorkerInfo info : List.copyOf(workers.values())) {
            if (!info.active() && info.lastUsed().isBefore(idleSince)) {
                workers.remove(info.id());
                info.worker().terminate();
                retired++;
                log.debug("Retired idle {}", info.id());
                events.publish(PoolEvent.worker(PoolEventType.WORKER_EXITED, info.id(), "idle"));
            }
        }
        return retired;
    }

    // ---- Metrics ------------------------------------------------------------

    @Override
    public PoolMetrics poolMetrics() {
        int active = 0;
        int total = 0;
        long completed = 0;
        long failed = 0;
        long totalDuration = 0;
        for (WorkerInfo info : workers.values()) {
            total++;
            if (info.active()) {
                active++;
            }
            completed += info.counters().tasksCompleted();
            failed += info.counters().tasksFailed();
            totalDuration += info.counters().totalDurationMs();
        }
        long uptimeMs = Duration.between(startedAt, Instant.now()).toMillis();
        double average = completed == 0 ? 0.0 : (double) totalDuration / completed;
        double throughput = uptimeMs <= 0 ? 0.0 : completed * 1000.0 / uptimeMs;
        return new PoolMetrics(active, total, queue.size(), pending.size(), completed, failed,
                average, throughput, uptimeMs);
    }

    @Override
    public List<WorkerMetrics> workerMetrics() {
        List<WorkerInfo> snapshot = new ArrayList<>(workers.values());
        snapshot.sort(Comparator.comparingInt(info -> info.worker().number()));
        List<WorkerMetrics> metrics = new ArrayList<>(snapshot.size());
        for (WorkerInfo info : snapshot) {
            metrics.add(info.toMetrics());
        }
        return metrics;
    }

    public Optional<WorkerMetrics> workerMetrics(String workerId) {
        WorkerInfo info = workers.get(workerId);
        return info != null ? Optional.of(info.toMetrics()) : Optional.empty();
    }

    /** Latest periodic sample; empty until the first one or when metrics are disabled. */
    public Optional<MetricsSnapshot> latestSample() {
        return metricsCollector.latest();
    }

    public MetricsCollector metricsCollector() {
        return metricsCollector;
    }

    public PoolEventBus events() {
        return events;
    }

    public EngineConfig config() {
        return config;
    }

    public TaskHandlerRegistry handlers() {
        return handlers;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public boolean isShutdown() {
        return shuttingDown;
    }

    // ---- Shutdown -----------------------------------------------------------

    /**
     * Reject all queued and pending tasks, terminate every worker and stop
     * the loop. Bounded by {@code shutdownGracePeriod}; idempotent.
     */
    public void shutdown() {
        if (!shutdownCalled.compareAndSet(false, true)) {
            return;
        }
        shuttingDown = true;
        log.info("Shutting down worker pool: {} workers, {} queued, {} pending",
                workers.size(), queue.size(), pending.size());
        events.publish(PoolEvent.pool(PoolEventType.SHUTDOWN_STARTED, null));
        scheduler.stop();

        long graceMs = config.shutdownGracePeriod().toMillis();
        long deadline = System.currentTimeMillis() + graceMs;
        boolean onLoop = Thread.currentThread() == loopThread;

        List<Worker> signalled;
        if (onLoop) {
            signalled = drain();
        } else {
            signalled = drainOnLoop(graceMs);
        }

        int stragglers = 0;
        for (Worker worker : signalled) {
            try {
                if (!worker.join(deadline - System.currentTimeMillis())) {
                    stragglers++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (stragglers > 0) {
            log.warn("{} worker thread(s) still running after {}ms grace period", stragglers, graceMs);
        }

        loop.shutdown();
        if (!onLoop) {
            try {
                if (!loop.awaitTermination(Math.max(1, deadline - System.currentTimeMillis()), TimeUnit.MILLISECONDS)) {
                    loop.shutdownNow();
                    log.warn("Coordinator loop forcefully stopped");
                }
            } catch (InterruptedException e) {
                loop.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        events.publish(PoolEvent.pool(PoolEventType.SHUTDOWN_COMPLETED, null));
        log.info("Worker pool stopped");
    }

    private List<Worker> drainOnLoop(long graceMs) {
        try {
            return CompletableFuture.supplyAsync(this::drain, loop).get(graceMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException | ExecutionException | TimeoutException e) {
            log.warn("Coordinator loop did not drain in time, stopping it: {}", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        loop.shutdownNow();
        return drain();
    }

    private List<Worker> drain() {
        List<PendingEntry> entries = pending.drain();
        List<Task> queued = queue.drain();
        for (PendingEntry entry : entries) {
            entry.reject(new PoolShuttingDownException(entry.taskId()));
        }
        if (!entries.isEmpty()) {
            log.info("Rejected {} pending task(s) ({} still queued)", entries.size(), queued.size());
        }

        List<Worker> signalled = new ArrayList<>();
        for (WorkerInfo info : List.copyOf(workers.values())) {
            workers.remove(info.id());
            info.release();
            info.worker().terminate();
            signalled.add(info.worker());
            events.publish(PoolEvent.worker(PoolEventType.WORKER_EXITED, info.id(), "pool shutdown"));
        }
        return signalled;
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---- Helpers ------------------------------------------------------------

    private static String newTaskId() {
        return "task-" + UUID.randomUUID();
    }

    static Throwable unwrap(Throwable e) {
        while ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
