package kiln.engine.core;

import kiln.engine.handler.TaskHandlerRegistry;
import kiln.engine.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One execution thread with its own inbox.
 *
 * The worker never touches pool state. For every task it receives it posts
 * exactly one {@link WorkerMessage} to the sink, and when the thread ends for
 * any reason it posts {@link WorkerMessage.Kind#WORKER_EXITED}.
 */
final class Worker {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final int number;
    private final String id;
    private final TaskHandlerRegistry handlers;
    private final Consumer<WorkerMessage> sink;
    private final BlockingQueue<Task> inbox = new LinkedBlockingQueue<>();
    private final Thread thread;

    private volatile boolean terminated = false;

    Worker(int number, TaskHandlerRegistry handlers, Consumer<WorkerMessage> sink) {
        this.number = number;
        this.id = "worker-" + number;
        this.handlers = handlers;
        this.sink = sink;
        this.thread = new Thread(this::runLoop, "kiln-worker-" + number);
        this.thread.setDaemon(true);
    }

    int number() {
        return number;
    }

    String id() {
        return id;
    }

    void start() {
        thread.start();
    }

    /**
     * Hand a task to this worker. The coordinator only does this while the
     * worker is idle, so the inbox never holds more than one task.
     */
    void assign(Task task) {
        inbox.add(task);
    }

    /**
     * Ask the thread to stop. A running handler is interrupted; whether it
     * stops early is up to the handler.
     */
    void terminate() {
        terminated = true;
        thread.interrupt();
    }

    boolean join(long timeoutMs) throws InterruptedException {
        thread.join(Math.max(1, timeoutMs));
        return !thread.isAlive();
    }

    private void runLoop() {
        log.debug("{} started", id);
        try {
            while (!terminated) {
                Task task;
                try {
                    task = inbox.take();
                } catch (InterruptedException e) {
                    break;
                }
                if (!execute(task)) {
                    break;
                }
            }
        } finally {
            log.debug("{} exiting", id);
            sink.accept(WorkerMessage.exited(id));
        }
    }

    /**
     * @return false if the thread must end after this task
     */
    private boolean execute(Task task) {
        long start = System.nanoTime();
        try {
            Object result = handlers.execute(task);
            sink.accept(WorkerMessage.completed(id, task.id(), result, elapsedMs(start)));
            return true;
        } catch (Exception e) {
            sink.accept(WorkerMessage.failed(id, task.id(), e, elapsedMs(start)));
            return true;
        } catch (Throwable t) {
            log.error("{} crashed running task {}", id, task.id(), t);
            sink.accept(WorkerMessage.crashed(id, task.id(), t, elapsedMs(start)));
            return false;
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', alive=" + thread.isAlive() + ", terminated=" + terminated + "}";
    }
}
