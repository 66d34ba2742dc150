package kiln.engine.core;

import kiln.engine.model.Task;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Tasks waiting for a free worker, highest priority first.
 * Equal priorities keep submission order through a monotonically increasing
 * sequence number. Not thread-safe: only the coordinator loop touches it.
 */
final class TaskQueue {

    private record Entry(Task task, long sequence) {
    }

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> e.task().priority()).reversed()
            .thenComparingLong(Entry::sequence);

    private final PriorityQueue<Entry> entries = new PriorityQueue<>(ORDER);
    private long nextSequence = 0;
    private volatile int size = 0;

    void offer(Task task) {
        entries.add(new Entry(task, nextSequence++));
        size = entries.size();
    }

    /** Highest-priority task, or null when empty. */
    Task poll() {
        Entry head = entries.poll();
        size = entries.size();
        return head != null ? head.task() : null;
    }

    /**
     * Remove this exact task instance.
     *
     * @return true if it was queued
     */
    boolean remove(Task task) {
        Iterator<Entry> it = entries.iterator();
        while (it.hasNext()) {
            if (it.next().task() == task) {
                it.remove();
                size = entries.size();
                return true;
            }
        }
        return false;
    }

    /** Remove everything, in dispatch order. */
    List<Task> drain() {
        List<Task> drained = new ArrayList<>(entries.size());
        Entry e;
        while ((e = entries.poll()) != null) {
            drained.add(e.task());
        }
        size = 0;
        return drained;
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Safe to call from any thread. */
    int size() {
        return size;
    }

}
