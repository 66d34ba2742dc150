package kiln.engine.core;

import kiln.engine.model.Task;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Task id to pending entry. Each entry is removed exactly once, by whichever of
 * result, timeout or shutdown gets there first; later attempts are no-ops.
 * Not thread-safe: only the coordinator loop touches it.
 */
final class PendingRegistry {

    private final Map<String, PendingEntry> entries = new HashMap<>();
    private volatile int size = 0;

    /**
     * @return false if an entry with the same task id is already registered
     */
    boolean register(PendingEntry entry) {
        if (entries.putIfAbsent(entry.taskId(), entry) != null) {
            return false;
        }
        size = entries.size();
        return true;
    }

    boolean contains(String taskId) {
        return entries.containsKey(taskId);
    }

    /**
     * Remove the entry registered for this exact task instance. Admission
     * refuses an id while a worker still runs it, so a result that arrives
     * after a timeout never finds a newer entry here.
     *
     * @return the removed entry, or null
     */
    PendingEntry removeFor(Task task) {
        PendingEntry entry = entries.get(task.id());
        if (entry == null || entry.task() != task) {
            return null;
        }
        entries.remove(task.id());
        size = entries.size();
        return entry;
    }

    /**
     * @return true if this entry was still registered
     */
    boolean remove(PendingEntry entry) {
        boolean removed = entries.remove(entry.taskId(), entry);
        size = entries.size();
        return removed;
    }

    List<PendingEntry> drain() {
        List<PendingEntry> drained = new ArrayList<>(entries.values());
        entries.clear();
        size = 0;
        return drained;
    }

    /** Safe to call from any thread. */
    int size() {
        return size;
    }
}
