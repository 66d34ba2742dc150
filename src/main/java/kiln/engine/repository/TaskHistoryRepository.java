package kiln.engine.repository;

import kiln.engine.model.TaskHistoryEntry;
import kiln.engine.model.TaskOutcome;

import java.util.List;
import java.util.Map;

/**
 * Storage for settled task outcomes.
 * Implementations can use JDBC or in-memory storage.
 */
public interface TaskHistoryRepository {

    /**
     * Append one settled task.
     *
     * @param entry the outcome to store
     */
    void save(TaskHistoryEntry entry);

    /**
     * Most recent entries first.
     *
     * @param limit maximum number of results
     * @return list of entries
     */
    List<TaskHistoryEntry> findRecent(int limit);

    /**
     * Every recorded outcome for a task id, oldest first. A reused id can
     * have more than one.
     *
     * @param taskId the task ID
     * @return list of entries
     */
    List<TaskHistoryEntry> findByTaskId(String taskId);

    /**
     * Count entries per outcome. Outcomes with no entries are absent.
     */
    Map<TaskOutcome, Integer> countByOutcome();
}
