package kiln.engine.store;

import kiln.engine.model.TaskHistoryEntry;
import kiln.engine.model.TaskOutcome;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskHistoryRepositoryTest {

    private static Database db;
    private JdbcTaskHistoryRepository repository;

    @BeforeAll
    static void initDb() {
        db = new Database("jdbc:h2:mem:history-repo-test;DB_CLOSE_DELAY=-1", 2);
    }

    @AfterAll
    static void closeDb() {
        db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("DELETE FROM task_history");
            conn.commit();
        }
        repository = new JdbcTaskHistoryRepository(db);
    }

    private static TaskHistoryEntry entry(String taskId, TaskOutcome outcome, Instant finishedAt) {
        return new TaskHistoryEntry(taskId, "hash_file", outcome, "worker-1", 12,
                outcome == TaskOutcome.COMPLETED ? null : "boom", finishedAt);
    }

    @Test
    void databaseIsHealthy() {
        assertTrue(db.isHealthy());
    }

    @Test
    @DisplayName("Save and find by task id")
    void saveAndFind() {
        Instant now = Instant.parse("2026-01-01T10:00:00Z");
        repository.save(entry("t1", TaskOutcome.COMPLETED, now));

        List<TaskHistoryEntry> found = repository.findByTaskId("t1");
        assertEquals(1, found.size());
        TaskHistoryEntry e = found.get(0);
        assertEquals("hash_file", e.taskType());
        assertEquals(TaskOutcome.COMPLETED, e.outcome());
        assertEquals("worker-1", e.workerId());
        assertEquals(12, e.durationMs());
        assertNull(e.errorMessage());
        assertEquals(now, e.finishedAt());
    }

    @Test
    void reusedIdKeepsAllRunsOldestFirst() {
        Instant base = Instant.parse("2026-01-01T10:00:00Z");
        repository.save(entry("t1", TaskOutcome.TIMED_OUT, base));
        repository.save(entry("t1", TaskOutcome.COMPLETED, base.plusSeconds(5)));

        List<TaskHistoryEntry> found = repository.findByTaskId("t1");
        assertEquals(2, found.size());
        assertEquals(TaskOutcome.TIMED_OUT, found.get(0).outcome());
        assertEquals(TaskOutcome.COMPLETED, found.get(1).outcome());
    }

    @Test
    void findRecentIsNewestFirstAndLimited() {
        Instant base = Instant.parse("2026-01-01T10:00:00Z");
        for (int i = 0; i < 5; i++) {
            repository.save(entry("t" + i, TaskOutcome.COMPLETED, base.plusSeconds(i)));
        }

        List<TaskHistoryEntry> recent = repository.findRecent(3);
        assertEquals(List.of("t4", "t3", "t2"), recent.stream().map(TaskHistoryEntry::taskId).toList());
    }

    @Test
    void countsByOutcome() {
        Instant now = Instant.now();
        repository.save(entry("a", TaskOutcome.COMPLETED, now));
        repository.save(entry("b", TaskOutcome.COMPLETED, now));
        repository.save(entry("c", TaskOutcome.FAILED, now));

        Map<TaskOutcome, Integer> counts = repository.countByOutcome();
        assertEquals(2, counts.get(TaskOutcome.COMPLETED));
        assertEquals(1, counts.get(TaskOutcome.FAILED));
        assertNull(counts.get(TaskOutcome.TIMED_OUT));
    }

    @Test
    void longErrorMessageIsTruncated() {
        TaskHistoryEntry longError = new TaskHistoryEntry("t1", "hash_file", TaskOutcome.FAILED, null, 0,
                "x".repeat(5000), Instant.now());
        repository.save(longError);

        TaskHistoryEntry stored = repository.findByTaskId("t1").get(0);
        assertEquals(2048, stored.errorMessage().length());
        assertNull(stored.workerId());
    }
}
