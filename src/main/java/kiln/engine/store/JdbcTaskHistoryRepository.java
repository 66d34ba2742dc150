package kiln.engine.store;

import kiln.engine.model.TaskHistoryEntry;
import kiln.engine.model.TaskOutcome;
import kiln.engine.repository.TaskHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of TaskHistoryRepository.
 */
public class JdbcTaskHistoryRepository implements TaskHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskHistoryRepository.class);

    private static final int MAX_ERROR_LENGTH = 2048;

    private final Database db;

    public JdbcTaskHistoryRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(TaskHistoryEntry entry) {
        String sql = """
                    INSERT INTO task_history (task_id, task_type, outcome, worker_id, duration_ms, error_message, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entry.taskId());
            ps.setString(2, entry.taskType());
            ps.setString(3, entry.outcome().name());
            ps.setString(4, entry.workerId());
            ps.setLong(5, entry.durationMs());
            setStringOrNull(ps, 6, truncate(entry.errorMessage()));
            ps.setTimestamp(7, Timestamp.from(entry.finishedAt() != null ? entry.finishedAt() : Instant.now()));

            ps.executeUpdate();
            conn.commit();

            log.trace("Recorded {} for task {}", entry.outcome(), entry.taskId());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save history for task: " + entry.taskId(), e);
        }
    }

    @Override
    public List<TaskHistoryEntry> findRecent(int limit) {
        String sql = "SELECT * FROM task_history ORDER BY finished_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load recent history", e);
        }
    }

    @Override
    public List<TaskHistoryEntry> findByTaskId(String taskId) {
        String sql = "SELECT * FROM task_history WHERE task_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find history for task: " + taskId, e);
        }
    }

    @Override
    public Map<TaskOutcome, Integer> countByOutcome() {
        String sql = "SELECT outcome, COUNT(*) AS cnt FROM task_history GROUP BY outcome";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            Map<TaskOutcome, Integer> counts = new EnumMap<>(TaskOutcome.class);
            while (rs.next()) {
                counts.put(TaskOutcome.valueOf(rs.getString("outcome")), rs.getInt("cnt"));
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count history by outcome", e);
        }
    }

    private List<TaskHistoryEntry> executeQuery(PreparedStatement ps) throws SQLException {
        List<TaskHistoryEntry> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private TaskHistoryEntry mapRow(ResultSet rs) throws SQLException {
        return new TaskHistoryEntry(
                rs.getString("task_id"),
                rs.getString("task_type"),
                TaskOutcome.valueOf(rs.getString("outcome")),
                rs.getString("worker_id"),
                rs.getLong("duration_ms"),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("finished_at")));
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setStringOrNull(PreparedStatement ps, int index, String value) throws SQLException {
        if (value != null) {
            ps.setString(index, value);
        } else {
            ps.setNull(index, Types.VARCHAR);
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
