package kiln.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import kiln.engine.model.TaskHistoryEntry;
import kiln.engine.model.TaskOutcome;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for recent task history.
 * GET /api/v1/tasks/history
 */
public record HistoryResponse(
        @JsonProperty("entries") List<TaskHistoryEntry> entries,
        @JsonProperty("counts") Map<TaskOutcome, Integer> counts) {
}
