package kiln.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("totalWorkers") Integer totalWorkers,
        @JsonProperty("activeWorkers") Integer activeWorkers,
        @JsonProperty("queuedTasks") Integer queuedTasks,
        @JsonProperty("pendingTasks") Integer pendingTasks) {

    public static HealthResponse healthy(String uptime, String version, int totalWorkers, int activeWorkers,
            int queuedTasks, int pendingTasks) {
        return new HealthResponse("healthy", uptime, version, totalWorkers, activeWorkers, queuedTasks, pendingTasks);
    }

    public static HealthResponse shuttingDown(String version) {
        return new HealthResponse("shutting_down", null, version, null, null, null, null);
    }
}
