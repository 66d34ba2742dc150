package kiln.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import kiln.engine.model.Task;

import java.time.Duration;

/**
 * Request DTO for submitting one task.
 * POST /api/v1/tasks
 */
public record SubmitTaskRequest(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("data") JsonNode data,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("timeoutMs") Long timeoutMs) {

    /** Validate the request */
    public void validate() {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        if (id != null && id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
    }

    /**
     * Build the domain task. A missing id is assigned by the pool.
     */
    public Task toTask() {
        return Task.builder()
                .id(id)
                .type(type)
                .data(data)
                .priority(priority != null ? priority : 0)
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                .build();
    }
}
