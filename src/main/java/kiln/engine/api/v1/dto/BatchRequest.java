package kiln.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for a batch submission.
 * POST /api/v1/tasks/batch
 */
public record BatchRequest(
        @JsonProperty("tasks") List<SubmitTaskRequest> tasks) {

    public static final int MAX_TASKS = 1000;

    /** Validate the request and every task in it */
    public void validate() {
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("tasks must not be empty");
        }
        if (tasks.size() > MAX_TASKS) {
            throw new IllegalArgumentException("at most " + MAX_TASKS + " tasks per batch");
        }
        for (int i = 0; i < tasks.size(); i++) {
            SubmitTaskRequest task = tasks.get(i);
            if (task == null) {
                throw new IllegalArgumentException("tasks[" + i + "] is null");
            }
            try {
                task.validate();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("tasks[" + i + "]: " + e.getMessage(), e);
            }
        }
    }
}
