package kiln.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import kiln.engine.exception.TaskException;
import kiln.engine.model.TaskResult;

/**
 * Response DTO for one settled task.
 * Used by POST /api/v1/tasks and in the batch results array.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResultResponse(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("success") boolean success,
        @JsonProperty("result") Object result,
        @JsonProperty("error") String error,
        @JsonProperty("errorType") String errorType,
        @JsonProperty("durationMs") long durationMs,
        @JsonProperty("workerId") String workerId) {

    public static TaskResultResponse from(TaskResult result) {
        return new TaskResultResponse(
                result.id(),
                result.success(),
                result.result(),
                result.error(),
                null,
                result.durationMs(),
                result.workerId());
    }

    /**
     * Failure response; {@code errorType} names the exception class.
     */
    public static TaskResultResponse failure(String taskId, Throwable error) {
        TaskResult result = TaskResult.failure(taskId, error);
        String id = taskId;
        if (id == null && error instanceof TaskException te) {
            id = te.taskId();
        }
        return new TaskResultResponse(
                id,
                false,
                null,
                result.error(),
                error.getClass().getSimpleName(),
                result.durationMs(),
                result.workerId());
    }
}
