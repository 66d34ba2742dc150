package kiln.engine.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kiln.engine.exception.TaskTimeoutException;
import kiln.engine.exception.WorkerCrashedException;
import kiln.engine.model.TaskResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TaskResultResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void successOmitsErrorFields() throws Exception {
        TaskResultResponse response = TaskResultResponse.from(TaskResult.success("t1", 42, 15, "worker-1"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(response));
        assertEquals("t1", json.get("taskId").asText());
        assertTrue(json.get("success").asBoolean());
        assertEquals(42, json.get("result").asInt());
        assertEquals(15, json.get("durationMs").asLong());
        assertEquals("worker-1", json.get("workerId").asText());
        assertFalse(json.has("error"));
        assertFalse(json.has("errorType"));
    }

    @Test
    void failureNamesExceptionType() {
        TaskResultResponse response = TaskResultResponse.failure("t1",
                new WorkerCrashedException("t1", "worker-2", 30, new Error("oom")));

        assertFalse(response.success());
        assertEquals("WorkerCrashedException", response.errorType());
        assertEquals("worker-2", response.workerId());
        assertEquals(30, response.durationMs());
        assertNotNull(response.error());
    }

    @Test
    void failureTakesIdFromExceptionWhenMissing() {
        TaskResultResponse response = TaskResultResponse.failure(null,
                new TaskTimeoutException("late-1", Duration.ofSeconds(1)));
        assertEquals("late-1", response.taskId());
        assertEquals("TaskTimeoutException", response.errorType());
    }
}
