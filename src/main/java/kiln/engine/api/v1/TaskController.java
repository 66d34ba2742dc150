package kiln.engine.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import kiln.engine.api.Controller;
import kiln.engine.api.v1.dto.BatchRequest;
import kiln.engine.api.v1.dto.SubmitTaskRequest;
import kiln.engine.api.v1.dto.TaskResultResponse;
import kiln.engine.core.PoolCoordinator;
import kiln.engine.exception.DuplicateTaskIdException;
import kiln.engine.exception.PoolShuttingDownException;
import kiln.engine.exception.TaskExecutionException;
import kiln.engine.exception.TaskTimeoutException;
import kiln.engine.exception.UnknownTaskTypeException;
import kiln.engine.exception.WorkerCrashedException;
import kiln.engine.model.Task;
import kiln.engine.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Task submission.
 *
 * POST /api/v1/tasks - run one task, respond when it settles
 * POST /api/v1/tasks/batch - run many, respond with every outcome in order
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final String TASKS_PATH = "/api/v1/tasks";
    private static final String BATCH_PATH = "/api/v1/tasks/batch";

    private final PoolCoordinator pool;

    public TaskController(PoolCoordinator pool) {
        this.pool = pool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && (TASKS_PATH.equals(path) || BATCH_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return handleAsync(ctx, req, path).join();
    }

    @Override
    public CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
            String path) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        try {
            if (BATCH_PATH.equals(path)) {
                return handleBatch(body);
            }
            return handleSubmit(body);
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage()));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ControllerResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Task controller error", e);
            return CompletableFuture.completedFuture(ControllerResponse.error("internal error"));
        }
    }

    private CompletableFuture<ControllerResponse> handleSubmit(String body) throws Exception {
        SubmitTaskRequest request = RouterHandler.mapper().readValue(body, SubmitTaskRequest.class);
        request.validate();
        Task task = request.toTask();

        return pool.submitForResult(task).handle((result, error) -> {
            try {
                if (error == null) {
                    return ControllerResponse.json(
                            RouterHandler.mapper().writeValueAsString(TaskResultResponse.from(result)));
                }
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                return ControllerResponse.json(
                        statusFor(cause),
                        RouterHandler.mapper().writeValueAsString(TaskResultResponse.failure(task.id(), cause)));
            } catch (Exception e) {
                log.error("Failed to serialize result of task {}", task.id(), e);
                return ControllerResponse.error("failed to serialize result");
            }
        });
    }

    private CompletableFuture<ControllerResponse> handleBatch(String body) throws Exception {
        BatchRequest request = RouterHandler.mapper().readValue(body, BatchRequest.class);
        request.validate();

        List<Task> tasks = new ArrayList<>(request.tasks().size());
        for (SubmitTaskRequest item : request.tasks()) {
            tasks.add(item.toTask());
        }

        return pool.executeBatch(tasks).thenApply(results -> {
            try {
                List<TaskResultResponse> response = new ArrayList<>(results.size());
                results.forEach(r -> response.add(TaskResultResponse.from(r)));
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
            } catch (Exception e) {
                log.error("Failed to serialize batch results", e);
                return ControllerResponse.error("failed to serialize results");
            }
        });
    }

    /**
     * HTTP status for the error a task future was rejected with.
     */
    static HttpResponseStatus statusFor(Throwable error) {
        if (error instanceof TaskTimeoutException) {
            return HttpResponseStatus.GATEWAY_TIMEOUT;
        }
        if (error instanceof TaskExecutionException || error instanceof WorkerCrashedException) {
            return HttpResponseStatus.UNPROCESSABLE_ENTITY;
        }
        if (error instanceof UnknownTaskTypeException) {
            return HttpResponseStatus.BAD_REQUEST;
        }
        if (error instanceof DuplicateTaskIdException) {
            return HttpResponseStatus.CONFLICT;
        }
        if (error instanceof PoolShuttingDownException) {
            return HttpResponseStatus.SERVICE_UNAVAILABLE;
        }
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
    }
}
