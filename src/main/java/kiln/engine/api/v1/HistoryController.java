package kiln.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import kiln.engine.api.Controller;
import kiln.engine.api.v1.dto.HistoryResponse;
import kiln.engine.repository.TaskHistoryRepository;
import kiln.engine.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Recent settled tasks.
 * GET /api/v1/tasks/history?limit=N
 */
public class HistoryController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 1000;

    private final TaskHistoryRepository repository;

    public HistoryController(TaskHistoryRepository repository) {
        this.repository = repository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/tasks/history".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            int limit = parseLimit(new QueryStringDecoder(req.uri()).parameters().get("limit"));
            HistoryResponse response = new HistoryResponse(
                    repository.findRecent(limit),
                    repository.countByOutcome());
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("History controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    static int parseLimit(List<String> values) {
        if (values == null || values.isEmpty()) {
            return DEFAULT_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(values.get(0).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }
}
