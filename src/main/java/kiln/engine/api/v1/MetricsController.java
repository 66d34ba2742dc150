package kiln.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import kiln.engine.api.Controller;
import kiln.engine.api.v1.dto.MetricsResponse;
import kiln.engine.core.PoolCoordinator;
import kiln.engine.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only pool observation.
 *
 * GET /api/v1/metrics - pool aggregates, worker counters, latest sample
 * GET /api/v1/workers - worker counters only
 */
public class MetricsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);

    private static final String METRICS_PATH = "/api/v1/metrics";
    private static final String WORKERS_PATH = "/api/v1/workers";

    private final PoolCoordinator pool;

    public MetricsController(PoolCoordinator pool) {
        this.pool = pool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && (METRICS_PATH.equals(path) || WORKERS_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (WORKERS_PATH.equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(pool.workerMetrics()));
            }
            MetricsResponse response = MetricsResponse.of(
                    pool.poolMetrics(),
                    pool.workerMetrics(),
                    pool.latestSample().orElse(null));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Metrics controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
