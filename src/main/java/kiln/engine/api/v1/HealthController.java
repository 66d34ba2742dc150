package kiln.engine.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import kiln.engine.api.Controller;
import kiln.engine.api.v1.dto.HealthResponse;
import kiln.engine.core.PoolCoordinator;
import kiln.engine.model.PoolMetrics;
import kiln.engine.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    public static final String VERSION = "1.0.0";

    private final PoolCoordinator pool;

    public HealthController(PoolCoordinator pool) {
        this.pool = pool;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (pool.isShutdown()) {
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.shuttingDown(VERSION)));
            }

            PoolMetrics metrics = pool.poolMetrics();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(metrics.uptimeMs()),
                    VERSION,
                    metrics.totalWorkers(),
                    metrics.activeWorkers(),
                    metrics.queuedTasks(),
                    metrics.pendingTasks());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
        }
    }

    private static String formatUptime(long uptimeMs) {
        Duration duration = Duration.ofMillis(uptimeMs);
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
