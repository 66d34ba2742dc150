package kiln.engine.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import kiln.engine.api.Controller;
import kiln.engine.api.Controller.ControllerResponse;
import kiln.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.FORBIDDEN;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only /api/v1/* is served; everything else returns 404. When an API key is
 * configured, every POST must carry it in the {@code X-Kiln-Key} header.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String API_KEY_HEADER = "X-Kiln-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final EngineConfig config;

    public RouterHandler(EngineConfig config) {
        this.config = config;
    }

    /**
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        boolean keepAlive = HttpUtil.isKeepAlive(req);

        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req)) {
                log.warn("Auth failed for {} {}", method, path);
                writeSafe(ctx, keepAlive, FORBIDDEN, "application/json", "{\"error\":\"forbidden\"}");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    // the request is released when this method returns; controllers read the body eagerly
                    CompletableFuture<ControllerResponse> response = controller.handleAsync(ctx, req, path);
                    response.whenComplete((r, error) -> {
                        if (error != null) {
                            writeError(ctx, keepAlive, method, path, unwrap(error));
                        } else {
                            writeSafe(ctx, keepAlive, r.status(), r.contentType(), r.body());
                        }
                    });
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, keepAlive, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (RuntimeException e) {
            writeError(ctx, keepAlive, method, path, e);
        }
    }

    private void writeError(ChannelHandlerContext ctx, boolean keepAlive, HttpMethod method, String path,
            Throwable t) {
        if (t instanceof IllegalArgumentException) {
            log.warn("Validation error: {}", t.getMessage());
            writeSafe(ctx, keepAlive, BAD_REQUEST, "application/json",
                    "{\"error\":\"" + escapeJson(t.getMessage()) + "\"}");
            return;
        }

        log.error("Handler error: {} {}", method, path, t);

        StringBuilder errorChain = new StringBuilder(t.toString());
        Throwable cause = t.getCause();
        while (cause != null) {
            errorChain.append(" <- ").append(cause);
            cause = cause.getCause();
        }
        writeSafe(ctx, keepAlive, INTERNAL_SERVER_ERROR, "application/json",
                "{\"error\":\"" + escapeJson(errorChain.toString()) + "\"}");
    }

    private boolean checkAuth(FullHttpRequest req) {
        if (!config.hasApiKey()) {
            return true;
        }
        if (!req.method().equals(HttpMethod.POST)) {
            return true;
        }
        String providedKey = req.headers().get(API_KEY_HEADER);
        return config.apiKey().equals(providedKey);
    }

    /**
     * Write a response, falling back to a bare 500 and finally to closing the
     * connection if even that fails.
     */
    private void writeSafe(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status,
            String contentType, String body) {
        try {
            ctx.writeAndFlush(buildResponse(status, contentType, body == null ? "" : body, keepAlive))
                    .addListener(keepAlive ? ChannelFutureListener.CLOSE_ON_FAILURE : ChannelFutureListener.CLOSE);
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            try {
                ctx.writeAndFlush(buildResponse(INTERNAL_SERVER_ERROR, "application/json",
                        "{\"error\":\"failed to write response\"}", false))
                        .addListener(ChannelFutureListener.CLOSE);
            } catch (RuntimeException e2) {
                log.error("Complete failure writing error response", e2);
                ctx.close();
            }
        }
    }

    private static FullHttpResponse buildResponse(HttpResponseStatus status, String contentType, String body,
            boolean keepAlive) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        HttpUtil.setKeepAlive(response, keepAlive);
        return response;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private static String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
    }

    /**
     * Shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
