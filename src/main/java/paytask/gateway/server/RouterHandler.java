package paytask.gateway.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import paytask.gateway.api.Controller;
import paytask.gateway.api.Controller.ControllerResponse;
import paytask.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_LENGTH;
import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 * 
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (operator API, guarded by X-Paytask-Key when a key is set)
 * 
 * All other endpoints return 404.
 * 
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    /** Header carrying the operator key for /internal/ endpoints */
    public static final String ADMIN_KEY_HEADER = "X-Paytask-Key";

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    // Numeric dates in requests are epoch millis, as in UpdateTaskRequest
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new ArrayList<>();
    private final GatewayConfig config;

    public RouterHandler(GatewayConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
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
        HttpMethod method = req.method();
        String path = new QueryStringDecoder(req.uri()).path();

        try {
            if (isInternal(path) && !adminKeyAccepted(req)) {
                log.warn("Rejected {} {}: bad or missing {}", method, path, ADMIN_KEY_HEADER);
                write(ctx, ControllerResponse.error(FORBIDDEN, "forbidden"));
                return;
            }

            Controller controller = route(method, path);
            if (controller == null) {
                log.debug("No route for {} {}", method, path);
                write(ctx, ControllerResponse.error(NOT_FOUND, "not found"));
                return;
            }

            controller.handleAsync(ctx, req, path).whenComplete((response, error) -> {
                if (error == null) {
                    write(ctx, response);
                } else {
                    write(ctx, failure(method, path, unwrap(error)));
                }
            });
        } catch (Exception e) {
            write(ctx, failure(method, path, e));
        }
    }

    private Controller route(HttpMethod method, String path) {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                return controller;
            }
        }
        return null;
    }

    private ControllerResponse failure(HttpMethod method, String path, Throwable t) {
        if (t instanceof IllegalArgumentException) {
            log.warn("Bad request {} {}: {}", method, path, t.getMessage());
            return ControllerResponse.error(BAD_REQUEST, t.getMessage());
        }
        log.error("Request {} {} failed", method, path, t);
        return ControllerResponse.error(INTERNAL_SERVER_ERROR, describe(t));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable t) {
        List<String> chain = new ArrayList<>();
        for (Throwable c = t; c != null; c = c.getCause()) {
            chain.add(c.toString());
        }
        return String.join(" <- ", chain);
    }

    private static boolean isInternal(String path) {
        return path.startsWith("/internal/");
    }

    /**
     * Internal endpoints are open unless an admin key is configured.
     */
    private boolean adminKeyAccepted(FullHttpRequest req) {
        return !config.hasAdminKey() || config.adminKey().equals(req.headers().get(ADMIN_KEY_HEADER));
    }

    /**
     * Write a response. May run off the event loop once an async controller completes.
     */
    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        String body = response.body() == null ? "" : response.body();
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse out = new DefaultFullHttpResponse(HTTP_1_1, response.status(), Unpooled.wrappedBuffer(bytes));
        out.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        out.headers().setInt(CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(out).addListener(future -> {
            if (!future.isSuccess()) {
                log.error("Failed to write {} response", response.status(), future.cause());
                ctx.close();
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel error", cause);
        ctx.close();
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
