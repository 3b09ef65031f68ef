package paytask.gateway.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import paytask.gateway.model.Message;

import java.util.concurrent.CompletableFuture;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /** Header carrying the caller identity */
    String CALLER_HEADER = "X-Paytask-Principal";

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Handle a request whose response depends on an outbound call.
     * The request is released once this method returns, so implementations
     * must read the body before returning the future.
     */
    default CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
            String path) {
        return CompletableFuture.completedFuture(handle(ctx, req, path));
    }

    /**
     * Caller identity from the request header.
     *
     * @throws IllegalArgumentException if the header is missing
     */
    static String requireCaller(FullHttpRequest req) {
        String caller = req.headers().get(CALLER_HEADER);
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException(CALLER_HEADER + " header is required");
        }
        return caller.trim();
    }

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return error(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse conflict(String message) {
            return error(HttpResponseStatus.CONFLICT, message);
        }

        /**
         * {"error": message} with the given status.
         */
        public static ControllerResponse error(HttpResponseStatus status, String message) {
            ObjectNode body = JsonNodeFactory.instance.objectNode();
            body.put("error", message == null ? "" : message);
            return json(status, body.toString());
        }

        /**
         * HTTP status for a service message kind.
         */
        public static HttpResponseStatus statusOf(Message message) {
            return switch (message.kind()) {
                case SUCCESS, PAYMENT_COMPLETED -> HttpResponseStatus.OK;
                case NOT_FOUND -> HttpResponseStatus.NOT_FOUND;
                case NOT_CONFIGURED -> HttpResponseStatus.SERVICE_UNAVAILABLE;
                case INVALID_PAYLOAD -> HttpResponseStatus.BAD_REQUEST;
                case EXISTS -> HttpResponseStatus.CONFLICT;
                case PAYMENT_FAILED -> HttpResponseStatus.PAYMENT_REQUIRED;
                case FAIL -> HttpResponseStatus.INTERNAL_SERVER_ERROR;
            };
        }
    }
}
