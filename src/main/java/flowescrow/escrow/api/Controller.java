package flowescrow.escrow.api;

import flowescrow.escrow.model.EscrowError;
import flowescrow.escrow.model.EscrowException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /** Header carrying the identity of the calling account */
    String CALLER_HEADER = "X-Caller";

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
     * Calling account from {@value #CALLER_HEADER}, or null when absent.
     */
    static String caller(FullHttpRequest req) {
        String caller = req.headers().get(CALLER_HEADER);
        return caller == null || caller.isBlank() ? null : caller.trim();
    }

    /**
     * Single query parameter, or {@code defaultValue} when absent.
     */
    static String queryParam(FullHttpRequest req, String name, String defaultValue) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? defaultValue : values.get(0);
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
            return errorBody(HttpResponseStatus.NOT_FOUND, "NOT_FOUND", message);
        }

        public static ControllerResponse badRequest(String message) {
            return errorBody(HttpResponseStatus.BAD_REQUEST, "BAD_REQUEST", message);
        }

        public static ControllerResponse error(String message) {
            return errorBody(HttpResponseStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", message);
        }

        /**
         * Map a rejected escrow operation to its HTTP status.
         */
        public static ControllerResponse rejected(EscrowException e) {
            return errorBody(statusOf(e.error()), e.error().name(), e.getMessage());
        }

        public static HttpResponseStatus statusOf(EscrowError error) {
            return switch (error) {
                case INVALID_AMOUNT, INVALID_ADDRESS, FEE_TOO_HIGH -> HttpResponseStatus.BAD_REQUEST;
                case UNAUTHORIZED -> HttpResponseStatus.FORBIDDEN;
                case TASK_NOT_FOUND -> HttpResponseStatus.NOT_FOUND;
                case INVALID_STATUS, EXCEEDS_BUDGET, ALREADY_PAID, WORK_ALREADY_STARTED, REENTRANT_CALL ->
                    HttpResponseStatus.CONFLICT;
                case TRANSFER_FAILED -> HttpResponseStatus.UNPROCESSABLE_ENTITY;
            };
        }

        private static ControllerResponse errorBody(HttpResponseStatus status, String code, String message) {
            return new ControllerResponse(status, "application/json",
                    "{\"error\":\"" + code + "\",\"message\":\"" + escapeJson(message) + "\"}");
        }

        private static String escapeJson(String s) {
            if (s == null)
                return "";
            return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\r", "\\r");
        }
    }
}
