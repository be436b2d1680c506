package flowescrow.escrow.api.v1;

import flowescrow.escrow.api.Controller;
import flowescrow.escrow.api.v1.dto.EventResponse;
import flowescrow.escrow.model.EscrowEvent;
import flowescrow.escrow.server.RouterHandler;
import flowescrow.escrow.service.EscrowService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read access to the audit event stream, for indexers.
 *
 * GET /api/v1/events?after={sequence}&limit={n}
 * GET /api/v1/events/{sequence}
 */
public class EventController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(EventController.class);

    private static final int DEFAULT_LIMIT = 100;
    private static final int MAX_LIMIT = 1000;

    private static final Pattern EVENTS_PATTERN = Pattern.compile("^/api/v1/events$");
    private static final Pattern EVENT_PATTERN = Pattern.compile("^/api/v1/events/(\\d+)$");

    private final EscrowService escrowService;

    public EventController(EscrowService escrowService) {
        this.escrowService = escrowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (EVENTS_PATTERN.matcher(path).matches() || EVENT_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher single = EVENT_PATTERN.matcher(path);
            if (single.matches()) {
                long sequence = Long.parseLong(single.group(1));
                Optional<EscrowEvent> event = escrowService.event(sequence);
                if (event.isEmpty()) {
                    return ControllerResponse.notFound("event " + sequence + " not found");
                }
                return ControllerResponse.json(
                        RouterHandler.mapper().writeValueAsString(EventResponse.from(event.get())));
            }

            long after = Long.parseLong(Controller.queryParam(req, "after", "0"));
            int limit = Math.min(Integer.parseInt(Controller.queryParam(req, "limit", String.valueOf(DEFAULT_LIMIT))),
                    MAX_LIMIT);
            if (after < 0 || limit <= 0) {
                throw new IllegalArgumentException("after must not be negative and limit must be positive");
            }

            List<EventResponse> events = escrowService.events(after, limit).stream()
                    .map(EventResponse::from)
                    .toList();
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("after", after);
            response.put("count", events.size());
            response.put("events", events);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Event controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
