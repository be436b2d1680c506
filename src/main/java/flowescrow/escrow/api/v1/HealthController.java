package flowescrow.escrow.api.v1;

import flowescrow.escrow.api.Controller;
import flowescrow.escrow.api.v1.dto.HealthResponse;
import flowescrow.escrow.model.TaskStatus;
import flowescrow.escrow.server.RouterHandler;
import flowescrow.escrow.service.EscrowService;
import flowescrow.escrow.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final EscrowService escrowService;

    public HealthController(Database database, EscrowService escrowService) {
        this.database = database;
        this.escrowService = escrowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            int openTasks = escrowService.countByStatus(TaskStatus.FUNDED)
                    + escrowService.countByStatus(TaskStatus.IN_PROGRESS);
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, escrowService.taskCount(), openTasks,
                    escrowService.countByStatus(TaskStatus.DISPUTED));

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                HealthResponse response = HealthResponse.unhealthy(e.getMessage());
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
