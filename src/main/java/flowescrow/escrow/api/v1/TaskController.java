package flowescrow.escrow.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import flowescrow.escrow.api.Controller;
import flowescrow.escrow.api.v1.dto.ApproveSubtaskRequest;
import flowescrow.escrow.api.v1.dto.EventResponse;
import flowescrow.escrow.api.v1.dto.FundRequest;
import flowescrow.escrow.api.v1.dto.ResolveDisputeRequest;
import flowescrow.escrow.api.v1.dto.SubtaskPaymentResponse;
import flowescrow.escrow.api.v1.dto.TaskResponse;
import flowescrow.escrow.model.EscrowException;
import flowescrow.escrow.model.SubtaskPayment;
import flowescrow.escrow.model.Task;
import flowescrow.escrow.server.RouterHandler;
import flowescrow.escrow.service.EscrowService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the escrow task lifecycle (public API).
 *
 * POST /api/v1/tasks - Fund a new task
 * GET /api/v1/tasks?client={account}&limit={n} - Tasks of a client
 * GET /api/v1/tasks/{taskId} - Task record
 * GET /api/v1/tasks/{taskId}/events - Audit events of a task
 * GET /api/v1/tasks/{taskId}/subtasks - Paid subtasks
 * GET /api/v1/tasks/{taskId}/subtasks/{index} - One subtask payment
 * POST /api/v1/tasks/{taskId}/subtasks/{index}/approve - Pay a subtask
 * POST /api/v1/tasks/{taskId}/complete - Complete and refund the remainder
 * POST /api/v1/tasks/{taskId}/dispute - Raise a dispute
 * POST /api/v1/tasks/{taskId}/resolve - Arbitrate a dispute (admin)
 * POST /api/v1/tasks/{taskId}/cancel - Cancel before any work was paid
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)$");
    private static final Pattern TASK_EVENTS_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)/events$");
    private static final Pattern SUBTASKS_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)/subtasks$");
    private static final Pattern SUBTASK_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)/subtasks/(\\d+)$");
    private static final Pattern APPROVE_PATTERN = Pattern.compile("^/api/v1/tasks/(\\d+)/subtasks/(\\d+)/approve$");
    private static final Pattern ACTION_PATTERN = Pattern
            .compile("^/api/v1/tasks/(\\d+)/(complete|dispute|resolve|cancel)$");

    private final EscrowService escrowService;

    public TaskController(EscrowService escrowService) {
        this.escrowService = escrowService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches()
                    || APPROVE_PATTERN.matcher(path).matches()
                    || ACTION_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATTERN.matcher(path).matches()
                    || TASK_BY_ID_PATTERN.matcher(path).matches()
                    || TASK_EVENTS_PATTERN.matcher(path).matches()
                    || SUBTASKS_PATTERN.matcher(path).matches()
                    || SUBTASK_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                return handlePost(req, path);
            }
            return handleGet(req, path);

        } catch (EscrowException e) {
            return ControllerResponse.rejected(e);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed request body: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handlePost(FullHttpRequest req, String path) throws Exception {
        String caller = Controller.caller(req);

        if (TASKS_PATTERN.matcher(path).matches()) {
            FundRequest request = RouterHandler.readBody(req, FundRequest.class);
            request.validate();
            long taskId = escrowService.fund(caller, request.amount());
            return ControllerResponse.json(
                    HttpResponseStatus.CREATED,
                    RouterHandler.mapper().writeValueAsString(Map.of("taskId", taskId)));
        }

        Matcher approve = APPROVE_PATTERN.matcher(path);
        if (approve.matches()) {
            long taskId = Long.parseLong(approve.group(1));
            int index = Integer.parseInt(approve.group(2));
            ApproveSubtaskRequest request = RouterHandler.readBody(req, ApproveSubtaskRequest.class);
            request.validate();
            escrowService.approveSubtask(caller, taskId, index, request.worker(), request.amount());
            return taskResponse(taskId);
        }

        Matcher action = ACTION_PATTERN.matcher(path);
        if (action.matches()) {
            long taskId = Long.parseLong(action.group(1));
            switch (action.group(2)) {
                case "complete" -> escrowService.completeTask(caller, taskId);
                case "dispute" -> escrowService.raiseDispute(caller, taskId);
                case "cancel" -> escrowService.cancelTask(caller, taskId);
                case "resolve" -> {
                    ResolveDisputeRequest request = RouterHandler.readBody(req, ResolveDisputeRequest.class);
                    request.validate();
                    escrowService.resolveDispute(caller, taskId, request.winner(), request.winnerAmount());
                }
                default -> throw new IllegalArgumentException("unknown action: " + action.group(2));
            }
            return taskResponse(taskId);
        }

        return ControllerResponse.notFound("unknown task endpoint");
    }

    private ControllerResponse handleGet(FullHttpRequest req, String path) throws Exception {
        if (TASKS_PATTERN.matcher(path).matches()) {
            String client = Controller.queryParam(req, "client", null);
            if (client == null || client.isBlank()) {
                throw new IllegalArgumentException("client query parameter is required");
            }
            int limit = Math.min(Integer.parseInt(Controller.queryParam(req, "limit", String.valueOf(DEFAULT_LIMIT))),
                    MAX_LIMIT);
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            List<TaskResponse> tasks = escrowService.findTasksByClient(client, limit).stream()
                    .map(TaskResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("client", client, "count", tasks.size(), "tasks", tasks)));
        }

        Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            return taskResponse(Long.parseLong(byId.group(1)));
        }

        Matcher events = TASK_EVENTS_PATTERN.matcher(path);
        if (events.matches()) {
            long taskId = Long.parseLong(events.group(1));
            List<EventResponse> list = escrowService.taskEvents(taskId).stream()
                    .map(EventResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("taskId", taskId, "events", list)));
        }

        Matcher subtasks = SUBTASKS_PATTERN.matcher(path);
        if (subtasks.matches()) {
            long taskId = Long.parseLong(subtasks.group(1));
            if (escrowService.getTask(taskId).isEmpty()) {
                return ControllerResponse.notFound("task " + taskId + " not found");
            }
            List<SubtaskPaymentResponse> payments = escrowService.subtaskPayments(taskId).stream()
                    .map(SubtaskPaymentResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("taskId", taskId, "payments", payments)));
        }

        Matcher subtask = SUBTASK_PATTERN.matcher(path);
        if (subtask.matches()) {
            long taskId = Long.parseLong(subtask.group(1));
            int index = Integer.parseInt(subtask.group(2));
            Optional<SubtaskPayment> payment = escrowService.getSubtaskPayment(taskId, index);
            if (payment.isEmpty()) {
                return ControllerResponse.notFound("subtask " + index + " of task " + taskId + " not paid");
            }
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    SubtaskPaymentResponse.from(payment.get())));
        }

        return ControllerResponse.notFound("unknown task endpoint");
    }

    private ControllerResponse taskResponse(long taskId) throws Exception {
        Optional<Task> task = escrowService.getTask(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task " + taskId + " not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task.get())));
    }
}
