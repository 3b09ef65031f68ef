package paytask.gateway.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import paytask.gateway.api.Controller;
import paytask.gateway.api.v1.dto.ClaimTaskRequest;
import paytask.gateway.api.v1.dto.MessageResponse;
import paytask.gateway.api.v1.dto.UpdateTaskRequest;
import paytask.gateway.model.ServiceResult;
import paytask.gateway.model.Task;
import paytask.gateway.model.TaskPatch;
import paytask.gateway.server.RouterHandler;
import paytask.gateway.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task mutations (public API). The caller comes from the principal header.
 * 
 * POST /api/v1/tasks - Claim a task with a paid order
 * POST /api/v1/tasks/{taskId}/complete - Mark a task completed
 * PATCH /api/v1/tasks/{taskId} - Update name, description or due date
 * DELETE /api/v1/tasks/{taskId} - Delete a task
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern TASK_COMPLETE_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/complete$");

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches() || TASK_COMPLETE_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.PATCH) || method.equals(HttpMethod.DELETE)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    /**
     * Claiming waits on the ledger, so it completes asynchronously.
     * Every other route answers synchronously.
     */
    @Override
    public CompletableFuture<ControllerResponse> handleAsync(ChannelHandlerContext ctx, FullHttpRequest req,
            String path) {
        if (!(req.method().equals(HttpMethod.POST) && TASKS_PATTERN.matcher(path).matches())) {
            return Controller.super.handleAsync(ctx, req, path);
        }
        try {
            return handleClaim(req);
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage()));
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(ControllerResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Task claim error", e);
            return CompletableFuture.completedFuture(ControllerResponse.error("internal error"));
        }
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String caller = Controller.requireCaller(req);

            Matcher completeMatcher = TASK_COMPLETE_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && completeMatcher.matches()) {
                String taskId = decode(completeMatcher.group(1));
                return respond(taskService.completeTask(caller, taskId));
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (taskMatcher.matches()) {
                String taskId = decode(taskMatcher.group(1));
                if (req.method().equals(HttpMethod.PATCH)) {
                    return handleUpdate(req, caller, taskId);
                }
                if (req.method().equals(HttpMethod.DELETE)) {
                    return respond(taskService.deleteTask(caller, taskId));
                }
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks
     */
    private CompletableFuture<ControllerResponse> handleClaim(FullHttpRequest req) throws Exception {
        String caller = Controller.requireCaller(req);
        String body = req.content().toString(StandardCharsets.UTF_8);
        ClaimTaskRequest request = RouterHandler.mapper().readValue(body, ClaimTaskRequest.class);
        request.validate();

        return taskService.claimTask(caller, request.toNewTask(), request.paymentIdOrMemo(),
                request.block(), request.memo())
                .thenApply(result -> {
                    String taskId = result.value().map(Task::id).orElse(null);
                    HttpResponseStatus status = result.isSuccess()
                            ? HttpResponseStatus.CREATED
                            : ControllerResponse.statusOf(result.message());
                    return json(status, MessageResponse.from(result.message(), taskId));
                });
    }

    /**
     * PATCH /api/v1/tasks/{taskId}
     */
    private ControllerResponse handleUpdate(FullHttpRequest req, String caller, String taskId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        JsonNode tree = body.isBlank() ? null : RouterHandler.mapper().readTree(body);
        TaskPatch patch = UpdateTaskRequest.toPatch(tree);
        return respond(taskService.updateTask(caller, taskId, patch));
    }

    private static ControllerResponse respond(ServiceResult<?> result) {
        return json(ControllerResponse.statusOf(result.message()), MessageResponse.from(result.message()));
    }

    private static ControllerResponse json(HttpResponseStatus status, Object body) {
        try {
            return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(body));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String decode(String segment) {
        return QueryStringDecoder.decodeComponent(segment);
    }
}
