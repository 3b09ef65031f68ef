package paytask.gateway.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import paytask.gateway.api.Controller;
import paytask.gateway.api.v1.dto.MessageResponse;
import paytask.gateway.api.v1.dto.OwnedTasksResponse;
import paytask.gateway.api.v1.dto.TaskResponse;
import paytask.gateway.model.ServiceResult;
import paytask.gateway.model.Task;
import paytask.gateway.server.RouterHandler;
import paytask.gateway.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only view of tasks per owner (public API).
 * 
 * GET /api/v1/owners/{owner}/tasks - Task ids of an owner, in insertion order
 * GET /api/v1/owners/{owner}/tasks/{taskId} - A task, if it belongs to the owner
 */
public class OwnerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(OwnerController.class);

    private static final Pattern OWNER_TASKS_PATTERN = Pattern.compile("^/api/v1/owners/([^/]+)/tasks$");
    private static final Pattern OWNER_TASK_PATTERN = Pattern.compile("^/api/v1/owners/([^/]+)/tasks/([^/]+)$");

    private final TaskService taskService;

    public OwnerController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && (OWNER_TASKS_PATTERN.matcher(path).matches() || OWNER_TASK_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher listMatcher = OWNER_TASKS_PATTERN.matcher(path);
            if (listMatcher.matches()) {
                String owner = QueryStringDecoder.decodeComponent(listMatcher.group(1));
                List<String> taskIds = taskService.listByOwner(owner);
                return ControllerResponse.json(
                        RouterHandler.mapper().writeValueAsString(new OwnedTasksResponse(owner, taskIds)));
            }

            Matcher taskMatcher = OWNER_TASK_PATTERN.matcher(path);
            if (taskMatcher.matches()) {
                String owner = QueryStringDecoder.decodeComponent(taskMatcher.group(1));
                String taskId = QueryStringDecoder.decodeComponent(taskMatcher.group(2));
                ServiceResult<Task> result = taskService.getIfOwned(owner, taskId);
                if (!result.isSuccess()) {
                    return ControllerResponse.json(
                            ControllerResponse.statusOf(result.message()),
                            RouterHandler.mapper().writeValueAsString(MessageResponse.from(result.message())));
                }
                return ControllerResponse.json(
                        RouterHandler.mapper().writeValueAsString(TaskResponse.from(result.orElseThrow())));
            }

            return ControllerResponse.notFound("unknown owner endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Owner controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
