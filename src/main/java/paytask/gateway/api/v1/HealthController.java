package paytask.gateway.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import paytask.gateway.api.Controller;
import paytask.gateway.api.v1.dto.HealthResponse;
import paytask.gateway.api.v1.dto.HealthResponse.Checks;
import paytask.gateway.api.v1.dto.HealthResponse.OrderBacklog;
import paytask.gateway.api.v1.dto.HealthResponse.TaskCounts;
import paytask.gateway.config.FeeRegistry;
import paytask.gateway.model.TaskStatus;
import paytask.gateway.scheduler.OrderExpiryScheduler;
import paytask.gateway.scheduler.Scheduler;
import paytask.gateway.server.RouterHandler;
import paytask.gateway.service.OrderService;
import paytask.gateway.service.TaskService;
import paytask.gateway.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.util.concurrent.TimeUnit;

/**
 * GET /api/v1/health
 *
 * Reports whether the gateway can take payments: the store must be reachable,
 * fees must be configured and reservations must still be expiring on time.
 * Only an unreachable store answers 503; a degraded gateway still serves reads.
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final Database database;
    private final FeeRegistry feeRegistry;
    private final Scheduler scheduler;
    private final OrderExpiryScheduler expiryScheduler;
    private final OrderService orderService;
    private final TaskService taskService;

    public HealthController(Database database, FeeRegistry feeRegistry, Scheduler scheduler,
            OrderExpiryScheduler expiryScheduler, OrderService orderService, TaskService taskService) {
        this.database = database;
        this.feeRegistry = feeRegistry;
        this.scheduler = scheduler;
        this.expiryScheduler = expiryScheduler;
        this.orderService = orderService;
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HealthResponse health = assess();
        HttpResponseStatus status = health.isServing() ? HttpResponseStatus.OK : HttpResponseStatus.SERVICE_UNAVAILABLE;
        try {
            return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(health));
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize health response", e);
            return ControllerResponse.error("health check failed");
        }
    }

    HealthResponse assess() {
        if (!database.isHealthy()) {
            return HealthResponse.unhealthy("unreachable");
        }

        try {
            int overdue = expiryScheduler.countOverdue();
            Checks checks = new Checks(
                    "ok",
                    feeRegistry.isInitialized() ? "configured" : "not_configured",
                    expiryState(overdue));

            HealthResponse health = HealthResponse.serving(
                    checks,
                    new OrderBacklog(orderService.countPending(), overdue),
                    new TaskCounts(taskService.countByStatus(TaskStatus.PENDING),
                            taskService.countByStatus(TaskStatus.COMPLETED)),
                    TimeUnit.MILLISECONDS.toSeconds(ManagementFactory.getRuntimeMXBean().getUptime()));

            if (HealthResponse.DEGRADED.equals(health.status())) {
                log.warn("Gateway degraded: {}", checks);
            }
            return health;
        } catch (RuntimeException e) {
            log.error("Health check query failed", e);
            return HealthResponse.unhealthy(e.getMessage());
        }
    }

    private String expiryState(int overdue) {
        if (!scheduler.isRunning()) {
            return "stopped";
        }
        return overdue > 0 ? "lagging" : "ok";
    }
}
