package paytask.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 *
 * <ul>
 * <li>{@code healthy}: database reachable, fees configured, expiry keeping up</li>
 * <li>{@code degraded}: serving, but reservations cannot be taken or do not expire</li>
 * <li>{@code unhealthy}: database unreachable</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("checks") Checks checks,
        @JsonProperty("orders") OrderBacklog orders,
        @JsonProperty("tasks") TaskCounts tasks,
        @JsonProperty("uptimeSeconds") Long uptimeSeconds) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
    public static final String UNHEALTHY = "unhealthy";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Checks(
            @JsonProperty("database") String database,
            @JsonProperty("fees") String fees,
            @JsonProperty("expiry") String expiry) {

        boolean allOk() {
            return "ok".equals(database) && "configured".equals(fees) && "ok".equals(expiry);
        }
    }

    public record OrderBacklog(
            @JsonProperty("pending") int pending,
            @JsonProperty("overdue") int overdue) {
    }

    public record TaskCounts(
            @JsonProperty("pending") int pending,
            @JsonProperty("completed") int completed) {
    }

    public static HealthResponse serving(Checks checks, OrderBacklog orders, TaskCounts tasks, long uptimeSeconds) {
        return new HealthResponse(checks.allOk() ? HEALTHY : DEGRADED, checks, orders, tasks, uptimeSeconds);
    }

    public static HealthResponse unhealthy(String databaseError) {
        return new HealthResponse(UNHEALTHY, new Checks(databaseError, null, null), null, null, null);
    }

    public boolean isServing() {
        return !UNHEALTHY.equals(status);
    }
}
