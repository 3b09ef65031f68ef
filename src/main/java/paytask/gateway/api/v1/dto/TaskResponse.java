package paytask.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import paytask.gateway.model.Task;

import java.time.Instant;

/**
 * Response DTO for a task.
 * GET /api/v1/owners/{owner}/tasks/{taskId}
 */
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("status") String status,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("dueDate") Instant dueDate,
        @JsonProperty("owner") String owner) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.name(),
                task.description(),
                task.status().name(),
                task.createdAt(),
                task.dueDate().orElse(null),
                task.owner());
    }
}
