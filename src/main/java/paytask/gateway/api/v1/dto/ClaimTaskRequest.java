package paytask.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import paytask.gateway.model.NewTask;

import java.time.Instant;

/**
 * Request DTO for claiming a paid task.
 * POST /api/v1/tasks
 */
public record ClaimTaskRequest(
        @JsonProperty("task") TaskPayload task,
        @JsonProperty("paymentId") String paymentId,
        @JsonProperty("block") Long block,
        @JsonProperty("memo") Long memo) {

    public record TaskPayload(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("dueDate") Instant dueDate) {
    }

    public void validate() {
        if (task == null) {
            throw new IllegalArgumentException("task is required");
        }
        if (task.name() == null || task.name().isBlank()) {
            throw new IllegalArgumentException("task.name is required");
        }
        if (block == null || block < 0) {
            throw new IllegalArgumentException("block must be a non-negative number");
        }
        if (memo == null || memo < 0) {
            throw new IllegalArgumentException("memo must be a non-negative number");
        }
    }

    public NewTask toNewTask() {
        return new NewTask(task.name(), task.description(), task.dueDate());
    }

    /** paymentId is informational; fall back to the memo when absent */
    public String paymentIdOrMemo() {
        return paymentId != null && !paymentId.isBlank() ? paymentId : String.valueOf(memo);
    }
}
