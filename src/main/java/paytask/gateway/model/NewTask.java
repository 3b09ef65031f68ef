package paytask.gateway.model;

import java.time.Instant;

/**
 * Caller-supplied fields of a task to be created by a claim.
 */
public record NewTask(String name, String description, Instant dueDate) {

    public NewTask {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("task name is required");
        }
        description = description != null ? description : "";
    }
}
