package paytask.gateway.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import paytask.gateway.model.TaskPatch;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Request body for PATCH /api/v1/tasks/{taskId}.
 *
 * <pre>
 * {"name": "..."}               rename, other fields unchanged
 * {"dueDate": "2026-01-01T00:00:00Z"}  set due date
 * {"dueDate": null}             clear due date
 * {}                            no change
 * </pre>
 *
 * Read from a tree so that an absent {@code dueDate} and a {@code null} one stay distinct.
 */
public final class UpdateTaskRequest {

    private UpdateTaskRequest() {
    }

    public static TaskPatch toPatch(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return TaskPatch.empty();
        }
        if (!body.isObject()) {
            throw new IllegalArgumentException("update body must be a JSON object");
        }

        TaskPatch patch = TaskPatch.empty();

        JsonNode name = body.get("name");
        if (name != null && !name.isNull()) {
            if (!name.isTextual() || name.asText().isBlank()) {
                throw new IllegalArgumentException("name must be a non-blank string");
            }
            patch = patch.withName(name.asText());
        }

        JsonNode description = body.get("description");
        if (description != null && !description.isNull()) {
            if (!description.isTextual()) {
                throw new IllegalArgumentException("description must be a string");
            }
            patch = patch.withDescription(description.asText());
        }

        if (body.has("dueDate")) {
            JsonNode dueDate = body.get("dueDate");
            patch = dueDate.isNull() ? patch.clearingDueDate() : patch.withDueDate(parseInstant(dueDate));
        }

        return patch;
    }

    private static Instant parseInstant(JsonNode node) {
        if (node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("dueDate must be an ISO-8601 instant: " + node.asText());
            }
        }
        throw new IllegalArgumentException("dueDate must be an ISO-8601 instant, epoch millis or null");
    }
}
