package paytask.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * GET /api/v1/owners/{owner}/tasks
 */
public record OwnedTasksResponse(
        @JsonProperty("owner") String owner,
        @JsonProperty("taskIds") List<String> taskIds) {
}
