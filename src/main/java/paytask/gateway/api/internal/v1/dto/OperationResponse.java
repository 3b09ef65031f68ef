package paytask.gateway.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error) {
    /** Success response */
    public static OperationResponse success() {
        return new OperationResponse(true, null);
    }

    /** Error response */
    public static OperationResponse error(String error) {
        return new OperationResponse(false, error);
    }

    public static OperationResponse alreadyInitialized() {
        return error("already_initialized");
    }
}
