package paytask.gateway.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import paytask.gateway.config.FeeSchedule;

/**
 * Request DTO for one-time fee initialization.
 * POST /internal/v1/init
 */
public record InitRequest(
        @JsonProperty("addResourceFee") Long addResourceFee,
        @JsonProperty("verifyFee") Long verifyFee,
        @JsonProperty("addTaskFee") Long addTaskFee) {

    public void validate() {
        if (addResourceFee == null || verifyFee == null || addTaskFee == null) {
            throw new IllegalArgumentException("addResourceFee, verifyFee and addTaskFee are required");
        }
        if (addResourceFee < 0 || verifyFee < 0 || addTaskFee < 0) {
            throw new IllegalArgumentException("fees must be non-negative");
        }
    }

    public FeeSchedule toFeeSchedule() {
        return new FeeSchedule(addResourceFee, verifyFee, addTaskFee);
    }
}
