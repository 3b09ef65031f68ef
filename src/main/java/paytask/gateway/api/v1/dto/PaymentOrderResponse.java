package paytask.gateway.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import paytask.gateway.model.PaymentOrder;

import java.time.Instant;

/**
 * Response DTO for a payment order.
 * POST /api/v1/orders, GET /api/v1/orders/settled
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentOrderResponse(
        @JsonProperty("orderId") String orderId,
        @JsonProperty("fee") long fee,
        @JsonProperty("status") String status,
        @JsonProperty("payer") String payer,
        @JsonProperty("paidAtBlock") Long paidAtBlock,
        @JsonProperty("memo") long memo,
        @JsonProperty("createdAt") Instant createdAt) {

    public static PaymentOrderResponse from(PaymentOrder order) {
        return new PaymentOrderResponse(
                order.orderId(),
                order.fee(),
                order.status().name(),
                order.payer(),
                order.paidAtBlock().isPresent() ? order.paidAtBlock().getAsLong() : null,
                order.memo(),
                order.createdAt());
    }
}
