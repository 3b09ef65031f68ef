package paytask.gateway.model;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Payment order reserved before a task can be claimed.
 * The memo is the correlation token the payer embeds in the ledger transfer
 * and the key of the order while it is pending.
 */
public final class PaymentOrder {
    private final String orderId;
    private final long fee;
    private final PaymentStatus status;
    private final String payer;
    private final Long paidAtBlock;
    private final long memo;
    private final Instant createdAt;

    private PaymentOrder(Builder builder) {
        this.orderId = Objects.requireNonNull(builder.orderId, "orderId is required");
        this.fee = builder.fee;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.payer = Objects.requireNonNull(builder.payer, "payer is required");
        this.paidAtBlock = builder.paidAtBlock;
        this.memo = builder.memo;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        if (fee < 0) {
            throw new IllegalArgumentException("fee must be non-negative");
        }
        if (memo < 0) {
            throw new IllegalArgumentException("memo must be non-negative");
        }
    }

    public String orderId() {
        return orderId;
    }

    public long fee() {
        return fee;
    }

    public PaymentStatus status() {
        return status;
    }

    public String payer() {
        return payer;
    }

    public OptionalLong paidAtBlock() {
        return paidAtBlock != null ? OptionalLong.of(paidAtBlock) : OptionalLong.empty();
    }

    public long memo() {
        return memo;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Completed copy of this order, paid at the given block.
     *
     * @throws IllegalStateException if the order is already completed
     */
    public PaymentOrder completeAt(long block) {
        if (status == PaymentStatus.COMPLETED) {
            throw new IllegalStateException("order " + memo + " already completed");
        }
        return toBuilder()
                .status(PaymentStatus.COMPLETED)
                .paidAtBlock(block)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .orderId(orderId)
                .fee(fee)
                .status(status)
                .payer(payer)
                .paidAtBlock(paidAtBlock)
                .memo(memo)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String orderId;
        private long fee;
        private PaymentStatus status = PaymentStatus.PENDING;
        private String payer;
        private Long paidAtBlock;
        private long memo;
        private Instant createdAt;

        public Builder orderId(String orderId) {
            this.orderId = orderId;
            return this;
        }

        public Builder fee(long fee) {
            this.fee = fee;
            return this;
        }

        public Builder status(PaymentStatus status) {
            this.status = status;
            return this;
        }

        public Builder payer(String payer) {
            this.payer = payer;
            return this;
        }

        public Builder paidAtBlock(Long paidAtBlock) {
            this.paidAtBlock = paidAtBlock;
            return this;
        }

        public Builder memo(long memo) {
            this.memo = memo;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public PaymentOrder build() {
            return new PaymentOrder(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PaymentOrder order))
            return false;
        return memo == order.memo && Objects.equals(orderId, order.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, memo);
    }

    @Override
    public String toString() {
        return "PaymentOrder{memo=" + memo + ", status=" + status + ", payer='" + payer + "', fee=" + fee + "}";
    }
}
