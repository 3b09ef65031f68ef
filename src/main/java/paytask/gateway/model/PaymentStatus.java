package paytask.gateway.model;

/**
 * Payment order status. PENDING -> COMPLETED happens at most once per memo.
 */
public enum PaymentStatus {
    /** Reserved, waiting for the ledger transfer */
    PENDING,
    /** Payment verified and order promoted to settled history */
    COMPLETED
}
