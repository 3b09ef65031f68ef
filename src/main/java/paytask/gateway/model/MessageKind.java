package paytask.gateway.model;

/**
 * Kinds of operation outcomes returned to callers.
 * Callers should switch on the kind, never on the message text.
 */
public enum MessageKind {
    EXISTS,
    /** Missing entity, unauthorized caller or unverifiable payment (merged) */
    NOT_FOUND,
    /** Reserved, not produced by current flows */
    INVALID_PAYLOAD,
    PAYMENT_FAILED,
    PAYMENT_COMPLETED,
    SUCCESS,
    FAIL,
    /** Fees were never initialized */
    NOT_CONFIGURED;

    public boolean isSuccess() {
        return this == SUCCESS || this == PAYMENT_COMPLETED;
    }
}
