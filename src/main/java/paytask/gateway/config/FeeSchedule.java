package paytask.gateway.config;

/**
 * Fees charged by the gateway, in ledger base units (e8s).
 * Only {@code addTaskFee} gates an operation today.
 */
public record FeeSchedule(long addResourceFee, long verifyFee, long addTaskFee) {

    public FeeSchedule {
        if (addResourceFee < 0 || verifyFee < 0 || addTaskFee < 0) {
            throw new IllegalArgumentException("fees must be non-negative");
        }
    }
}
