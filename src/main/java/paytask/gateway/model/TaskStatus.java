package paytask.gateway.model;

/**
 * Task lifecycle status. COMPLETED is terminal.
 */
public enum TaskStatus {
    /** Task created by a successful claim */
    PENDING,
    /** Task marked done by its owner */
    COMPLETED
}
