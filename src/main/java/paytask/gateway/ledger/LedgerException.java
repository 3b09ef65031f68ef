package paytask.gateway.ledger;

/**
 * Raised when a ledger query cannot be completed or its reply cannot be read.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
