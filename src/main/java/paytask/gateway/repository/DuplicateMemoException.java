package paytask.gateway.repository;

/**
 * A pending order already holds the memo.
 */
public class DuplicateMemoException extends RuntimeException {

    private final long memo;

    public DuplicateMemoException(long memo, Throwable cause) {
        super("memo already pending: " + memo, cause);
        this.memo = memo;
    }

    public long memo() {
        return memo;
    }
}
