package paytask.gateway.repository;

import paytask.gateway.model.PaymentOrder;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for payment orders.
 * Pending orders are keyed by memo, settled orders by payer.
 * A memo lives in at most one of the two stores at a time.
 */
public interface OrderRepository {

    /**
     * Store a reserved order under its memo.
     *
     * @param order a PENDING order
     * @throws DuplicateMemoException if the memo is already pending
     */
    void savePending(PaymentOrder order);

    /**
     * Find a pending order by memo.
     */
    Optional<PaymentOrder> findPending(long memo);

    /**
     * Atomically remove a pending order.
     * When several callers race on the same memo exactly one receives the order.
     *
     * @param memo the order memo
     * @return the removed order, or empty if it was not pending
     */
    Optional<PaymentOrder> removePendingIfPresent(long memo);

    /**
     * Remove the pending order and record it as the payer's settled order,
     * COMPLETED at the given block, in one transaction. A previous settled
     * order of the same payer is overwritten.
     *
     * @param memo        the order memo
     * @param paidAtBlock ledger block holding the payment
     * @return the settled order, or empty if the memo was not pending
     */
    Optional<PaymentOrder> promote(long memo, long paidAtBlock);

    /**
     * Most recent settled order of a payer.
     */
    Optional<PaymentOrder> findSettled(String payer);

    /**
     * All pending orders, oldest first.
     */
    List<PaymentOrder> findAllPending();

    int countPending();

    /**
     * Pending orders reserved before the cutoff.
     */
    int countPendingCreatedBefore(Instant cutoff);
}
