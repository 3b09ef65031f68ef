package paytask.gateway.scheduler;

import paytask.gateway.config.GatewayConfig;
import paytask.gateway.model.PaymentOrder;
import paytask.gateway.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Discards unpaid reservations.
 * 
 * Every reserved order gets one deferred expiry. Expiry and claim both go
 * through {@link OrderRepository#removePendingIfPresent(long)}, so whichever
 * runs first wins and the other sees the order gone. Expiry cannot be
 * cancelled; after a claim it is a silent no-op.
 */
public class OrderExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(OrderExpiryScheduler.class);

    /** Slack past the deadline before a still-pending order counts as overdue */
    static final Duration OVERDUE_GRACE = Duration.ofSeconds(30);

    private final OrderRepository orderRepository;
    private final Scheduler scheduler;
    private final Duration reservationPeriod;
    private final Clock clock;

    public OrderExpiryScheduler(OrderRepository orderRepository, Scheduler scheduler, GatewayConfig config,
            Clock clock) {
        this.orderRepository = orderRepository;
        this.scheduler = scheduler;
        this.reservationPeriod = config.orderReservationPeriod();
        this.clock = clock;
    }

    /**
     * Schedule expiry of the memo after the full reservation period.
     */
    public void schedule(long memo) {
        schedule(memo, reservationPeriod);
    }

    public void schedule(long memo, Duration delay) {
        scheduler.scheduleOnce("order-expiry-" + memo, () -> expire(memo), delay);
        log.debug("Expiry of memo {} scheduled in {}", memo, delay);
    }

    /**
     * Remove the memo from pending if it is still there.
     *
     * @return true if this call discarded the order
     */
    public boolean expire(long memo) {
        Optional<PaymentOrder> discarded = orderRepository.removePendingIfPresent(memo);
        if (discarded.isPresent()) {
            log.info("Order discarded after timeout: {}", discarded.get());
            return true;
        }
        log.debug("Expiry of memo {} is a no-op (claimed or already expired)", memo);
        return false;
    }

    /**
     * Orders still pending well past their reservation window. Non-zero means
     * expiry is not keeping up (scheduler stopped or wedged).
     */
    public int countOverdue() {
        Instant cutoff = clock.instant().minus(reservationPeriod).minus(OVERDUE_GRACE);
        return orderRepository.countPendingCreatedBefore(cutoff);
    }

    /**
     * Re-arm expiry for orders left pending by a previous run.
     * Orders already past their window expire immediately.
     *
     * @return number of orders rescheduled
     */
    public int rescheduleOutstanding() {
        List<PaymentOrder> pending = orderRepository.findAllPending();
        Instant now = clock.instant();

        for (PaymentOrder order : pending) {
            Instant deadline = order.createdAt().plus(reservationPeriod);
            Duration remaining = Duration.between(now, deadline);
            schedule(order.memo(), remaining.isNegative() ? Duration.ZERO : remaining);
        }

        if (!pending.isEmpty()) {
            log.info("Rescheduled expiry for {} outstanding orders", pending.size());
        }
        return pending.size();
    }

    public Duration reservationPeriod() {
        return reservationPeriod;
    }
}
