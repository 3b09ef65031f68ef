package paytask.gateway.service;

import paytask.gateway.config.FeeRegistry;
import paytask.gateway.model.Message;
import paytask.gateway.model.MessageKind;
import paytask.gateway.model.PaymentOrder;
import paytask.gateway.model.PaymentStatus;
import paytask.gateway.model.ServiceResult;
import paytask.gateway.repository.DuplicateMemoException;
import paytask.gateway.repository.OrderRepository;
import paytask.gateway.scheduler.OrderExpiryScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Service layer for payment orders: reservation with bounded lifetime and
 * promotion of paid reservations into settled history.
 */
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    // memo collisions with a live pending order are retried with a new order id
    private static final int MAX_MEMO_ATTEMPTS = 3;

    private final OrderRepository orderRepository;
    private final OrderExpiryScheduler expiryScheduler;
    private final CorrelationIdGenerator correlationIds;
    private final FeeRegistry feeRegistry;
    private final Clock clock;

    public OrderService(OrderRepository orderRepository, OrderExpiryScheduler expiryScheduler,
            CorrelationIdGenerator correlationIds, FeeRegistry feeRegistry, Clock clock) {
        this.orderRepository = orderRepository;
        this.expiryScheduler = expiryScheduler;
        this.correlationIds = correlationIds;
        this.feeRegistry = feeRegistry;
        this.clock = clock;
    }

    /**
     * Reserve a task order for the payer. The returned memo must be embedded in
     * the ledger transfer. The reservation expires after the configured period.
     */
    public ServiceResult<PaymentOrder> reserve(String payer) {
        if (payer == null || payer.isBlank()) {
            throw new IllegalArgumentException("payer is required");
        }

        OptionalLong fee = feeRegistry.addTaskFee();
        if (fee.isEmpty()) {
            return ServiceResult.notConfigured("add task fee not set");
        }

        for (int attempt = 1; attempt <= MAX_MEMO_ATTEMPTS; attempt++) {
            String orderId = UUID.randomUUID().toString();
            long memo = correlationIds.generate(orderId, payer);

            if (orderRepository.findPending(memo).isPresent()) {
                log.warn("Memo {} already pending, regenerating (attempt {})", memo, attempt);
                continue;
            }

            PaymentOrder order = PaymentOrder.builder()
                    .orderId(orderId)
                    .fee(fee.getAsLong())
                    .status(PaymentStatus.PENDING)
                    .payer(payer)
                    .memo(memo)
                    .createdAt(clock.instant())
                    .build();

            try {
                orderRepository.savePending(order);
            } catch (DuplicateMemoException e) {
                log.warn("Memo {} taken by a concurrent reservation, regenerating (attempt {})", memo, attempt);
                continue;
            }
            expiryScheduler.schedule(memo);

            log.info("Order {} reserved for {} (memo={}, fee={})", orderId, payer, memo, order.fee());
            return ServiceResult.ok(order, "order reserved");
        }

        return ServiceResult.failure(new Message(MessageKind.FAIL, "cannot allocate a unique memo"));
    }

    /**
     * Remove the memo from pending and record the order as settled for its
     * payer. Must only be called once the payment has been verified.
     *
     * @return NOT_FOUND if the memo never existed, already expired or was
     *         already claimed
     */
    public ServiceResult<PaymentOrder> claimAndPromote(long memo, long paidAtBlock) {
        Optional<PaymentOrder> settled = orderRepository.promote(memo, paidAtBlock);
        if (settled.isEmpty()) {
            log.warn("No pending order for memo {}", memo);
            return ServiceResult.notFound("there is no pending order with memo=" + memo);
        }

        log.info("Order {} settled for {} at block {}", settled.get().orderId(), settled.get().payer(), paidAtBlock);
        return ServiceResult.ok(settled.get(), "order settled");
    }

    /**
     * Discard the reservation if it is still pending. Safe to call at any time.
     *
     * @return true if this call removed the order
     */
    public boolean expire(long memo) {
        return expiryScheduler.expire(memo);
    }

    public Optional<PaymentOrder> findPending(long memo) {
        return orderRepository.findPending(memo);
    }

    public Optional<PaymentOrder> findSettled(String payer) {
        return orderRepository.findSettled(payer);
    }

    public int countPending() {
        return orderRepository.countPending();
    }
}
