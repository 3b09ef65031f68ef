package paytask.gateway.service;

import paytask.gateway.config.FeeRegistry;
import paytask.gateway.config.FeeSchedule;
import paytask.gateway.config.GatewayConfig;
import paytask.gateway.model.MessageKind;
import paytask.gateway.model.PaymentOrder;
import paytask.gateway.model.PaymentStatus;
import paytask.gateway.model.ServiceResult;
import paytask.gateway.scheduler.OrderExpiryScheduler;
import paytask.gateway.scheduler.Scheduler;
import paytask.gateway.store.Database;
import paytask.gateway.store.JdbcOrderRepository;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OrderServiceTest {

    private static Database db;
    private static JdbcOrderRepository orders;

    private Scheduler scheduler;
    private FeeRegistry fees;
    private OrderExpiryScheduler expiry;
    private OrderService service;

    @BeforeAll
    static void setup() {
        GatewayConfig config = GatewayConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-order-service;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        orders = new JdbcOrderRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM pending_orders");
            st.execute("DELETE FROM settled_orders");
            conn.commit();
        }

        // Long reservation: expiry is driven by hand in these tests
        GatewayConfig config = GatewayConfig.defaults().withOrderReservationPeriod(Duration.ofHours(1));
        Clock clock = Clock.systemUTC();
        scheduler = new Scheduler(() -> {
        }, config);
        fees = new FeeRegistry();
        expiry = new OrderExpiryScheduler(orders, scheduler, config, clock);
        service = new OrderService(orders, expiry, new CorrelationIdGenerator(clock), fees, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void reserveWithoutFeesIsNotConfigured() {
        ServiceResult<PaymentOrder> result = service.reserve("alice");

        assertEquals(MessageKind.NOT_CONFIGURED, result.kind());
        assertEquals("add task fee not set", result.message().text());
        assertEquals(0, service.countPending());
    }

    @Test
    void reserveStoresPendingOrderUnderMemo() {
        fees.initialize(new FeeSchedule(0, 0, 100));

        PaymentOrder order = service.reserve("alice").orElseThrow();

        assertEquals(PaymentStatus.PENDING, order.status());
        assertEquals(100, order.fee());
        assertEquals("alice", order.payer());
        assertTrue(order.paidAtBlock().isEmpty());
        assertEquals(order, service.findPending(order.memo()).orElseThrow());
    }

    @Test
    void reservationsGetDistinctMemos() {
        fees.initialize(new FeeSchedule(0, 0, 100));

        PaymentOrder first = service.reserve("alice").orElseThrow();
        PaymentOrder second = service.reserve("alice").orElseThrow();

        assertNotEquals(first.memo(), second.memo());
        assertEquals(2, service.countPending());
    }

    @Test
    void claimPromotesToSettled() {
        fees.initialize(new FeeSchedule(0, 0, 100));
        PaymentOrder order = service.reserve("alice").orElseThrow();

        PaymentOrder settled = service.claimAndPromote(order.memo(), 7).orElseThrow();

        assertEquals(PaymentStatus.COMPLETED, settled.status());
        assertEquals(7, settled.paidAtBlock().getAsLong());
        assertTrue(service.findPending(order.memo()).isEmpty());
        assertEquals(order.memo(), service.findSettled("alice").orElseThrow().memo());
    }

    @Test
    void secondClaimIsNotFound() {
        fees.initialize(new FeeSchedule(0, 0, 100));
        PaymentOrder order = service.reserve("alice").orElseThrow();

        assertTrue(service.claimAndPromote(order.memo(), 7).isSuccess());
        ServiceResult<PaymentOrder> again = service.claimAndPromote(order.memo(), 7);

        assertEquals(MessageKind.NOT_FOUND, again.kind());
    }

    @Test
    void unknownMemoIsNotFoundWithoutSideEffects() {
        fees.initialize(new FeeSchedule(0, 0, 100));
        PaymentOrder order = service.reserve("alice").orElseThrow();

        ServiceResult<PaymentOrder> result = service.claimAndPromote(order.memo() + 1, 7);

        assertEquals(MessageKind.NOT_FOUND, result.kind());
        assertTrue(service.findPending(order.memo()).isPresent());
        assertTrue(service.findSettled("alice").isEmpty());
    }

    @Test
    void expiredOrderCannotBeClaimed() {
        fees.initialize(new FeeSchedule(0, 0, 100));
        PaymentOrder order = service.reserve("alice").orElseThrow();

        assertTrue(service.expire(order.memo()));
        assertFalse(service.expire(order.memo()));

        assertEquals(MessageKind.NOT_FOUND, service.claimAndPromote(order.memo(), 7).kind());
        assertTrue(service.findSettled("alice").isEmpty());
    }

    @Test
    void expiryAfterClaimIsNoOp() {
        fees.initialize(new FeeSchedule(0, 0, 100));
        PaymentOrder order = service.reserve("alice").orElseThrow();
        service.claimAndPromote(order.memo(), 7);

        assertFalse(expiry.expire(order.memo()));
        assertTrue(service.findSettled("alice").isPresent());
    }

    @Test
    void reserveRequiresPayer() {
        assertThrows(IllegalArgumentException.class, () -> service.reserve(" "));
    }

    @Test
    void memoTakenBetweenCheckAndInsertIsRegenerated() {
        fees.initialize(new FeeSchedule(0, 0, 100));
        JdbcOrderRepository racing = new JdbcOrderRepository(db) {
            private boolean raced;

            @Override
            public Optional<PaymentOrder> findPending(long memo) {
                Optional<PaymentOrder> found = super.findPending(memo);
                if (!raced) {
                    raced = true;
                    super.savePending(pendingOrder("competitor", "bob", memo));
                }
                return found;
            }
        };
        Clock clock = Clock.systemUTC();
        OrderService contended = new OrderService(racing, expiry, new ScriptedMemos(clock, 11, 12), fees, clock);

        ServiceResult<PaymentOrder> result = contended.reserve("alice");

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(12, result.orElseThrow().memo());
        assertEquals("bob", orders.findPending(11).orElseThrow().payer());
        assertEquals("alice", orders.findPending(12).orElseThrow().payer());
    }

    @Test
    void givesUpAfterRepeatedCollisions() {
        fees.initialize(new FeeSchedule(0, 0, 100));
        orders.savePending(pendingOrder("taken", "bob", 5));
        Clock clock = Clock.systemUTC();
        OrderService colliding = new OrderService(orders, expiry, new ScriptedMemos(clock, 5, 5, 5), fees, clock);

        ServiceResult<PaymentOrder> result = colliding.reserve("alice");

        assertEquals(MessageKind.FAIL, result.kind());
        assertEquals(1, service.countPending());
    }

    private static PaymentOrder pendingOrder(String orderId, String payer, long memo) {
        return PaymentOrder.builder()
                .orderId(orderId)
                .fee(100)
                .payer(payer)
                .memo(memo)
                .createdAt(Instant.now())
                .build();
    }

    /** Hands out a fixed sequence of memos. */
    private static final class ScriptedMemos extends CorrelationIdGenerator {
        private final Deque<Long> memos = new ArrayDeque<>();

        ScriptedMemos(Clock clock, long... memos) {
            super(clock);
            for (long memo : memos) {
                this.memos.add(memo);
            }
        }

        @Override
        public long generate(String subject, String caller) {
            return memos.removeFirst();
        }
    }
}
