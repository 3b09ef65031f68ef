package paytask.gateway.integration;

import paytask.gateway.config.Dependencies;
import paytask.gateway.config.FeeSchedule;
import paytask.gateway.config.GatewayConfig;
import paytask.gateway.ledger.FakeLedgerClient;
import paytask.gateway.model.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the paid task workflow wired through {@link Dependencies}:
 * 1. Reserve an order
 * 2. Pay on the ledger
 * 3. Claim a task with the payment proof
 * 4. Work with the task as its owner
 */
class FullFlowIntegrationTest {

        private static final String SERVICE = "paytask-gateway";

        @TempDir
        Path tempDir;

        private String databaseUrl;
        private FakeLedgerClient ledger;
        private Dependencies deps;

        @BeforeEach
        void setUp() {
                databaseUrl = "jdbc:h2:mem:test-flow-" + System.nanoTime()
                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
                ledger = new FakeLedgerClient();
                deps = Dependencies.create(config(), ledger, Clock.systemUTC());
        }

        @AfterEach
        void tearDown() {
                if (deps != null) {
                        deps.close();
                }
        }

        private GatewayConfig config() {
                return GatewayConfig.defaults()
                                .withDatabaseUrl(databaseUrl)
                                .withServiceIdentity(SERVICE)
                                .withOrderReservationPeriod(Duration.ofMinutes(2));
        }

        @Test
        @DisplayName("Full workflow: reserve, pay, claim, update, complete, delete")
        void testFullTaskWorkflow() {
                deps.feeRegistry().initialize(new FeeSchedule(0, 0, 100));

                // 1. Reserve
                PaymentOrder order = deps.orderService().reserve("alice").orElseThrow();
                assertEquals(1, deps.orderService().countPending());

                // 2. Pay at block 7
                ledger.transfer(7, "alice", SERVICE, 100, order.memo());

                // 3. Claim
                ServiceResult<Task> claimed = deps.taskService().claimTask("alice",
                                new NewTask("write report", "q3", null), order.orderId(), 7, order.memo()).join();
                assertTrue(claimed.isSuccess(), claimed.toString());
                Task task = claimed.orElseThrow();

                assertEquals(0, deps.orderService().countPending());
                assertEquals(7, deps.orderService().findSettled("alice").orElseThrow().paidAtBlock().getAsLong());
                assertEquals(List.of(task.id()), deps.taskService().listByOwner("alice"));

                // 4. Update and complete
                assertTrue(deps.taskService().updateTask("alice", task.id(),
                                TaskPatch.empty().withDescription("q4")).isSuccess());
                assertTrue(deps.taskService().completeTask("alice", task.id()).isSuccess());

                Task stored = deps.taskService().getIfOwned("alice", task.id()).orElseThrow();
                assertEquals("q4", stored.description());
                assertEquals(TaskStatus.COMPLETED, stored.status());
                assertEquals(1, deps.taskService().countByStatus(TaskStatus.COMPLETED));

                // 5. Delete
                assertTrue(deps.taskService().deleteTask("alice", task.id()).isSuccess());
                assertTrue(deps.taskService().listByOwner("alice").isEmpty());
                assertTrue(deps.taskRepository().findById(task.id()).isEmpty());
        }

        @Test
        @DisplayName("Fees file is loaded at startup")
        void testFeesFromFile() throws IOException {
                Path fees = tempDir.resolve("fees.ini");
                Files.writeString(fees, "[FEES]\nadd_resource_fee = 0\nverify_fee = 0\nadd_task_fee = 250\n");
                deps.close();

                deps = Dependencies.create(config().withFeesFile(fees), ledger, Clock.systemUTC());

                assertEquals(250, deps.feeRegistry().addTaskFee().getAsLong());
                assertEquals(250, deps.orderService().reserve("alice").orElseThrow().fee());
        }

        @Test
        @DisplayName("Orders left pending by a previous run expire after restart")
        void testLeftoverOrdersExpireAfterRestart() throws InterruptedException {
                deps.feeRegistry().initialize(new FeeSchedule(0, 0, 100));
                PaymentOrder order = deps.orderService().reserve("alice").orElseThrow();
                deps.close();

                // Restart one hour later: the reservation window has long passed
                Clock later = Clock.offset(Clock.systemUTC(), Duration.ofHours(1));
                deps = Dependencies.create(config(), ledger, later);
                assertTrue(deps.orderService().findPending(order.memo()).isPresent());

                deps.startScheduler();

                long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
                while (deps.orderService().findPending(order.memo()).isPresent() && System.nanoTime() < deadline) {
                        Thread.sleep(20);
                }
                assertTrue(deps.orderService().findPending(order.memo()).isEmpty());
        }

        @Test
        @DisplayName("Reconciler repairs a task missing from the owner index")
        void testReconcilerRepairsIndex() {
                deps.feeRegistry().initialize(new FeeSchedule(0, 0, 100));
                PaymentOrder order = deps.orderService().reserve("alice").orElseThrow();
                ledger.transfer(1, "alice", SERVICE, 100, order.memo());
                Task task = deps.taskService().claimTask("alice", new NewTask("n", "", null), order.orderId(), 1,
                                order.memo()).join().orElseThrow();

                // Simulate a crash between the store write and the index append
                deps.ownerIndexRepository().remove("alice", task.id());
                assertTrue(deps.taskService().listByOwner("alice").isEmpty());

                assertEquals(1, deps.ownerIndexReconciler().reconcile());
                assertEquals(List.of(task.id()), deps.taskService().listByOwner("alice"));
        }
}
