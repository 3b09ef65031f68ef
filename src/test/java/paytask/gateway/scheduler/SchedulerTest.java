package paytask.gateway.scheduler;

import paytask.gateway.config.GatewayConfig;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    @Test
    void runsReconcilerPeriodically() throws InterruptedException {
        CountDownLatch runs = new CountDownLatch(2);
        GatewayConfig config = GatewayConfig.defaults().withIndexReconcileInterval(Duration.ofMillis(50));

        try (Scheduler scheduler = new Scheduler(runs::countDown, config)) {
            scheduler.start();
            assertTrue(scheduler.isRunning());
            assertTrue(runs.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void failingJobKeepsSchedulerAlive() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch secondRun = new CountDownLatch(2);
        GatewayConfig config = GatewayConfig.defaults().withIndexReconcileInterval(Duration.ofMillis(50));

        try (Scheduler scheduler = new Scheduler(() -> {
            attempts.incrementAndGet();
            secondRun.countDown();
            throw new IllegalStateException("boom");
        }, config)) {
            scheduler.start();
            assertTrue(secondRun.await(5, TimeUnit.SECONDS));
        }
        assertTrue(attempts.get() >= 2);
    }

    @Test
    void oneShotActionsRunBeforeStart() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);

        try (Scheduler scheduler = new Scheduler(() -> {
        }, GatewayConfig.defaults())) {
            assertNotNull(scheduler.scheduleOnce("test", ran::countDown, Duration.ofMillis(10)));
            assertTrue(ran.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void stopDropsPendingActions() {
        Scheduler scheduler = new Scheduler(() -> {
        }, GatewayConfig.defaults());
        scheduler.start();
        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertNull(scheduler.scheduleOnce("late", () -> {
        }, Duration.ZERO));
    }
}
