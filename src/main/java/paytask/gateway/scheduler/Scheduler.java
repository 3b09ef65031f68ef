package paytask.gateway.scheduler;

import paytask.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background work:
 * - one-shot order expiry (see {@link OrderExpiryScheduler})
 * - periodic owner index reconciliation
 * 
 * Uses a single-threaded executor so scheduled actions never overlap.
 * One-shot actions can be scheduled before {@link #start()}.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final Runnable indexReconciler;
    private final GatewayConfig config;

    private volatile boolean running = false;

    /**
     * @param indexReconciler runnable repairing the owner index (typically
     *                        OwnerIndexReconciler)
     * @param config          configuration
     */
    public Scheduler(Runnable indexReconciler, GatewayConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "paytask-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.indexReconciler = indexReconciler;
        this.config = config;
    }

    /**
     * Start periodic jobs.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long reconcileIntervalMs = config.indexReconcileInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("index-reconciler", indexReconciler),
                reconcileIntervalMs,
                reconcileIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Index reconciler scheduled every {}ms", reconcileIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Run an action once after the delay.
     *
     * @return the scheduled action, or null if the executor is shut down
     */
    public ScheduledFuture<?> scheduleOnce(String name, Runnable action, Duration delay) {
        try {
            return executor.schedule(wrapRunnable(name, action), Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Cannot schedule {}: scheduler is shut down", name);
            return null;
        }
    }

    /**
     * Stop the scheduler gracefully. Pending one-shot actions are dropped.
     */
    public void stop() {
        running = false;
        if (executor.isShutdown()) {
            return;
        }

        executor.shutdownNow();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scheduler did not terminate in time");
            } else {
                log.info("Scheduler stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
