package paytask.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the fee schedule. It is set exactly once and never changes afterwards.
 */
public final class FeeRegistry {

    private static final Logger log = LoggerFactory.getLogger(FeeRegistry.class);

    private final AtomicReference<FeeSchedule> schedule = new AtomicReference<>();

    /**
     * Install the fee schedule.
     *
     * @throws IllegalStateException if fees were already initialized
     */
    public void initialize(FeeSchedule fees) {
        if (fees == null) {
            throw new IllegalArgumentException("fees are required");
        }
        if (!schedule.compareAndSet(null, fees)) {
            throw new IllegalStateException("fees already initialized");
        }
        log.info("Fees initialized: {}", fees);
    }

    public boolean isInitialized() {
        return schedule.get() != null;
    }

    public Optional<FeeSchedule> current() {
        return Optional.ofNullable(schedule.get());
    }

    public OptionalLong addTaskFee() {
        FeeSchedule fees = schedule.get();
        return fees != null ? OptionalLong.of(fees.addTaskFee()) : OptionalLong.empty();
    }

    public OptionalLong addResourceFee() {
        FeeSchedule fees = schedule.get();
        return fees != null ? OptionalLong.of(fees.addResourceFee()) : OptionalLong.empty();
    }

    public OptionalLong verifyFee() {
        FeeSchedule fees = schedule.get();
        return fees != null ? OptionalLong.of(fees.verifyFee()) : OptionalLong.empty();
    }
}
