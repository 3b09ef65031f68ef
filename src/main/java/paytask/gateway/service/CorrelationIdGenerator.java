package paytask.gateway.service;

import paytask.gateway.util.ShortHash;

import java.time.Clock;
import java.time.Instant;

/**
 * Derives payment memos from (subject, caller, time).
 *
 * <p>
 * The token is a 32-bit string hash widened to a non-negative long. It is not
 * unpredictable and two different inputs can produce the same token, so callers
 * must not treat it as a unique key without checking the store.
 */
public class CorrelationIdGenerator {

    private final Clock clock;

    public CorrelationIdGenerator(Clock clock) {
        this.clock = clock;
    }

    /** Token for the subject and caller at the current clock time. */
    public long generate(String subject, String caller) {
        return generate(subject, caller, clock.instant());
    }

    public long generate(String subject, String caller, Instant now) {
        long nanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
        return ShortHash.of(subject + "_" + caller + "_" + nanos);
    }
}
