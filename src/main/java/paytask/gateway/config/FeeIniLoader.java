package paytask.gateway.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Optional;

/**
 * Loads the fee schedule from an INI file.
 *
 * <pre>
 * [FEES]
 * add_resource_fee = 1000000
 * verify_fee       = 500000
 * add_task_fee     = 1000000
 * </pre>
 *
 * Every key is required; a fee is never assumed to be 0.
 */
public final class FeeIniLoader {

    private static final Logger log = LoggerFactory.getLogger(FeeIniLoader.class);

    private FeeIniLoader() {
    }

    /**
     * @return the fees, or empty if the file has no [FEES] section
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a key is missing or a value is not a non-negative integer
     */
    public static Optional<FeeSchedule> load(File file) throws IOException {
        Ini ini = new Ini(file);
        Profile.Section fees = ini.get("FEES");
        if (fees == null) {
            log.warn("No [FEES] section in {}", file);
            return Optional.empty();
        }

        return Optional.of(new FeeSchedule(
                fee(fees, "add_resource_fee"),
                fee(fees, "verify_fee"),
                fee(fees, "add_task_fee")));
    }

    private static long fee(Profile.Section section, String key) {
        String raw = section.get(key);
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("missing " + key + " in [FEES]");
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + key + ": " + raw, e);
        }
    }
}
