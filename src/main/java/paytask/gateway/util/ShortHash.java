package paytask.gateway.util;

import java.util.Arrays;

/**
 * 32-bit non-cryptographic hashes widened to non-negative longs.
 * Used for correlation tokens and for the loose address comparison during
 * payment verification. Distinct inputs can collide.
 */
public final class ShortHash {

    private ShortHash() {
    }

    public static long of(String input) {
        return widen(input.hashCode());
    }

    public static long of(byte[] input) {
        return widen(Arrays.hashCode(input));
    }

    // abs in long arithmetic so Integer.MIN_VALUE stays positive
    private static long widen(int hash) {
        return Math.abs((long) hash);
    }
}
