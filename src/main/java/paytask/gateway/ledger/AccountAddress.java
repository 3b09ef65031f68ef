package paytask.gateway.ledger;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.zip.CRC32;

/**
 * 32-byte ledger account identifier derived from an identity and a subaccount:
 * {@code CRC32(h) || h} where {@code h = SHA-224(0x0A "account-id" || identity || subaccount)}.
 */
public final class AccountAddress {

    public static final int LENGTH = 32;
    public static final int SUBACCOUNT_LENGTH = 32;

    private static final byte[] DOMAIN_SEPARATOR = "\naccount-id".getBytes(StandardCharsets.US_ASCII);
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private AccountAddress(byte[] bytes) {
        this.bytes = bytes;
    }

    /** Address of the identity's default (all-zero) subaccount. */
    public static AccountAddress of(String identity) {
        return of(identity, new byte[SUBACCOUNT_LENGTH]);
    }

    public static AccountAddress of(String identity, byte[] subaccount) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity is required");
        }
        if (subaccount == null || subaccount.length != SUBACCOUNT_LENGTH) {
            throw new IllegalArgumentException("subaccount must be " + SUBACCOUNT_LENGTH + " bytes");
        }

        MessageDigest sha224 = sha224();
        sha224.update(DOMAIN_SEPARATOR);
        sha224.update(identity.getBytes(StandardCharsets.UTF_8));
        sha224.update(subaccount);
        byte[] hash = sha224.digest();

        CRC32 crc = new CRC32();
        crc.update(hash);

        return new AccountAddress(ByteBuffer.allocate(LENGTH)
                .putInt((int) crc.getValue())
                .put(hash)
                .array());
    }

    /**
     * Parse a hex encoded identifier.
     *
     * @throws IllegalArgumentException if not hex or not 32 bytes
     */
    public static AccountAddress fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("address is required");
        }
        byte[] parsed = HEX.parseHex(hex.trim().toLowerCase());
        if (parsed.length != LENGTH) {
            throw new IllegalArgumentException("address must be " + LENGTH + " bytes, got " + parsed.length);
        }
        return new AccountAddress(parsed);
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    private static MessageDigest sha224() {
        try {
            return MessageDigest.getInstance("SHA-224");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-224 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AccountAddress other))
            return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
