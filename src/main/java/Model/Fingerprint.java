package Model;

import java.math.BigInteger;
import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One hash value of one kind, stored as fixed-width lowercase hex so that equal hashes compare equal as strings.
 */
public record Fingerprint(FingerprintKind kind, String hex) {

    private static final Pattern HEX = Pattern.compile("[0-9a-f]+");

    public Fingerprint {
        Objects.requireNonNull(kind, "kind");
        if (hex == null || !HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("Not a lowercase hex value: " + hex);
        }
    }

    public static Fingerprint of(FingerprintKind kind, byte[] digest) {
        return new Fingerprint(kind, HexFormat.of().formatHex(digest));
    }

    public static Fingerprint of(FingerprintKind kind, BigInteger value, int bitLength) {
        if (value.signum() < 0) throw new IllegalArgumentException("Hash value must be unsigned");
        int nibbles = Math.max(1, (bitLength + 3) / 4);
        String raw = value.toString(16);
        if (raw.length() >= nibbles) return new Fingerprint(kind, raw);
        return new Fingerprint(kind, "0".repeat(nibbles - raw.length()) + raw);
    }

    public static Fingerprint ofNullable(FingerprintKind kind, String hex) {
        return hex == null ? null : new Fingerprint(kind, hex);
    }

    @Override
    public String toString() {
        return kind + ":" + hex;
    }
}
