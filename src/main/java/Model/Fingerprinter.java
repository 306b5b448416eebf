package Model;

import dev.brachtendorf.jimagehash.hash.Hash;
import dev.brachtendorf.jimagehash.hashAlgorithms.AverageHash;
import dev.brachtendorf.jimagehash.hashAlgorithms.HashingAlgorithm;
import dev.brachtendorf.jimagehash.hashAlgorithms.PerceptiveHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Turns raw bytes and decoded pixels into an {@link ImageRecord}. Pure: no file or process access.
 * Byte digests never depend on decoding, so an undecodable image still gets both of them.
 * Color counts are not part of a fingerprint; {@link ImageAnalysis} adds them once groups are known.
 */
public final class Fingerprinter {

    private static final Logger log = LoggerFactory.getLogger(Fingerprinter.class);

    public static final int AVERAGE_HASH_BITS = 64;
    public static final int PERCEPTUAL_HASH_BITS = 32;

    // JImageHash algorithms keep internal buffers, one instance per worker thread
    private final ThreadLocal<HashingAlgorithm> averageHasher =
            ThreadLocal.withInitial(() -> new AverageHash(AVERAGE_HASH_BITS));
    private final ThreadLocal<HashingAlgorithm> perceptualHasher =
            ThreadLocal.withInitial(() -> new PerceptiveHash(PERCEPTUAL_HASH_BITS));

    public ImageRecord fingerprint(String filePath, byte[] bytes, BufferedImage pixels, ImageMetadata metadata) {
        Objects.requireNonNull(bytes, "bytes");

        Fingerprint content = contentDigest(bytes);
        Fingerprint weak = weakDigest(bytes);

        Fingerprint average = null;
        Fingerprint perceptual = null;

        if (pixels != null) {
            try {
                average = toFingerprint(FingerprintKind.AVERAGE, averageHasher.get().hash(pixels));
                perceptual = toFingerprint(FingerprintKind.PERCEPTUAL, perceptualHasher.get().hash(pixels));
            } catch (RuntimeException e) {
                log.warn("Pixel hashing failed for {}: {}", filePath, e.toString());
                average = null;
                perceptual = null;
            }
        }

        Integer x = metadata == null ? null : metadata.xResolution();
        Integer y = metadata == null ? null : metadata.yResolution();

        return new ImageRecord(filePath, content, weak, average, perceptual, x, y, null);
    }

    public static Fingerprint contentDigest(byte[] bytes) {
        try {
            return Fingerprint.of(FingerprintKind.CONTENT, MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static Fingerprint weakDigest(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes);
        return new Fingerprint(FingerprintKind.WEAK_CONTENT, String.format("%08x", crc.getValue()));
    }

    private static Fingerprint toFingerprint(FingerprintKind kind, Hash hash) {
        return Fingerprint.of(kind, hash.getHashValue(), hash.getBitResolution());
    }
}
