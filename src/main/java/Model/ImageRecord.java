package Model;

/**
 * Fingerprints and quality metadata of one file. Any field except {@code filePath} may be null:
 * digests are null when the bytes could not be read, pixel-derived fields when the image could not be decoded,
 * resolution when the header could not be read. {@code numUniqueColors} is only set for the largest members of a
 * similarity group.
 */
public record ImageRecord(
        String filePath,
        Fingerprint contentDigest,
        Fingerprint weakDigest,
        Fingerprint averageHash,
        Fingerprint perceptualHash,
        Integer xResolution,
        Integer yResolution,
        Integer numUniqueColors
) {

    public ImageRecord {
        if (filePath == null || filePath.isBlank()) throw new IllegalArgumentException("filePath is required");
        requireKind(contentDigest, FingerprintKind.CONTENT);
        requireKind(weakDigest, FingerprintKind.WEAK_CONTENT);
        requireKind(averageHash, FingerprintKind.AVERAGE);
        requireKind(perceptualHash, FingerprintKind.PERCEPTUAL);
        requireNonNegative(xResolution, "xResolution");
        requireNonNegative(yResolution, "yResolution");
        requireNonNegative(numUniqueColors, "numUniqueColors");
    }

    public static ImageRecord unhashed(String filePath) {
        return new ImageRecord(filePath, null, null, null, null, null, null, null);
    }

    public ImageRecord withUniqueColors(Integer colors) {
        return new ImageRecord(filePath, contentDigest, weakDigest, averageHash, perceptualHash,
                xResolution, yResolution, colors);
    }

    public boolean isHashed() {
        return contentDigest != null && weakDigest != null;
    }

    public boolean hasPerceptualHash() {
        return perceptualHash != null;
    }

    public boolean hasColorData() {
        return numUniqueColors != null;
    }

    public boolean hasResolution() {
        return xResolution != null && yResolution != null;
    }

    /** Missing resolution counts as zero pixels. */
    public long pixelCount() {
        return hasResolution() ? (long) xResolution * yResolution : 0L;
    }

    public String contentHex() {
        return contentDigest == null ? null : contentDigest.hex();
    }

    public String weakHex() {
        return weakDigest == null ? null : weakDigest.hex();
    }

    public String averageHex() {
        return averageHash == null ? null : averageHash.hex();
    }

    public String perceptualHex() {
        return perceptualHash == null ? null : perceptualHash.hex();
    }

    private static void requireKind(Fingerprint fingerprint, FingerprintKind expected) {
        if (fingerprint != null && fingerprint.kind() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " fingerprint but got " + fingerprint.kind());
        }
    }

    private static void requireNonNegative(Integer value, String name) {
        if (value != null && value < 0) throw new IllegalArgumentException(name + " must be >= 0: " + value);
    }
}
