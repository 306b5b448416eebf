package Model;

final class Records {

    private Records() {}

    static ImageRecord hashed(String path, String content, String weak) {
        return new ImageRecord(path,
                new Fingerprint(FingerprintKind.CONTENT, content),
                new Fingerprint(FingerprintKind.WEAK_CONTENT, weak),
                null, null, null, null, null);
    }

    static ImageRecord image(String path, String content, String weak, String perceptual,
                             Integer x, Integer y, Integer colors) {
        return new ImageRecord(path,
                content == null ? null : new Fingerprint(FingerprintKind.CONTENT, content),
                weak == null ? null : new Fingerprint(FingerprintKind.WEAK_CONTENT, weak),
                null,
                perceptual == null ? null : new Fingerprint(FingerprintKind.PERCEPTUAL, perceptual),
                x, y, colors);
    }

    static ImageRecord similar(String path, String perceptual, Integer x, Integer y, Integer colors) {
        // distinct bytes per path, so no exact duplicates
        String hex = Integer.toHexString(path.hashCode() & 0x7fffffff);
        return image(path, hex + "c", hex + "e", perceptual, x, y, colors);
    }
}
