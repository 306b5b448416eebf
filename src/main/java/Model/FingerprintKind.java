package Model;

public enum FingerprintKind {
    CONTENT,
    WEAK_CONTENT,
    AVERAGE,
    PERCEPTUAL
}
