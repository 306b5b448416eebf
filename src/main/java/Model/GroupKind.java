package Model;

public enum GroupKind {
    /** Same content digest and same weak digest. */
    EXACT_DUPLICATE,
    /** Same perceptual hash. */
    SIMILAR
}
