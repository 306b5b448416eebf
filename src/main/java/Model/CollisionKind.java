package Model;

public enum CollisionKind {
    /** Weak digest shared, content digest differs. */
    WEAK,
    /** Content digest shared, weak digest differs. */
    STRONG
}
