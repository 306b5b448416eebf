package Model;

public enum LinkageStatus {
    /** File name maps straight onto an external record. */
    DIRECT,
    /** Inherited from a directly linked member of the same group. */
    PROPAGATED,
    /** The group links to more than one record, so nothing was propagated. */
    CONFLICTED,
    UNLINKED
}
