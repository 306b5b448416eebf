package Model;

import java.util.Objects;

/**
 * @param codeAndNumber key derived from the file path, null when the name follows no convention
 * @param viaGroupKind  group that decided a propagated or conflicted outcome, null otherwise
 */
public record LinkageResult(
        String filePath,
        String codeAndNumber,
        String recordId,
        LinkageStatus status,
        GroupKind viaGroupKind,
        String viaGroupKey
) {

    public LinkageResult {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(status, "status");
        boolean linked = status == LinkageStatus.DIRECT || status == LinkageStatus.PROPAGATED;
        if (linked == (recordId == null)) {
            throw new IllegalArgumentException(status + " result for " + filePath + (linked ? " needs" : " cannot have") + " a recordId");
        }
    }

    public static LinkageResult direct(String filePath, String codeAndNumber, String recordId) {
        return new LinkageResult(filePath, codeAndNumber, recordId, LinkageStatus.DIRECT, null, null);
    }

    public static LinkageResult propagated(String filePath, String codeAndNumber, String recordId, ImageGroup via) {
        return new LinkageResult(filePath, codeAndNumber, recordId, LinkageStatus.PROPAGATED, via.kind(), via.key());
    }

    public static LinkageResult conflicted(String filePath, String codeAndNumber, ImageGroup via) {
        return new LinkageResult(filePath, codeAndNumber, null, LinkageStatus.CONFLICTED, via.kind(), via.key());
    }

    public static LinkageResult unlinked(String filePath, String codeAndNumber) {
        return new LinkageResult(filePath, codeAndNumber, null, LinkageStatus.UNLINKED, null, null);
    }
}
