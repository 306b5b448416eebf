package Model;

import java.util.List;

public record DuplicateGroup(String weakDigest, String contentDigest, List<ImageRecord> members) implements ImageGroup {

    public DuplicateGroup {
        members = List.copyOf(members);
        if (members.size() < 2) throw new IllegalArgumentException("A duplicate group needs at least two members");
        for (ImageRecord r : members) {
            if (!weakDigest.equals(r.weakHex()) || !contentDigest.equals(r.contentHex())) {
                throw new IllegalArgumentException(r.filePath() + " does not carry digests " + weakDigest + "/" + contentDigest);
            }
        }
    }

    @Override
    public GroupKind kind() {
        return GroupKind.EXACT_DUPLICATE;
    }

    @Override
    public String key() {
        return weakDigest + "/" + contentDigest;
    }
}
