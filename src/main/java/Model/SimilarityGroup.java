package Model;

import java.util.List;

public record SimilarityGroup(String perceptualHash, List<ImageRecord> members) implements ImageGroup {

    public SimilarityGroup {
        members = List.copyOf(members);
        if (members.size() < 2) throw new IllegalArgumentException("A similarity group needs at least two members");
        for (ImageRecord r : members) {
            if (!perceptualHash.equals(r.perceptualHex())) {
                throw new IllegalArgumentException(r.filePath() + " does not carry perceptual hash " + perceptualHash);
            }
        }
    }

    @Override
    public GroupKind kind() {
        return GroupKind.SIMILAR;
    }

    @Override
    public String key() {
        return perceptualHash;
    }
}
