package Model;

import java.util.List;

public record RankedGroup(ImageGroup group, List<RankedMember> members) {

    public RankedGroup {
        members = List.copyOf(members);
    }

    public GroupKind kind() {
        return group.kind();
    }

    public String key() {
        return group.key();
    }

    /** More than one member shares rank 1; which one to keep is left to a person. */
    public boolean ambiguousBest() {
        return members.stream().filter(m -> m.rank() == 1).count() > 1;
    }

    public List<RankedMember> best() {
        return members.stream().filter(m -> m.rank() == 1).toList();
    }

    public List<RankedMember> removalCandidates() {
        return members.stream().filter(m -> m.rank() > 1).toList();
    }
}
