package Model;

import java.util.List;

public record CollisionGroup(CollisionKind kind, String sharedDigest, List<ImageRecord> members) {

    public CollisionGroup {
        members = List.copyOf(members);
    }
}
