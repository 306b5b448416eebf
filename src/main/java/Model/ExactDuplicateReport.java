package Model;

import java.util.List;

public record ExactDuplicateReport(
        List<DuplicateGroup> groups,
        List<CollisionGroup> weakCollisions,
        List<CollisionGroup> strongCollisions,
        List<String> unhashed
) {

    public ExactDuplicateReport {
        groups = List.copyOf(groups);
        weakCollisions = List.copyOf(weakCollisions);
        strongCollisions = List.copyOf(strongCollisions);
        unhashed = List.copyOf(unhashed);
    }
}
