package Model;

import java.util.List;

public record IdentityConflict(GroupKind groupKind, String groupKey, List<String> recordIds, List<String> filePaths) {

    public IdentityConflict {
        recordIds = List.copyOf(recordIds);
        filePaths = List.copyOf(filePaths);
    }
}
