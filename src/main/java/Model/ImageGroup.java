package Model;

import java.util.List;

public interface ImageGroup {

    GroupKind kind();

    String key();

    /** Ordered by file path, never fewer than two. */
    List<ImageRecord> members();
}
