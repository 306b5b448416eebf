package Model;

import java.util.Locale;
import java.util.Optional;

/**
 * Derives the {@code codeAndNumber} join key from a file path, by naming convention.
 */
public interface CodeAndNumberExtractor {

    /** File names carrying one of these markers were deliberately left unlinked by the archive. */
    String[] UNLINKED_MARKERS = {"_OGK", "_OGKB"};

    Optional<String> extract(String filePath);

    static boolean isMarkedUnlinked(String fileName) {
        String upper = fileName.toUpperCase(Locale.ROOT);
        for (String marker : UNLINKED_MARKERS) {
            if (upper.contains(marker)) return true;
        }
        return false;
    }
}
