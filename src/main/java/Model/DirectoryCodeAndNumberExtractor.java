package Model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code <root>/<accession>/<inventory>/.../file}: the first two directories below the scan root.
 */
public final class DirectoryCodeAndNumberExtractor implements CodeAndNumberExtractor {

    private final Path root;

    public DirectoryCodeAndNumberExtractor(Path root) {
        this.root = Objects.requireNonNull(root).toAbsolutePath().normalize();
    }

    @Override
    public Optional<String> extract(String filePath) {
        Path file = Path.of(filePath).toAbsolutePath().normalize();
        Path parent = file.getParent();
        if (parent == null || !parent.startsWith(root)) return Optional.empty();
        if (CodeAndNumberExtractor.isMarkedUnlinked(file.getFileName().toString())) return Optional.empty();

        Path relative = root.relativize(parent);
        if (relative.getNameCount() < 2 || relative.toString().isEmpty()) return Optional.empty();

        try {
            return Optional.of(CodeAndNumber.deriveKey(relative.getName(0).toString(), relative.getName(1).toString()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
