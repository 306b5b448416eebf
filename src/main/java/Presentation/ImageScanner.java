package Presentation;

import Model.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.function.Consumer;

public final class ImageScanner {

    private static final Logger log = LoggerFactory.getLogger(ImageScanner.class);

    private final Set<String> extensions;

    public ImageScanner(Set<String> extensions) {
        this.extensions = Set.copyOf(extensions);
    }

    /**
     * Unreadable image files are still reported so they end up labelled as unhashed. Any other entry that cannot be
     * read, such as a directory, would silently shrink the record set, so the walk fails instead.
     */
    public void scan(Path root, Consumer<Path> onImageFound) {
        ImageVisitor visitor = new ImageVisitor(onImageFound);
        try {
            Files.walkFileTree(root, visitor);
        } catch (IOException e) {
            throw new AnalysisException("Cannot walk " + root, e);
        }
        if (!visitor.unreadable.isEmpty()) {
            throw new AnalysisException(visitor.unreadable.size() + " entries below " + root
                    + " could not be read, first: " + visitor.unreadable.get(0));
        }
    }

    public List<Path> collect(Path root) {
        List<Path> found = new ArrayList<>();
        scan(root, found::add);
        Collections.sort(found);
        return found;
    }

    private boolean looksLikeImage(Path p) {
        Path name = p.getFileName();
        if (name == null) return false;
        String s = name.toString().toLowerCase(Locale.ROOT);
        int dot = s.lastIndexOf('.');
        return dot >= 0 && extensions.contains(s.substring(dot + 1));
    }

    final class ImageVisitor extends SimpleFileVisitor<Path> {

        private final Consumer<Path> onImageFound;
        final List<Path> unreadable = new ArrayList<>();

        ImageVisitor(Consumer<Path> onImageFound) {
            this.onImageFound = onImageFound;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && looksLikeImage(file)) onImageFound.accept(file);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.warn("Cannot read {}: {}", file, exc.toString());
            if (looksLikeImage(file)) {
                onImageFound.accept(file);
            } else {
                unreadable.add(file);
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
