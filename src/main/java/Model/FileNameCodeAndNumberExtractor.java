package Model;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code <accession>_<inventory>[_anything].<ext>}, e.g. {@code ACC123_INV45.jpg}.
 */
public final class FileNameCodeAndNumberExtractor implements CodeAndNumberExtractor {

    private static final Pattern STEM = Pattern.compile("^([^_\\\\]+)_([^_\\\\]+)(?:_.*)?$");

    @Override
    public Optional<String> extract(String filePath) {
        Path name = Path.of(filePath).getFileName();
        if (name == null) return Optional.empty();

        String fileName = name.toString();
        if (CodeAndNumberExtractor.isMarkedUnlinked(fileName)) return Optional.empty();

        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;

        Matcher m = STEM.matcher(stem);
        if (!m.matches()) return Optional.empty();

        try {
            return Optional.of(CodeAndNumber.deriveKey(m.group(1), m.group(2)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
