package Presentation;

import Model.CodeAndNumberExtractor;
import Model.DirectoryCodeAndNumberExtractor;
import Model.FileNameCodeAndNumberExtractor;
import Model.FingerprintScanner;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Settings from {@code ideduplicator.properties} on the classpath; a JVM system property of the same name wins.
 */
public record AnalysisSettings(
        String databasePath,
        Path outputDir,
        Set<String> extensions,
        int threads,
        String fileNameConvention
) {

    public static final String RESOURCE = "/ideduplicator.properties";

    public static final String DB_PATH = "ideduplicator.db.path";
    public static final String OUTPUT_DIR = "ideduplicator.output.dir";
    public static final String EXTENSIONS = "ideduplicator.extensions";
    public static final String THREADS = "ideduplicator.threads";
    public static final String CONVENTION = "ideduplicator.filename.convention";

    public static final String CONVENTION_FILENAME = "filename";
    public static final String CONVENTION_DIRECTORY = "directory";

    public AnalysisSettings {
        extensions = Set.copyOf(extensions);
        if (threads < 1) throw new IllegalArgumentException(THREADS + " must be >= 1: " + threads);
        if (!CONVENTION_FILENAME.equals(fileNameConvention) && !CONVENTION_DIRECTORY.equals(fileNameConvention)) {
            throw new IllegalArgumentException("Unknown " + CONVENTION + ": " + fileNameConvention);
        }
    }

    public static AnalysisSettings load() {
        Properties props = new Properties();
        try (InputStream in = AnalysisSettings.class.getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        for (String key : List.of(DB_PATH, OUTPUT_DIR, EXTENSIONS, THREADS, CONVENTION)) {
            String override = System.getProperty(key);
            if (override != null) props.setProperty(key, override);
        }
        return from(props);
    }

    public static AnalysisSettings from(Properties props) {
        Set<String> extensions = new LinkedHashSet<>();
        for (String ext : props.getProperty(EXTENSIONS, "jpg,jpeg,png,bmp,gif,tif,tiff").split(",")) {
            String e = ext.trim().toLowerCase(Locale.ROOT);
            if (e.startsWith(".")) e = e.substring(1);
            if (!e.isEmpty()) extensions.add(e);
        }

        String threads = props.getProperty(THREADS, "").trim();
        return new AnalysisSettings(
                props.getProperty(DB_PATH, "./ideduplicator_db").trim(),
                Path.of(props.getProperty(OUTPUT_DIR, "./processed").trim()),
                extensions,
                threads.isEmpty() ? FingerprintScanner.defaultThreads() : Integer.parseInt(threads),
                props.getProperty(CONVENTION, CONVENTION_FILENAME).trim().toLowerCase(Locale.ROOT));
    }

    public CodeAndNumberExtractor extractorFor(Path root) {
        return CONVENTION_DIRECTORY.equals(fileNameConvention)
                ? new DirectoryCodeAndNumberExtractor(root)
                : new FileNameCodeAndNumberExtractor();
    }
}
