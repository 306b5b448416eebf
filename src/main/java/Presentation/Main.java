package Presentation;

import Model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@code Main <imageRoot> [recordsCsv]}: fingerprints every image below the root, classifies, ranks and links them,
 * then stores the tables in H2 and exports them as CSV.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, AnalysisSettings.load()));
    }

    static int run(String[] args, AnalysisSettings settings) {
        if (args.length < 1 || args.length > 2) {
            log.error("Usage: Main <imageRoot> [recordsCsv]");
            return USAGE;
        }

        Path root = Path.of(args[0]).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            log.error("Not a directory: {}", root);
            return USAGE;
        }
        Path recordsCsv = args.length == 2 ? Path.of(args[1]) : null;
        if (recordsCsv != null && !Files.isRegularFile(recordsCsv)) {
            log.error("Records file not found: {}", recordsCsv);
            return USAGE;
        }

        try {
            List<Path> images = new ImageScanner(settings.extensions()).collect(root);
            log.info("Found {} images below {}", images.size(), root);
            if (images.isEmpty()) throw new AnalysisException("No images found below " + root);

            ExternalRecordTable table = recordsCsv == null
                    ? ExternalRecordTable.empty()
                    : new ExternalRecordReader().read(recordsCsv);

            List<ImageRecord> records;
            try (FingerprintCache cache = FingerprintCache.openFile(settings.databasePath());
                 FingerprintScanner scanner = new FingerprintScanner(cache, settings.threads())) {
                records = scanner.scan(images);
            }

            AnalysisResult result = new ImageAnalysis(settings.extractorFor(root)).run(records, table);

            try (AnalysisStore store = AnalysisStore.openFile(settings.databasePath())) {
                store.save(result, table);
                log.info("{} removal candidates among exact duplicates, {} among similar images, {} ambiguous groups",
                        store.removalCandidates(GroupKind.EXACT_DUPLICATE).size(),
                        store.removalCandidates(GroupKind.SIMILAR).size(),
                        store.ambiguousBestGroups(GroupKind.EXACT_DUPLICATE).size()
                                + store.ambiguousBestGroups(GroupKind.SIMILAR).size());
            }
            new CsvReportWriter(settings.outputDir()).write(result);
            return OK;
        } catch (AnalysisException e) {
            log.error("Analysis failed: {}", e.getMessage(), e);
            return FAILED;
        } catch (StoreException | UncheckedIOException e) {
            log.error("Run failed: {}", e.getMessage(), e);
            return FAILED;
        }
    }
}
