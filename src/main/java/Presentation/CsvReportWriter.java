package Presentation;

import Model.*;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class CsvReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    public static final String IMAGE_RECORDS = "imageRecords.csv";
    public static final String EXACT_DUPLICATES = "exactDuplicates.csv";
    public static final String COLLISION_CANDIDATES = "collisionCandidates.csv";
    public static final String SIMILAR_IMAGES = "similarImages.csv";
    public static final String RANKED_MEMBERS = "rankedMembers.csv";
    public static final String LINKAGE_RESULTS = "linkageResults.csv";
    public static final String IDENTITY_CONFLICTS = "identityConflicts.csv";

    private final CsvMapper mapper = new CsvMapper();
    private final Path outputDir;

    public CsvReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public void write(AnalysisResult result) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create " + outputDir, e);
        }

        List<Map<String, Object>> records = new ArrayList<>();
        for (ImageRecord r : result.records()) {
            records.add(row("filePath", r.filePath(), "contentDigest", r.contentHex(), "weakDigest", r.weakHex(),
                    "averageHash", r.averageHex(), "perceptualHash", r.perceptualHex(),
                    "xResolution", r.xResolution(), "yResolution", r.yResolution(),
                    "numUniqueColors", r.numUniqueColors()));
        }
        write(IMAGE_RECORDS, records);

        List<Map<String, Object>> duplicates = new ArrayList<>();
        for (DuplicateGroup g : result.exactDuplicates().groups()) {
            for (ImageRecord m : g.members()) {
                duplicates.add(row("weakDigest", g.weakDigest(), "contentDigest", g.contentDigest(), "filePath", m.filePath()));
            }
        }
        write(EXACT_DUPLICATES, duplicates);

        List<Map<String, Object>> collisions = new ArrayList<>();
        List<CollisionGroup> allCollisions = new ArrayList<>(result.exactDuplicates().weakCollisions());
        allCollisions.addAll(result.exactDuplicates().strongCollisions());
        for (CollisionGroup c : allCollisions) {
            for (ImageRecord m : c.members()) {
                collisions.add(row("collisionKind", c.kind(), "sharedDigest", c.sharedDigest(), "filePath", m.filePath(),
                        "contentDigest", m.contentHex(), "weakDigest", m.weakHex()));
            }
        }
        write(COLLISION_CANDIDATES, collisions);

        List<Map<String, Object>> similar = new ArrayList<>();
        for (SimilarityGroup g : result.similarityGroups()) {
            for (ImageRecord m : g.members()) similar.add(row("perceptualHash", g.perceptualHash(), "filePath", m.filePath()));
        }
        write(SIMILAR_IMAGES, similar);

        List<Map<String, Object>> ranked = new ArrayList<>();
        for (RankedGroup g : result.rankedGroups()) {
            boolean ambiguous = g.ambiguousBest();
            for (RankedMember m : g.members()) {
                ranked.add(row("groupKind", g.kind(), "groupKey", g.key(), "filePath", m.filePath(),
                        "rank", m.rank(), "ambiguousBest", ambiguous));
            }
        }
        write(RANKED_MEMBERS, ranked);

        List<Map<String, Object>> linkage = new ArrayList<>();
        for (LinkageResult r : result.linkage().results()) {
            linkage.add(row("filePath", r.filePath(), "codeAndNumber", r.codeAndNumber(), "recordId", r.recordId(),
                    "status", r.status(), "viaGroupKind", r.viaGroupKind(), "viaGroupKey", r.viaGroupKey()));
        }
        write(LINKAGE_RESULTS, linkage);

        List<Map<String, Object>> conflicts = new ArrayList<>();
        for (IdentityConflict c : result.linkage().conflicts()) {
            conflicts.add(row("groupKind", c.groupKind(), "groupKey", c.groupKey(),
                    "recordIds", String.join(";", c.recordIds()), "filePaths", String.join(";", c.filePaths())));
        }
        write(IDENTITY_CONFLICTS, conflicts);

        log.info("Wrote CSV reports to {}", outputDir.toAbsolutePath());
    }

    private void write(String fileName, List<Map<String, Object>> rows) {
        Path target = outputDir.resolve(fileName);
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             SequenceWriter seq = mapper.writer(schemaFor(fileName)).writeValues(out)) {
            for (Map<String, Object> row : rows) seq.write(row);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

    private static CsvSchema schemaFor(String fileName) {
        CsvSchema.Builder b = CsvSchema.builder();
        for (String column : columns(fileName)) b.addColumn(column);
        return b.build().withHeader();
    }

    static List<String> columns(String fileName) {
        return switch (fileName) {
            case IMAGE_RECORDS -> List.of("filePath", "contentDigest", "weakDigest", "averageHash", "perceptualHash",
                    "xResolution", "yResolution", "numUniqueColors");
            case EXACT_DUPLICATES -> List.of("weakDigest", "contentDigest", "filePath");
            case COLLISION_CANDIDATES -> List.of("collisionKind", "sharedDigest", "filePath", "contentDigest", "weakDigest");
            case SIMILAR_IMAGES -> List.of("perceptualHash", "filePath");
            case RANKED_MEMBERS -> List.of("groupKind", "groupKey", "filePath", "rank", "ambiguousBest");
            case LINKAGE_RESULTS -> List.of("filePath", "codeAndNumber", "recordId", "status", "viaGroupKind", "viaGroupKey");
            case IDENTITY_CONFLICTS -> List.of("groupKind", "groupKey", "recordIds", "filePaths");
            default -> throw new IllegalArgumentException("Unknown report " + fileName);
        };
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object v = keyValues[i + 1];
            row.put((String) keyValues[i], v instanceof Enum<?> e ? e.name() : v);
        }
        return row;
    }
}
