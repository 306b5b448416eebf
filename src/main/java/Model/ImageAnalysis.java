package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * One full pass over a fixed record set: classify, rank, link. Same input in any order gives the same result.
 */
public final class ImageAnalysis {

    private static final Logger log = LoggerFactory.getLogger(ImageAnalysis.class);

    private final ExactDuplicateClassifier exactClassifier;
    private final SimilarityClassifier similarityClassifier;
    private final QualityRanker ranker;
    private final RecordLinkagePropagator propagator;
    private final UniqueColorSource colors;

    public ImageAnalysis(CodeAndNumberExtractor extractor) {
        this(extractor, new ColorCounter());
    }

    public ImageAnalysis(CodeAndNumberExtractor extractor, UniqueColorSource colors) {
        this(new ExactDuplicateClassifier(), new SimilarityClassifier(), new QualityRanker(),
                new RecordLinkagePropagator(extractor), colors);
    }

    public ImageAnalysis(ExactDuplicateClassifier exactClassifier,
                         SimilarityClassifier similarityClassifier,
                         QualityRanker ranker,
                         RecordLinkagePropagator propagator,
                         UniqueColorSource colors) {
        this.exactClassifier = exactClassifier;
        this.similarityClassifier = similarityClassifier;
        this.ranker = ranker;
        this.propagator = propagator;
        this.colors = Objects.requireNonNull(colors);
    }

    public AnalysisResult run(Collection<ImageRecord> input, ExternalRecordTable table) {
        if (input.isEmpty()) throw new AnalysisException("No images to analyse");

        List<ImageRecord> sorted = new ArrayList<>(input);
        sorted.sort(Comparator.comparing(ImageRecord::filePath));
        requireUniquePaths(sorted);

        if (sorted.stream().noneMatch(ImageRecord::isHashed)) {
            throw new AnalysisException("Hashing failed for all " + sorted.size() + " images");
        }

        List<ImageRecord> records = withColorCounts(sorted);

        ExactDuplicateReport exact = exactClassifier.classify(records);
        List<SimilarityGroup> similar = similarityClassifier.classify(records);
        List<RankedGroup> rankedExact = ranker.rankAll(exact.groups());
        List<RankedGroup> rankedSimilar = ranker.rankAll(similar);
        LinkageReport linkage = propagator.link(records, exact.groups(), similar, table);

        log.info("{} images: {} unhashed, {} exact-duplicate groups, {} weak / {} strong collisions, {} similarity groups",
                records.size(), exact.unhashed().size(), exact.groups().size(),
                exact.weakCollisions().size(), exact.strongCollisions().size(), similar.size());
        log.info("Linkage {}, {} identity conflicts", linkage.countByStatus(), linkage.conflicts().size());

        return new AnalysisResult(records, exact, similar, rankedExact, rankedSimilar, linkage);
    }

    /**
     * Counts colors only for the members of each similarity group that share the group's largest pixel count, and
     * clears them everywhere else. Color presence thereby marks the largest images and the count only separates them.
     */
    private List<ImageRecord> withColorCounts(List<ImageRecord> records) {
        Set<String> largest = new HashSet<>();
        for (SimilarityGroup g : similarityClassifier.classify(records)) {
            long max = g.members().stream().mapToLong(ImageRecord::pixelCount).max().orElse(0L);
            for (ImageRecord m : g.members()) {
                if (m.pixelCount() == max) largest.add(m.filePath());
            }
        }

        List<ImageRecord> out = new ArrayList<>(records.size());
        for (ImageRecord r : records) {
            if (!largest.contains(r.filePath())) {
                out.add(r.hasColorData() ? r.withUniqueColors(null) : r);
            } else if (r.hasColorData()) {
                out.add(r);
            } else {
                out.add(r.withUniqueColors(colors.uniqueColors(r.filePath()).orElse(null)));
            }
        }
        log.debug("Counted colors for {} of {} images", largest.size(), records.size());
        return out;
    }

    private static void requireUniquePaths(List<ImageRecord> sorted) {
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).filePath().equals(sorted.get(i - 1).filePath())) {
                throw new IllegalArgumentException("Duplicate file path " + sorted.get(i).filePath());
            }
        }
    }
}
