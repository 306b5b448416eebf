package Model;

import java.util.*;

/**
 * Groups records by exact perceptual-hash equality. No distance threshold: a hash seen once is not a group.
 * Independent of {@link ExactDuplicateClassifier}, the two partitions may overlap.
 */
public final class SimilarityClassifier {

    public List<SimilarityGroup> classify(Collection<ImageRecord> records) {
        Map<String, List<ImageRecord>> byHash = new TreeMap<>();
        for (ImageRecord r : records) {
            if (!r.hasPerceptualHash()) continue;
            byHash.computeIfAbsent(r.perceptualHex(), k -> new ArrayList<>()).add(r);
        }

        List<SimilarityGroup> groups = new ArrayList<>();
        for (var e : byHash.entrySet()) {
            if (e.getValue().size() < 2) continue;

            List<ImageRecord> members = new ArrayList<>(e.getValue());
            members.sort(Comparator.comparing(ImageRecord::filePath));
            groups.add(new SimilarityGroup(e.getKey(), members));
        }
        return groups;
    }
}
