package Model;

import java.util.*;
import java.util.function.Function;

/**
 * Partitions records into exact-duplicate groups. Membership needs both the weak and the content digest to agree;
 * agreement on only one of them is reported as a collision instead.
 */
public final class ExactDuplicateClassifier {

    public ExactDuplicateReport classify(Collection<ImageRecord> records) {
        List<String> unhashed = new ArrayList<>();
        List<ImageRecord> hashed = new ArrayList<>();
        for (ImageRecord r : records) {
            if (r.isHashed()) hashed.add(r);
            else unhashed.add(r.filePath());
        }
        Collections.sort(unhashed);
        hashed.sort(Comparator.comparing(ImageRecord::filePath));

        Map<String, List<ImageRecord>> byWeak = bucket(hashed, ImageRecord::weakHex);
        Map<String, List<ImageRecord>> byContent = bucket(hashed, ImageRecord::contentHex);

        List<DuplicateGroup> groups = new ArrayList<>();
        for (var weakBucket : byWeak.entrySet()) {
            if (weakBucket.getValue().size() < 2) continue;

            for (var pair : bucket(weakBucket.getValue(), ImageRecord::contentHex).entrySet()) {
                if (pair.getValue().size() < 2) continue;
                groups.add(new DuplicateGroup(weakBucket.getKey(), pair.getKey(), pair.getValue()));
            }
        }

        return new ExactDuplicateReport(
                groups,
                collisions(CollisionKind.WEAK, byWeak, ImageRecord::contentHex),
                collisions(CollisionKind.STRONG, byContent, ImageRecord::weakHex),
                unhashed);
    }

    // A bucket collides when it spans more than one value of the other digest; every member is reported.
    private static List<CollisionGroup> collisions(CollisionKind kind,
                                                   Map<String, List<ImageRecord>> buckets,
                                                   Function<ImageRecord, String> otherDigest) {
        List<CollisionGroup> out = new ArrayList<>();
        for (var b : buckets.entrySet()) {
            if (b.getValue().size() < 2) continue;

            Set<String> distinct = new HashSet<>();
            for (ImageRecord r : b.getValue()) distinct.add(otherDigest.apply(r));
            if (distinct.size() > 1) out.add(new CollisionGroup(kind, b.getKey(), b.getValue()));
        }
        return out;
    }

    private static Map<String, List<ImageRecord>> bucket(List<ImageRecord> sorted, Function<ImageRecord, String> key) {
        Map<String, List<ImageRecord>> out = new TreeMap<>();
        for (ImageRecord r : sorted) {
            out.computeIfAbsent(key.apply(r), k -> new ArrayList<>()).add(r);
        }
        return out;
    }
}
