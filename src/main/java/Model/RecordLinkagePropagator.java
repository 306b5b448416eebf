package Model;

import java.util.*;

/**
 * Links every record to an external record: directly through its file name, or else through a directly linked
 * member of a group it belongs to. The exact-duplicate group is consulted first; the similarity group only when
 * the exact group has no direct link at all. Single hop, computed once.
 */
public final class RecordLinkagePropagator {

    private final CodeAndNumberExtractor extractor;

    public RecordLinkagePropagator(CodeAndNumberExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor);
    }

    public LinkageReport link(Collection<ImageRecord> records,
                              List<? extends ImageGroup> exactGroups,
                              List<? extends ImageGroup> similarityGroups,
                              ExternalRecordTable table) {
        List<ImageRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(ImageRecord::filePath));

        Map<String, String> keyByPath = new HashMap<>();
        Map<String, ExternalRecord> directByPath = new HashMap<>();
        for (ImageRecord r : sorted) {
            Optional<String> key = extractor.extract(r.filePath());
            if (key.isEmpty()) continue;
            keyByPath.put(r.filePath(), key.get());
            table.findByCodeAndNumber(key.get()).ifPresent(x -> directByPath.put(r.filePath(), x));
        }

        Map<String, ImageGroup> exactByPath = index(exactGroups);
        Map<String, ImageGroup> similarByPath = index(similarityGroups);

        Map<ImageGroup, SortedSet<String>> directIds = new IdentityHashMap<>();
        List<IdentityConflict> conflicts = new ArrayList<>();
        for (List<? extends ImageGroup> partition : List.of(exactGroups, similarityGroups)) {
            for (ImageGroup g : partition) {
                SortedSet<String> ids = new TreeSet<>();
                for (ImageRecord m : g.members()) {
                    ExternalRecord x = directByPath.get(m.filePath());
                    if (x != null) ids.add(x.recordId());
                }
                directIds.put(g, ids);
                if (ids.size() > 1) {
                    conflicts.add(new IdentityConflict(g.kind(), g.key(), new ArrayList<>(ids),
                            g.members().stream().map(ImageRecord::filePath).toList()));
                }
            }
        }

        List<LinkageResult> results = new ArrayList<>(sorted.size());
        for (ImageRecord r : sorted) {
            String path = r.filePath();
            String key = keyByPath.get(path);

            ExternalRecord direct = directByPath.get(path);
            if (direct != null) {
                results.add(LinkageResult.direct(path, key, direct.recordId()));
                continue;
            }

            LinkageResult viaGroup = null;
            for (ImageGroup g : Arrays.asList(exactByPath.get(path), similarByPath.get(path))) {
                if (g == null) continue;

                SortedSet<String> ids = directIds.get(g);
                if (ids.size() > 1) {
                    viaGroup = LinkageResult.conflicted(path, key, g);
                    break;
                }
                if (ids.size() == 1) {
                    viaGroup = LinkageResult.propagated(path, key, ids.first(), g);
                    break;
                }
            }
            results.add(viaGroup != null ? viaGroup : LinkageResult.unlinked(path, key));
        }

        return new LinkageReport(results, conflicts);
    }

    private static Map<String, ImageGroup> index(List<? extends ImageGroup> groups) {
        Map<String, ImageGroup> byPath = new HashMap<>();
        for (ImageGroup g : groups) {
            for (ImageRecord m : g.members()) {
                ImageGroup previous = byPath.putIfAbsent(m.filePath(), g);
                if (previous != null && previous != g) {
                    throw new IllegalArgumentException(m.filePath() + " is in both " + previous.key() + " and " + g.key());
                }
            }
        }
        return byPath;
    }
}
