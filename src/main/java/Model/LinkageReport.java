package Model;

import java.util.*;

public record LinkageReport(List<LinkageResult> results, List<IdentityConflict> conflicts) {

    public LinkageReport {
        results = List.copyOf(results);
        conflicts = List.copyOf(conflicts);
    }

    public Optional<LinkageResult> find(String filePath) {
        return results.stream().filter(r -> r.filePath().equals(filePath)).findFirst();
    }

    public Map<LinkageStatus, Integer> countByStatus() {
        Map<LinkageStatus, Integer> counts = new EnumMap<>(LinkageStatus.class);
        for (LinkageStatus s : LinkageStatus.values()) counts.put(s, 0);
        for (LinkageResult r : results) counts.merge(r.status(), 1, Integer::sum);
        return counts;
    }
}
