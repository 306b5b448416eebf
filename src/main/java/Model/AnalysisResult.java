package Model;

import java.util.ArrayList;
import java.util.List;

public record AnalysisResult(
        List<ImageRecord> records,
        ExactDuplicateReport exactDuplicates,
        List<SimilarityGroup> similarityGroups,
        List<RankedGroup> rankedExactGroups,
        List<RankedGroup> rankedSimilarityGroups,
        LinkageReport linkage
) {

    public AnalysisResult {
        records = List.copyOf(records);
        similarityGroups = List.copyOf(similarityGroups);
        rankedExactGroups = List.copyOf(rankedExactGroups);
        rankedSimilarityGroups = List.copyOf(rankedSimilarityGroups);
    }

    public List<RankedGroup> rankedGroups() {
        List<RankedGroup> all = new ArrayList<>(rankedExactGroups);
        all.addAll(rankedSimilarityGroups);
        return all;
    }

    public long hashedCount() {
        return records.stream().filter(ImageRecord::isHashed).count();
    }
}
