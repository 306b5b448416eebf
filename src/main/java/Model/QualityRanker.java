package Model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Dense-ranks each group's members by {@link QualityKey}. Equal keys share a rank and the next distinct key
 * gets the next integer, so ties stay visible instead of being broken arbitrarily.
 */
public final class QualityRanker {

    private static final Comparator<ImageRecord> ORDER =
            Comparator.comparing(QualityKey::of).thenComparing(ImageRecord::filePath);

    public RankedGroup rank(ImageGroup group) {
        List<ImageRecord> sorted = new ArrayList<>(group.members());
        sorted.sort(ORDER);

        List<RankedMember> ranked = new ArrayList<>(sorted.size());
        QualityKey previous = null;
        int rank = 0;
        for (ImageRecord r : sorted) {
            QualityKey key = QualityKey.of(r);
            if (previous == null || key.compareTo(previous) != 0) rank++;
            ranked.add(new RankedMember(r, rank));
            previous = key;
        }
        return new RankedGroup(group, ranked);
    }

    public List<RankedGroup> rankAll(List<? extends ImageGroup> groups) {
        List<RankedGroup> out = new ArrayList<>(groups.size());
        for (ImageGroup g : groups) out.add(rank(g));
        return out;
    }
}
