package Model;

/**
 * Ranking key of one record. Natural order is best first: color data present, more colors, more pixels.
 */
public record QualityKey(boolean colorPresent, int uniqueColors, long pixelCount) implements Comparable<QualityKey> {

    public static QualityKey of(ImageRecord r) {
        return new QualityKey(r.hasColorData(), r.hasColorData() ? r.numUniqueColors() : 0, r.pixelCount());
    }

    @Override
    public int compareTo(QualityKey o) {
        int c = Boolean.compare(o.colorPresent, colorPresent);
        if (c != 0) return c;
        c = Integer.compare(o.uniqueColors, uniqueColors);
        if (c != 0) return c;
        return Long.compare(o.pixelCount, pixelCount);
    }
}
