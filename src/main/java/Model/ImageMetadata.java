package Model;

public record ImageMetadata(int xResolution, int yResolution) {

    public ImageMetadata {
        if (xResolution < 0 || yResolution < 0) {
            throw new IllegalArgumentException("Resolution must be >= 0: " + xResolution + "x" + yResolution);
        }
    }
}
