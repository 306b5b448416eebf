package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.BitSet;
import java.util.Optional;

public final class ColorCounter implements UniqueColorSource {

    private static final Logger log = LoggerFactory.getLogger(ColorCounter.class);

    private static final int RGB_SPACE = 1 << 24;

    /** Distinct 24-bit RGB values; alpha is ignored. */
    public int countUniqueColors(BufferedImage image) {
        BitSet seen = new BitSet(RGB_SPACE);
        int w = image.getWidth();
        int h = image.getHeight();
        int[] row = new int[w];

        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int argb : row) seen.set(argb & 0xFFFFFF);
        }
        return seen.cardinality();
    }

    @Override
    public Optional<Integer> uniqueColors(String filePath) {
        try {
            BufferedImage img = ImageIO.read(Path.of(filePath).toFile());
            if (img == null) {
                log.warn("Cannot count colors of undecodable image {}", filePath);
                return Optional.empty();
            }
            return Optional.of(countUniqueColors(img));
        } catch (IOException | RuntimeException e) {
            log.warn("Cannot count colors of {}: {}", filePath, e.toString());
            return Optional.empty();
        }
    }
}
