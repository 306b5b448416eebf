package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

/**
 * Reads pixel dimensions from the image header without decoding the pixel data.
 */
public class ImageMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(ImageMetadataReader.class);

    public Optional<ImageMetadata> read(Path path) {
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            if (in == null) return Optional.empty();

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                log.debug("No image reader for {}", path);
                return Optional.empty();
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return Optional.of(new ImageMetadata(reader.getWidth(0), reader.getHeight(0)));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Cannot read resolution of {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
