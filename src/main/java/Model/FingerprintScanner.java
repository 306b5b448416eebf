package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;

/**
 * Fingerprints files on a worker pool. Per-file failures become explicit outcomes on the record
 * (no digests, or no pixel-derived fields) and never abort the scan.
 */
public final class FingerprintScanner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FingerprintScanner.class);

    private final ExecutorService pool;
    private final FingerprintCache cache;
    private final Fingerprinter fingerprinter;
    private final ImageMetadataReader metadataReader;

    public FingerprintScanner(FingerprintCache cache, int threads) {
        this(cache, new Fingerprinter(), new ImageMetadataReader(), threads);
    }

    public FingerprintScanner(FingerprintCache cache, Fingerprinter fingerprinter, ImageMetadataReader metadataReader, int threads) {
        this.cache = cache;
        this.fingerprinter = Objects.requireNonNull(fingerprinter);
        this.metadataReader = Objects.requireNonNull(metadataReader);
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads));
    }

    public static int defaultThreads() {
        return Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    }

    public CompletableFuture<List<ImageRecord>> scanAsync(List<Path> images) {
        List<CompletableFuture<ImageRecord>> futures = new ArrayList<>(images.size());
        for (Path p : images) {
            futures.add(CompletableFuture.supplyAsync(() -> fingerprint(p), pool));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(done -> {
                    List<ImageRecord> records = new ArrayList<>(futures.size());
                    for (CompletableFuture<ImageRecord> f : futures) records.add(f.join());
                    records.sort(Comparator.comparing(ImageRecord::filePath));
                    return records;
                });
    }

    public List<ImageRecord> scan(List<Path> images) {
        try {
            return scanAsync(images).join();
        } catch (CompletionException e) {
            throw new AnalysisException("Fingerprinting failed", e.getCause());
        }
    }

    ImageRecord fingerprint(Path p) {
        String filePath = p.toAbsolutePath().normalize().toString();

        long lastModified;
        long size;
        try {
            lastModified = Files.getLastModifiedTime(p).toMillis();
            size = Files.size(p);
        } catch (IOException e) {
            log.warn("Cannot stat {}: {}", filePath, e.toString());
            return ImageRecord.unhashed(filePath);
        }

        if (cache != null) {
            var cached = cache.get(filePath);
            if (cached.isPresent() && cached.get().matches(lastModified, size)) {
                return cached.get().record();
            }
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(p);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", filePath, e.toString());
            return ImageRecord.unhashed(filePath);
        }

        ImageMetadata metadata = metadataReader.read(p).orElse(null);
        ImageRecord record = fingerprinter.fingerprint(filePath, bytes, decode(filePath, bytes), metadata);

        if (cache != null) cache.put(record, lastModified, size);
        return record;
    }

    private static BufferedImage decode(String filePath, byte[] bytes) {
        try {
            BufferedImage img = ImageIO.read(new ByteArrayInputStream(bytes));
            if (img == null) log.warn("Undecodable image {}", filePath);
            return img;
        } catch (IOException | RuntimeException e) {
            log.warn("Undecodable image {}: {}", filePath, e.toString());
            return null;
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
