package Model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class FingerprintScannerTest {

    @TempDir
    Path dir;

    private FingerprintCache cache;

    @BeforeEach
    void open() {
        cache = new FingerprintCache("jdbc:h2:mem:scanner-" + UUID.randomUUID());
    }

    @AfterEach
    void close() {
        cache.close();
    }

    private List<Path> archive() throws Exception {
        BufferedImage original = TestImages.pattern(64, 48, 4);
        Path png = TestImages.write(dir.resolve("ACC1_INV1.png"), original, "png");
        Path copy = Files.copy(png, dir.resolve("copy.png"));
        Path bmp = TestImages.write(dir.resolve("reencoded.bmp"), original, "bmp");
        Path corrupt = Files.write(dir.resolve("corrupt.jpg"), new byte[]{(byte) 0xFF, (byte) 0xD8, 0x00, 0x11});
        Path missing = dir.resolve("missing.jpg");
        return List.of(missing, corrupt, bmp, copy, png);
    }

    private static Map<String, ImageRecord> byName(List<ImageRecord> records) {
        return records.stream().collect(Collectors.toMap(r -> Path.of(r.filePath()).getFileName().toString(), Function.identity()));
    }

    @Test
    void fingerprintsEveryPathAndLabelsFailures() throws Exception {
        List<ImageRecord> records;
        try (FingerprintScanner scanner = new FingerprintScanner(cache, 2)) {
            records = scanner.scan(archive());
        }

        assertThat(records).extracting(ImageRecord::filePath).isSorted().hasSize(5);
        Map<String, ImageRecord> r = byName(records);

        assertThat(r.get("missing.jpg").isHashed()).isFalse();
        assertThat(r.get("corrupt.jpg").isHashed()).isTrue();
        assertThat(r.get("corrupt.jpg").hasPerceptualHash()).isFalse();

        assertThat(r.get("copy.png").contentHex()).isEqualTo(r.get("ACC1_INV1.png").contentHex());
        assertThat(r.get("reencoded.bmp").contentHex()).isNotEqualTo(r.get("ACC1_INV1.png").contentHex());
        assertThat(r.get("reencoded.bmp").perceptualHex()).isEqualTo(r.get("ACC1_INV1.png").perceptualHex());
        assertThat(r.get("ACC1_INV1.png").pixelCount()).isEqualTo(64L * 48);
        assertThat(r.get("ACC1_INV1.png").hasColorData()).isFalse();
    }

    @Test
    void unchangedFilesAreServedFromTheCache() throws Exception {
        List<Path> paths = archive();
        List<ImageRecord> first;
        try (FingerprintScanner scanner = new FingerprintScanner(cache, 2)) {
            first = scanner.scan(paths);
        }

        Fingerprinter fingerprinter = mock(Fingerprinter.class);
        ImageMetadataReader metadataReader = mock(ImageMetadataReader.class);
        List<ImageRecord> second;
        try (FingerprintScanner scanner = new FingerprintScanner(cache, fingerprinter, metadataReader, 2)) {
            second = scanner.scan(paths);
        }

        assertThat(second).isEqualTo(first);
        verifyNoInteractions(fingerprinter, metadataReader);
    }

    @Test
    void changedFileIsFingerprintedAgain() throws Exception {
        Path png = TestImages.write(dir.resolve("a.png"), TestImages.pattern(32, 32, 1), "png");
        String before;
        try (FingerprintScanner scanner = new FingerprintScanner(cache, 1)) {
            before = scanner.scan(List.of(png)).get(0).contentHex();
        }

        TestImages.write(png, TestImages.pattern(40, 40, 2), "png");
        Files.setLastModifiedTime(png, java.nio.file.attribute.FileTime.fromMillis(System.currentTimeMillis() + 60_000));

        try (FingerprintScanner scanner = new FingerprintScanner(cache, 1)) {
            ImageRecord after = scanner.scan(List.of(png)).get(0);
            assertThat(after.contentHex()).isNotEqualTo(before);
            assertThat(after.pixelCount()).isEqualTo(1600L);
        }
    }

    @Test
    void worksWithoutACache() throws Exception {
        try (FingerprintScanner scanner = new FingerprintScanner(null, 1)) {
            assertThat(scanner.scan(archive())).hasSize(5);
        }
    }
}
