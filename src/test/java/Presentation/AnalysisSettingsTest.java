package Presentation;

import Model.DirectoryCodeAndNumberExtractor;
import Model.FileNameCodeAndNumberExtractor;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisSettingsTest {

    @Test
    void defaultsApplyToEmptyProperties() {
        AnalysisSettings settings = AnalysisSettings.from(new Properties());

        assertThat(settings.databasePath()).isEqualTo("./ideduplicator_db");
        assertThat(settings.outputDir()).isEqualTo(Path.of("./processed"));
        assertThat(settings.extensions()).contains("jpg", "png", "tif");
        assertThat(settings.threads()).isGreaterThanOrEqualTo(2);
        assertThat(settings.extractorFor(Path.of("/x"))).isInstanceOf(FileNameCodeAndNumberExtractor.class);
    }

    @Test
    void parsesEveryKey() {
        Properties props = new Properties();
        props.setProperty(AnalysisSettings.DB_PATH, " /data/db ");
        props.setProperty(AnalysisSettings.OUTPUT_DIR, "/data/out");
        props.setProperty(AnalysisSettings.EXTENSIONS, ".JPG, tif ,,");
        props.setProperty(AnalysisSettings.THREADS, "3");
        props.setProperty(AnalysisSettings.CONVENTION, "Directory");

        AnalysisSettings settings = AnalysisSettings.from(props);

        assertThat(settings.databasePath()).isEqualTo("/data/db");
        assertThat(settings.extensions()).containsExactlyInAnyOrder("jpg", "tif");
        assertThat(settings.threads()).isEqualTo(3);
        assertThat(settings.extractorFor(Path.of("/x"))).isInstanceOf(DirectoryCodeAndNumberExtractor.class);
    }

    @Test
    void rejectsUnknownConventionAndBadThreadCount() {
        Properties convention = new Properties();
        convention.setProperty(AnalysisSettings.CONVENTION, "guess");
        assertThatThrownBy(() -> AnalysisSettings.from(convention)).isInstanceOf(IllegalArgumentException.class);

        Properties threads = new Properties();
        threads.setProperty(AnalysisSettings.THREADS, "0");
        assertThatThrownBy(() -> AnalysisSettings.from(threads)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void systemPropertyOverridesTheResource() {
        System.setProperty(AnalysisSettings.THREADS, "5");
        try {
            assertThat(AnalysisSettings.load().threads()).isEqualTo(5);
        } finally {
            System.clearProperty(AnalysisSettings.THREADS);
        }
    }
}
