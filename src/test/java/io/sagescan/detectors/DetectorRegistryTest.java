package io.sagescan.detectors;

import io.sagescan.model.FileRecord;
import io.sagescan.model.SourceText;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void createDefault_registersBuiltInLanguages() {
        DetectorRegistry registry = DetectorRegistry.createDefault(AnalysisSettings.defaults());

        assertThat(registry.supportedLanguages()).containsExactly("python", "java", "typescript", "javascript");
    }

    @Test
    void getDetector_dispatchesOnFileName() {
        DetectorRegistry registry = DetectorRegistry.createDefault(AnalysisSettings.defaults());

        assertThat(registry.languageOf(Path.of("a.py"))).isEqualTo("python");
        assertThat(registry.languageOf(Path.of("A.java"))).isEqualTo("java");
        assertThat(registry.languageOf(Path.of("c.tsx"))).isEqualTo("typescript");
        assertThat(registry.languageOf(Path.of("d.jsx"))).isEqualTo("javascript");
        assertThat(registry.languageOf(Path.of("e.rb"))).isEqualTo(FileRecord.UNKNOWN_LANGUAGE);
        assertThat(registry.getDetector(Path.of("e.rb"))).isEmpty();
    }

    @Test
    void getDetector_prefersEarlierRegistration() {
        Detector first = new StubDetector("first");
        Detector second = new StubDetector("second");

        DetectorRegistry registry = DetectorRegistry.of(first, second);

        assertThat(registry.getDetector(Path.of("x.stub"))).containsSame(first);
    }

    @Test
    void register_failsOnceFrozen() {
        DetectorRegistry registry = DetectorRegistry.of(new StubDetector("one")).freeze();

        assertThat(registry.isFrozen()).isTrue();
        assertThatThrownBy(() -> registry.register(new StubDetector("two")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("frozen");
        assertThat(registry.allDetectors()).hasSize(1);
    }

    @Test
    void analyzeWithTiming_turnsRuntimeFailureIntoFailedRecord() throws IOException {
        Path file = Files.writeString(tempDir.resolve("x.stub"), "content");
        Detector exploding = new StubDetector("boom") {
            @Override
            public FileRecord analyzeSource(SourceText source) {
                throw new IllegalStateException("detector bug");
            }
        };

        FileRecord record = exploding.analyzeWithTiming(file);

        assertThat(record.success()).isFalse();
        assertThat(record.error()).isEqualTo("IllegalStateException: detector bug");
        assertThat(record.issues()).isEmpty();
    }

    @Test
    void analyze_turnsUnreadableFileIntoFailedRecord() {
        FileRecord record = new StubDetector("stub").analyze(tempDir.resolve("missing.stub"));

        assertThat(record.success()).isFalse();
        assertThat(record.error()).isNotBlank();
    }

    private static class StubDetector implements Detector {
        private final String language;

        StubDetector(String language) {
            this.language = language;
        }

        @Override
        public String language() {
            return language;
        }

        @Override
        public boolean canAnalyze(Path path) {
            return path.toString().endsWith(".stub");
        }

        @Override
        public FileRecord analyzeSource(SourceText source) {
            return FileRecord.succeeded(source.filePath(), language, java.util.List.of(), null);
        }
    }
}
