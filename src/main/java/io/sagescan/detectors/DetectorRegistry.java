package io.sagescan.detectors;

import io.sagescan.model.FileRecord;
import io.sagescan.rules.RuleCatalog;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of detectors.
 * <p>
 * Lookup returns the first registered detector that accepts a file, so registration order
 * decides between detectors whose extensions overlap. A registry belongs to one engine;
 * it is frozen before the engine starts dispatching and is read-only afterwards.
 */
public class DetectorRegistry {

    private final List<Detector> detectors = new ArrayList<>();
    private volatile boolean frozen;

    /**
     * Creates a registry with the built-in detectors. TypeScript is registered before
     * JavaScript so the more specific detector is tried first.
     */
    public static DetectorRegistry createDefault(AnalysisSettings settings) {
        DetectorRegistry registry = new DetectorRegistry();
        registry.register(new PythonDetector(settings));
        registry.register(new JavaDetector(settings));
        RuleCatalog lexical = RuleCatalog.loadLexical();
        registry.register(new LexicalDetector(LexicalDetector.TYPESCRIPT, lexical));
        registry.register(new LexicalDetector(LexicalDetector.JAVASCRIPT, lexical));
        return registry;
    }

    /**
     * Creates an unfrozen registry with specific detectors.
     */
    public static DetectorRegistry of(Detector... detectors) {
        DetectorRegistry registry = new DetectorRegistry();
        for (Detector detector : detectors) {
            registry.register(detector);
        }
        return registry;
    }

    /**
     * Appends a detector. Earlier registrations win on overlapping extensions.
     *
     * @throws IllegalStateException if the registry is frozen
     */
    public synchronized void register(Detector detector) {
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; cannot register " + detector.language());
        }
        detectors.add(detector);
    }

    /**
     * Makes the registry read-only. Idempotent.
     */
    public synchronized DetectorRegistry freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Returns the first detector whose {@link Detector#canAnalyze(Path)} accepts the file.
     */
    public Optional<Detector> getDetector(Path path) {
        for (Detector detector : snapshot()) {
            if (detector.canAnalyze(path)) {
                return Optional.of(detector);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the distinct language ids, in registration order.
     */
    public List<String> supportedLanguages() {
        LinkedHashSet<String> languages = new LinkedHashSet<>();
        for (Detector detector : snapshot()) {
            languages.add(detector.language());
        }
        return List.copyOf(languages);
    }

    public List<Detector> allDetectors() {
        return snapshot();
    }

    private List<Detector> snapshot() {
        if (frozen) {
            return Collections.unmodifiableList(detectors);
        }
        synchronized (this) {
            return List.copyOf(detectors);
        }
    }

    /**
     * Detects the language of a file from its name, or {@code unknown}.
     */
    public String languageOf(Path path) {
        return getDetector(path).map(Detector::language).orElse(FileRecord.UNKNOWN_LANGUAGE);
    }
}
