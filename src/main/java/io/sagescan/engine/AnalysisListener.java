package io.sagescan.engine;

import java.nio.file.Path;

/**
 * Receives per-file state changes during a run.
 * <p>
 * In parallel mode callbacks arrive on worker threads, so implementations must be thread-safe.
 */
@FunctionalInterface
public interface AnalysisListener {

    AnalysisListener NONE = (file, state) -> { };

    void onStateChange(Path file, FileState state);
}
