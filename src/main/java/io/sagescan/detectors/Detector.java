package io.sagescan.detectors;

import io.sagescan.discovery.FileAccessException;
import io.sagescan.discovery.SourceReader;
import io.sagescan.model.FileRecord;
import io.sagescan.model.SourceText;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Analyzes files of one language.
 * <p>
 * Implementations are stateless: every call builds its own issue list, so one instance
 * can serve many worker threads at once. Expected failures (unreadable file, invalid
 * syntax) never escape as exceptions; they become a failed record or an issue.
 */
public interface Detector {

    /**
     * Returns the language id this detector reports, e.g. {@code python}.
     */
    String language();

    /**
     * Returns true if this detector handles the given file. Decided by file name only.
     */
    boolean canAnalyze(Path path);

    /**
     * Analyzes already-read content.
     *
     * @return a successful record, unless the detector itself could not complete
     */
    FileRecord analyzeSource(SourceText source);

    /**
     * Reads and analyzes a file. An unreadable file yields a failed record.
     */
    default FileRecord analyze(Path path) {
        SourceText source;
        try {
            source = SourceText.of(path.toString(), new SourceReader().read(path));
        } catch (FileAccessException e) {
            return FileRecord.failed(path.toString(), language(), e.getMessage());
        }
        return analyzeSource(source);
    }

    /**
     * Runs {@link #analyze(Path)} and records its wall-clock duration, whatever the outcome.
     * An unexpected runtime exception is turned into a failed record.
     */
    default FileRecord analyzeWithTiming(Path path) {
        long start = System.nanoTime();
        FileRecord record;
        try {
            record = analyze(path);
        } catch (RuntimeException e) {
            record = FileRecord.failed(path.toString(), language(), describeFailure(e));
        }
        return record.withDuration(Duration.ofNanos(System.nanoTime() - start));
    }

    static String describeFailure(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }
}
