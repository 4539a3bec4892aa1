package io.sagescan.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Analysis outcome for a single file.
 *
 * @param filePath Path of the analysed file
 * @param language Detected language id, {@code unknown} when no detector claimed the file
 * @param issues   Issues found in the file; always empty when {@code success} is false
 * @param metrics  Code metrics (if computed)
 * @param duration Wall-clock analysis time
 * @param success  False only when the analysis itself could not complete
 * @param error    Error message for failed records
 */
public record FileRecord(
        String filePath,
        String language,
        List<Issue> issues,
        CodeMetrics metrics,
        Duration duration,
        boolean success,
        String error
) {
    public static final String UNKNOWN_LANGUAGE = "unknown";

    public FileRecord {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("filePath cannot be null or blank");
        }
        if (language == null || language.isBlank()) {
            language = UNKNOWN_LANGUAGE;
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
        if (!success && issues != null && !issues.isEmpty()) {
            throw new IllegalArgumentException("A failed record cannot carry issues: " + filePath);
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static FileRecord succeeded(String filePath, String language, List<Issue> issues, CodeMetrics metrics) {
        return new FileRecord(filePath, language, issues, metrics, Duration.ZERO, true, null);
    }

    public static FileRecord failed(String filePath, String language, String error) {
        return new FileRecord(filePath, language, List.of(), null, Duration.ZERO, false, error);
    }

    /**
     * Returns a copy whose issue list is replaced by the given one.
     */
    public FileRecord withIssues(List<Issue> newIssues) {
        if (!success) {
            return this;
        }
        return new FileRecord(filePath, language, newIssues, metrics, duration, success, error);
    }

    /**
     * Returns a copy with the given issues appended after the current ones.
     */
    public FileRecord withAdditionalIssues(List<Issue> extra) {
        if (!success || extra.isEmpty()) {
            return this;
        }
        List<Issue> merged = new ArrayList<>(issues);
        merged.addAll(extra);
        return withIssues(merged);
    }

    public FileRecord withDuration(Duration elapsed) {
        return new FileRecord(filePath, language, issues, metrics, elapsed, success, error);
    }

    public Optional<CodeMetrics> metricsIfPresent() {
        return Optional.ofNullable(metrics);
    }

    public List<Issue> issuesWithSeverity(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }

    public List<Issue> issuesInCategory(Category category) {
        return issues.stream().filter(i -> i.category() == category).toList();
    }
}
