package io.sagescan.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Complete analysis result for a project.
 *
 * @param projectPath Path that was analysed
 * @param timestamp   When the run started
 * @param files       One record per discovered file, in discovery order
 * @param totalFiles  Number of file records
 * @param totalIssues Number of issues across all records
 * @param totalTime   Wall-clock time of the whole run
 * @param languages   Number of files per language
 * @param summary     Severity, category and auto-fixable counts
 */
public record ProjectResult(
        String projectPath,
        Instant timestamp,
        List<FileRecord> files,
        int totalFiles,
        int totalIssues,
        Duration totalTime,
        Map<String, Integer> languages,
        RunSummary summary
) {
    public ProjectResult {
        if (projectPath == null) {
            throw new IllegalArgumentException("projectPath cannot be null");
        }
        files = files == null ? List.of() : List.copyOf(files);
        languages = languages == null ? Map.of() : Map.copyOf(languages);
        if (totalTime == null) {
            totalTime = Duration.ZERO;
        }
    }

    /**
     * Severity, category and auto-fixable counts over all issues of a run.
     */
    public record RunSummary(
            Map<Severity, Integer> severityCounts,
            Map<Category, Integer> categoryCounts,
            int autoFixableCount
    ) {
        public RunSummary {
            severityCounts = severityCounts == null ? Map.of() : Map.copyOf(severityCounts);
            categoryCounts = categoryCounts == null ? Map.of() : Map.copyOf(categoryCounts);
        }
    }

    public List<Issue> allIssues() {
        return files.stream()
                .flatMap(f -> f.issues().stream())
                .toList();
    }

    public int countBySeverity(Severity severity) {
        return summary.severityCounts().getOrDefault(severity, 0);
    }

    public int countByCategory(Category category) {
        return summary.categoryCounts().getOrDefault(category, 0);
    }

    /**
     * Returns true if there are any critical issues. The CLI fails the run on this.
     */
    public boolean hasCriticalIssues() {
        return countBySeverity(Severity.CRITICAL) > 0;
    }

    public long failedFileCount() {
        return files.stream().filter(f -> !f.success()).count();
    }
}
