package io.sagescan.engine;

import io.sagescan.model.Category;
import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.ProjectResult;
import io.sagescan.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the final {@link ProjectResult} from per-file records.
 */
public class ResultAssembler {

    public ProjectResult assemble(String projectPath, Instant startedAt, List<FileRecord> records, Duration totalTime) {
        Map<String, Integer> languages = new LinkedHashMap<>();
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        Map<Category, Integer> byCategory = new EnumMap<>(Category.class);
        int totalIssues = 0;
        int autoFixable = 0;

        for (FileRecord record : records) {
            languages.merge(record.language(), 1, Integer::sum);
            for (Issue issue : record.issues()) {
                totalIssues++;
                bySeverity.merge(issue.severity(), 1, Integer::sum);
                byCategory.merge(issue.category(), 1, Integer::sum);
                if (issue.autoFixable()) {
                    autoFixable++;
                }
            }
        }

        return new ProjectResult(
                projectPath,
                startedAt,
                records,
                records.size(),
                totalIssues,
                totalTime,
                languages,
                new ProjectResult.RunSummary(bySeverity, byCategory, autoFixable)
        );
    }
}
