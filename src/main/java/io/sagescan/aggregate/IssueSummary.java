package io.sagescan.aggregate;

import io.sagescan.model.Category;
import io.sagescan.model.Severity;

import java.util.Map;

/**
 * Issue statistics over a project result.
 *
 * @param byFile Issue count per file with at least one issue, highest count first
 */
public record IssueSummary(
        int totalIssues,
        Map<Severity, Integer> bySeverity,
        Map<Category, Integer> byCategory,
        Map<String, Integer> byFile,
        int autoFixable,
        int highPriority,
        int filesWithIssues,
        int filesWithoutIssues
) {
}
