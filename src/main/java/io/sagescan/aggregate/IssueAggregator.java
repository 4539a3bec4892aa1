package io.sagescan.aggregate;

import io.sagescan.model.Category;
import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.ProjectResult;
import io.sagescan.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Project-wide issue operations: deduplication, similarity grouping, ranking, filtering
 * and summary statistics. Stateless apart from the similarity threshold.
 */
public class IssueAggregator {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;

    static final int AUTO_FIX_BONUS = 5;

    private final double similarityThreshold;

    public IssueAggregator() {
        this(DEFAULT_SIMILARITY_THRESHOLD);
    }

    public IssueAggregator(double similarityThreshold) {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1], was " + similarityThreshold);
        }
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * Drops exact duplicates. Two issues are duplicates when file path, start line, title and
     * category all match; the first occurrence is kept. Ids play no part.
     */
    public List<Issue> deduplicate(List<Issue> issues) {
        Set<Signature> seen = new HashSet<>();
        List<Issue> unique = new ArrayList<>();
        for (Issue issue : issues) {
            if (seen.add(Signature.of(issue))) {
                unique.add(issue);
            }
        }
        return unique;
    }

    /**
     * Groups issues that tell the same story.
     * <p>
     * Each issue not yet grouped starts a group and pulls in every later ungrouped issue with
     * the same category and severity whose title and description are both at least
     * {@code similarityThreshold} similar to it. Candidates are compared with the group's
     * first member only, so chains of near-duplicates may end up in separate groups.
     *
     * @return groups with more than one member, keyed by the first member's id, in input order
     */
    public Map<String, List<Issue>> findSimilar(List<Issue> issues) {
        Map<String, List<Issue>> groups = new LinkedHashMap<>();
        boolean[] grouped = new boolean[issues.size()];

        for (int i = 0; i < issues.size(); i++) {
            if (grouped[i]) {
                continue;
            }
            Issue representative = issues.get(i);
            grouped[i] = true;
            List<Issue> group = new ArrayList<>();
            group.add(representative);

            for (int j = i + 1; j < issues.size(); j++) {
                if (!grouped[j] && areSimilar(representative, issues.get(j))) {
                    group.add(issues.get(j));
                    grouped[j] = true;
                }
            }
            if (group.size() > 1) {
                groups.merge(representative.id(), group, (existing, added) -> {
                    List<Issue> merged = new ArrayList<>(existing);
                    merged.addAll(added);
                    return merged;
                });
            }
        }
        return groups;
    }

    boolean areSimilar(Issue a, Issue b) {
        if (a.category() != b.category() || a.severity() != b.severity()) {
            return false;
        }
        if (SequenceMatcher.ratio(a.title(), b.title()) < similarityThreshold) {
            return false;
        }
        return SequenceMatcher.ratio(a.description(), b.description()) >= similarityThreshold;
    }

    /**
     * Sorts by descending priority. The sort is stable: equal priorities keep input order.
     */
    public List<Issue> rank(List<Issue> issues) {
        List<Issue> ranked = new ArrayList<>(issues);
        ranked.sort(Comparator.comparingDouble(IssueAggregator::priority).reversed());
        return ranked;
    }

    /**
     * {@code (severity weight + category weight) * confidence}, plus a flat bonus when auto-fixable.
     */
    public static double priority(Issue issue) {
        double score = (issue.severity().weight() + issue.category().weight()) * issue.confidence();
        return issue.autoFixable() ? score + AUTO_FIX_BONUS : score;
    }

    public List<Issue> filter(List<Issue> issues, IssueFilter filter) {
        return issues.stream().filter(filter).toList();
    }

    public IssueSummary summarize(ProjectResult result) {
        List<Issue> issues = result.allIssues();
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        Map<Category, Integer> byCategory = new EnumMap<>(Category.class);
        int autoFixable = 0;
        int highPriority = 0;
        for (Issue issue : issues) {
            bySeverity.merge(issue.severity(), 1, Integer::sum);
            byCategory.merge(issue.category(), 1, Integer::sum);
            if (issue.autoFixable()) {
                autoFixable++;
            }
            if (issue.severity() == Severity.CRITICAL || issue.severity() == Severity.HIGH) {
                highPriority++;
            }
        }

        List<FileRecord> withIssues = result.files().stream()
                .filter(f -> !f.issues().isEmpty())
                .sorted(Comparator.comparingInt((FileRecord f) -> f.issues().size()).reversed())
                .toList();
        Map<String, Integer> byFile = new LinkedHashMap<>();
        for (FileRecord file : withIssues) {
            byFile.merge(file.filePath(), file.issues().size(), Integer::sum);
        }

        return new IssueSummary(
                issues.size(),
                bySeverity,
                byCategory,
                byFile,
                autoFixable,
                highPriority,
                withIssues.size(),
                result.files().size() - withIssues.size()
        );
    }

    private record Signature(String filePath, int line, String title, Category category) {
        static Signature of(Issue issue) {
            return new Signature(issue.filePath(), issue.startLine(), issue.title(), issue.category());
        }
    }
}
