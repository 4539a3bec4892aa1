package io.sagescan.aggregate;

import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Optional, ANDed issue predicates.
 *
 * @param minSeverity     Lowest severity kept (inclusive), or null for any
 * @param categories      Categories kept; null or empty for any
 * @param autoFixableOnly Keep only auto-fixable issues
 */
public record IssueFilter(Severity minSeverity, Set<Category> categories, boolean autoFixableOnly)
        implements Predicate<Issue> {

    public static final IssueFilter NONE = new IssueFilter(null, null, false);

    public IssueFilter {
        categories = categories == null ? Set.of() : Set.copyOf(categories);
    }

    public static IssueFilter minSeverity(Severity severity) {
        return new IssueFilter(severity, null, false);
    }

    public IssueFilter withCategories(Set<Category> newCategories) {
        return new IssueFilter(minSeverity, newCategories, autoFixableOnly);
    }

    public IssueFilter autoFixable() {
        return new IssueFilter(minSeverity, categories, true);
    }

    @Override
    public boolean test(Issue issue) {
        if (minSeverity != null && !issue.severity().isAtLeast(minSeverity)) {
            return false;
        }
        if (!categories.isEmpty() && !categories.contains(issue.category())) {
            return false;
        }
        return !autoFixableOnly || issue.autoFixable();
    }
}
