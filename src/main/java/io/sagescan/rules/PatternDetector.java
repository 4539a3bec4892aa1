package io.sagescan.rules;

import io.sagescan.model.Issue;
import io.sagescan.model.IssueIds;
import io.sagescan.model.Location;
import io.sagescan.model.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;

/**
 * Evaluates a {@link RuleCatalog} against file content, line by line.
 * <p>
 * Every match of every applicable rule produces one issue. Columns are 1-based;
 * the end column is the position of the last matched character.
 * Instances are immutable and safe to share between worker threads.
 */
public class PatternDetector {

    private final RuleCatalog catalog;
    private final UnaryOperator<String> lineTransform;

    public PatternDetector(RuleCatalog catalog) {
        this(catalog, UnaryOperator.identity());
    }

    /**
     * @param lineTransform Applied to each line before matching; must preserve the line's length
     *                      for reported columns to stay meaningful
     */
    public PatternDetector(RuleCatalog catalog, UnaryOperator<String> lineTransform) {
        this.catalog = catalog;
        this.lineTransform = lineTransform;
    }

    public RuleCatalog catalog() {
        return catalog;
    }

    public List<Issue> matchFile(String filePath, String content, String language) {
        return matchFile(SourceText.of(filePath, content), language);
    }

    public List<Issue> matchFile(SourceText source, String language) {
        List<Rule> rules = catalog.rulesFor(language);
        if (rules.isEmpty()) {
            return List.of();
        }

        List<String> lines = new ArrayList<>(source.lineCount());
        for (String line : source.lines()) {
            lines.add(lineTransform.apply(line));
        }

        List<Issue> issues = new ArrayList<>();
        for (Rule rule : rules) {
            for (int i = 0; i < lines.size(); i++) {
                Matcher m = rule.pattern().matcher(lines.get(i));
                while (m.find()) {
                    issues.add(toIssue(source, rule, i + 1, m.start() + 1, Math.max(m.end(), m.start() + 1)));
                }
            }
        }
        return issues;
    }

    private Issue toIssue(SourceText source, Rule rule, int line, int startColumn, int endColumn) {
        return Issue.builder()
                .id(IssueIds.of(source.filePath(), rule.id(), line))
                .title(rule.name())
                .description(rule.message())
                .severity(rule.severity())
                .category(rule.category())
                .location(new Location(source.filePath(), line, line, startColumn, endColumn))
                .codeSnippet(source.snippet(line, line))
                .suggestedFix(rule.fixSuggestion())
                .autoFixable(rule.autoFixable())
                .ruleId(rule.id())
                .build();
    }
}
