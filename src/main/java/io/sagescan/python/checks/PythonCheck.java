package io.sagescan.python.checks;

import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Issue;
import io.sagescan.model.IssueIds;
import io.sagescan.model.Location;
import io.sagescan.model.SourceText;
import io.sagescan.python.ast.Module;

import java.util.List;

/**
 * One structural check over a parsed Python module.
 * Checks are independent of each other: each returns its own issue list.
 */
public interface PythonCheck {

    /**
     * Returns a unique identifier for this check. Also used as the issue's rule id.
     */
    String id();

    /**
     * Returns a human-readable description of what this check finds.
     */
    String description();

    List<Issue> check(Module module, SourceText source, AnalysisSettings settings);

    /**
     * Starts an issue at the given lines with id, location, snippet and rule id filled in.
     */
    default Issue.Builder issueAt(SourceText source, int line, int endLine) {
        return Issue.builder()
                .id(IssueIds.of(source.filePath(), id(), line))
                .location(Location.lines(source.filePath(), line, endLine))
                .codeSnippet(source.snippet(line, endLine))
                .ruleId(id());
    }
}
