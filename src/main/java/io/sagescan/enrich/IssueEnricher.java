package io.sagescan.enrich;

import io.sagescan.model.Issue;

import java.util.List;

/**
 * Adds explanations and fix suggestions to already-ranked issues.
 */
public interface IssueEnricher {

    /**
     * Returns one issue per input issue, in the same order. An issue that cannot be
     * enriched is returned unchanged; implementations do not throw for per-issue failures.
     */
    List<Issue> enrich(List<Issue> issues);
}
