package io.sagescan.rules;

import io.sagescan.model.Issue;
import io.sagescan.model.IssueIds;
import io.sagescan.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PatternDetectorTest {

    private PatternDetector detector;

    @BeforeEach
    void setUp() {
        detector = new PatternDetector(RuleCatalog.loadDefault());
    }

    @Test
    void matchFile_flagsHardcodedPassword() {
        List<Issue> issues = detector.matchFile("config.py", "password = \"hunter22\"\n", "python");

        assertThat(issues).hasSize(1);
        Issue issue = issues.get(0);
        assertThat(issue.ruleId()).isEqualTo("hardcoded-password");
        assertThat(issue.title()).isEqualTo("Hardcoded Password");
        assertThat(issue.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(issue.location().startLine()).isEqualTo(1);
        assertThat(issue.location().startColumn()).isEqualTo(1);
        assertThat(issue.location().endColumn()).isEqualTo(21);
        assertThat(issue.id()).isEqualTo(IssueIds.of("config.py", "hardcoded-password", 1));
        assertThat(issue.suggestedFix()).contains("environment variables");
    }

    @Test
    void matchFile_isCaseInsensitiveWhereFlagged() {
        List<Issue> issues = detector.matchFile("Config.java", "String PASSWORD = \"hunter22\";\n", "java");

        assertThat(issues).extracting(Issue::ruleId).containsExactly("hardcoded-password");
        assertThat(issues.get(0).location().startColumn()).isEqualTo(8);
    }

    @Test
    void matchFile_skipsRulesForOtherLanguages() {
        assertThat(detector.matchFile("main.go", "password = \"hunter22\"\n", "go")).isEmpty();
    }

    @Test
    void matchFile_reportsEveryMatchOnALine() {
        List<Issue> issues = detector.matchFile("a.py", "print(1); print(2)\n", "python");

        assertThat(issues).extracting(i -> i.location().startColumn()).containsExactly(1, 11);
        assertThat(issues).allMatch(Issue::autoFixable);
    }

    @Test
    void matchFile_reportsLineNumbers() {
        String content = "x = 1\n# TODO: tidy\ntry:\n    y()\nexcept ValueError: pass\n";

        List<Issue> issues = detector.matchFile("a.py", content, "python");

        assertThat(issues).extracting(Issue::ruleId, i -> i.location().startLine())
                .containsExactlyInAnyOrder(
                        tuple("todo-comment", 2),
                        tuple("except-pass", 5));
    }

    @Test
    void matchFile_appliesLineTransform() {
        PatternDetector blanking = new PatternDetector(RuleCatalog.loadDefault(), line -> " ".repeat(line.length()));

        assertThat(blanking.matchFile("a.py", "password = \"hunter22\"\n", "python")).isEmpty();
    }

    @Test
    void matchFile_returnsNothingForEmptyCatalog() {
        PatternDetector empty = new PatternDetector(RuleCatalog.empty());

        assertThat(empty.matchFile("a.py", "password = \"x\"\n", "python")).isEmpty();
    }
}
