package io.sagescan.report;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    @Test
    void render_printsSummarySectionsWithoutColors() {
        String out = new ConsoleReporter(false).render(ReportFixtures.sampleResult());

        assertThat(out).doesNotContain("\u001B[");
        assertThat(out).contains(
                "SAGE-SCAN REPORT",
                "Project: /work/demo",
                "Scanned: 3 files | 1 failed",
                "Issues: 2 critical | 0 high | 1 medium | 1 low | 0 info",
                "Auto-fixable: 1",
                "Languages: javascript (1) python (2)",
                "CATEGORY BREAKDOWN",
                "  security: 2");
    }

    @Test
    void render_groupsIssuesByFileMostIssuesFirst() {
        String out = new ConsoleReporter(false).render(ReportFixtures.sampleResult());

        assertThat(out).contains(
                "ISSUES BY FILE (2 files)",
                "src/app.py [3 issues]",
                "  [CRIT] line 1: Hardcoded Password",
                "  [MED]  line 7: Bare Except Clause (auto-fixable)",
                "  [LOW]  line 2: Var Declaration");
        assertThat(out.indexOf("src/app.py [3 issues]")).isLessThan(out.indexOf("lib\\win.js [1 issues]"));
    }

    @Test
    void render_listsFailedFilesAndCriticalFooter() {
        String out = new ConsoleReporter(false).render(ReportFixtures.sampleResult());

        assertThat(out).contains(
                "FAILED FILES (1)",
                "  broken.py - Python Syntax Error",
                "ACTION REQUIRED: 2 critical issue(s) must be fixed.",
                "Run with --detailed for code snippets and fixes.");
        assertThat(out).doesNotContain("Fix: ");
    }

    @Test
    void render_detailedModeShowsSnippetAndFix() {
        String out = new ConsoleReporter(false, true).render(ReportFixtures.sampleResult());

        assertThat(out).contains(
                "      →    1 | password = \"hunter22\"",
                "      Fix: Use environment variables for credentials");
        assertThat(out).doesNotContain("Run with --detailed");
    }

    @Test
    void render_colorsSeverityWhenEnabled() {
        String out = new ConsoleReporter(true).render(ReportFixtures.sampleResult());

        assertThat(out).contains("\u001B[31m[CRIT]\u001B[0m");
    }

    @Test
    void render_reportsCleanRun() {
        String out = new ConsoleReporter(false).render(ReportFixtures.emptyResult());

        assertThat(out).contains("No issues found.", "Issues: 0 critical");
        assertThat(out).doesNotContain("ISSUES BY FILE", "FAILED FILES", "CATEGORY BREAKDOWN");
    }
}
