package io.sagescan.report;

import io.sagescan.engine.ResultAssembler;
import io.sagescan.model.Category;
import io.sagescan.model.CodeMetrics;
import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.IssueIds;
import io.sagescan.model.Location;
import io.sagescan.model.ProjectResult;
import io.sagescan.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A small result shared by the reporter tests: two analysed files, one failed file.
 */
final class ReportFixtures {

    static final Instant STARTED = Instant.parse("2024-01-15T10:00:00Z");

    private ReportFixtures() {
    }

    static ProjectResult sampleResult() {
        Issue password = Issue.builder()
                .id(IssueIds.of("src/app.py", "hardcoded-password", 1))
                .title("Hardcoded Password")
                .description("Password literal assigned in source")
                .severity(Severity.CRITICAL)
                .category(Category.SECURITY)
                .location(new Location("src/app.py", 1, 1, 1, 21))
                .codeSnippet("→    1 | password = \"hunter22\"")
                .suggestedFix("Use environment variables for credentials")
                .ruleId("hardcoded-password")
                .build();
        Issue secondPassword = password.toBuilder()
                .id(IssueIds.of("src/app.py", "hardcoded-password", 3))
                .location(new Location("src/app.py", 3, 3, 1, 21))
                .build();
        Issue bareExcept = Issue.builder()
                .id(IssueIds.of("src/app.py", "bare-except", 7))
                .title("Bare Except Clause")
                .description("Catches every exception including SystemExit")
                .severity(Severity.MEDIUM)
                .category(Category.CODE_SMELL)
                .location(Location.lines("src/app.py", 7, 8))
                .autoFixable(true)
                .confidence(0.8)
                .ruleId("bare-except")
                .build();
        Issue varDeclaration = Issue.builder()
                .id(IssueIds.of("lib\\win.js", "var", 2))
                .title("Var Declaration")
                .severity(Severity.LOW)
                .category(Category.STYLE)
                .location(Location.line("lib\\win.js", 2))
                .build();

        List<FileRecord> records = List.of(
                FileRecord.succeeded("src/app.py", "python", List.of(password, secondPassword, bareExcept),
                        new CodeMetrics(10, 8, 1, 1, 2.0)),
                FileRecord.succeeded("lib\\win.js", "javascript", List.of(varDeclaration), null),
                FileRecord.failed("broken.py", "python", "Python Syntax Error"));

        return new ResultAssembler().assemble("/work/demo", STARTED, records, Duration.ofMillis(1500));
    }

    static ProjectResult emptyResult() {
        return new ResultAssembler().assemble("/work/empty", STARTED, List.of(), Duration.ZERO);
    }
}
