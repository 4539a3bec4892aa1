package io.sagescan.detectors;

import io.sagescan.model.Category;
import io.sagescan.model.CodeMetrics;
import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.IssueIds;
import io.sagescan.model.Location;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;
import io.sagescan.python.PythonParser;
import io.sagescan.python.PythonSyntaxException;
import io.sagescan.python.ast.Module;
import io.sagescan.python.checks.BareExceptCheck;
import io.sagescan.python.checks.ComplexityCheck;
import io.sagescan.python.checks.CyclomaticComplexity;
import io.sagescan.python.checks.FunctionLengthCheck;
import io.sagescan.python.checks.IdentityLiteralCheck;
import io.sagescan.python.checks.MutableDefaultCheck;
import io.sagescan.python.checks.ParameterCountCheck;
import io.sagescan.python.checks.PythonCheck;
import io.sagescan.python.checks.WildcardImportCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * AST detector for Python sources.
 * <p>
 * A file that does not parse yields a single CRITICAL issue at the error position and a
 * successful record: the syntax error is the finding.
 */
public class PythonDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(PythonDetector.class);

    public static final String LANGUAGE = "python";

    private final AnalysisSettings settings;
    private final List<PythonCheck> checks;

    public PythonDetector(AnalysisSettings settings) {
        this(settings, defaultChecks());
    }

    public PythonDetector(AnalysisSettings settings, List<PythonCheck> checks) {
        this.settings = settings;
        this.checks = List.copyOf(checks);
    }

    public static List<PythonCheck> defaultChecks() {
        return List.of(
                new FunctionLengthCheck(),
                new ParameterCountCheck(),
                new ComplexityCheck(),
                new BareExceptCheck(),
                new WildcardImportCheck(),
                new MutableDefaultCheck(),
                new IdentityLiteralCheck()
        );
    }

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public boolean canAnalyze(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".py") || name.endsWith(".pyw");
    }

    @Override
    public FileRecord analyzeSource(SourceText source) {
        Module module;
        try {
            module = PythonParser.parse(source.content());
        } catch (PythonSyntaxException e) {
            log.debug("Syntax error in {} at {}:{}: {}", source.filePath(), e.line(), e.column(), e.getMessage());
            return FileRecord.succeeded(source.filePath(), LANGUAGE, List.of(syntaxIssue(source, e)), null);
        }

        List<Issue> issues = new ArrayList<>();
        for (PythonCheck check : checks) {
            issues.addAll(check.check(module, source, settings));
        }
        CodeMetrics metrics = source.lineMetrics(List.of("#")).withComplexity(CyclomaticComplexity.average(module));
        log.debug("Analyzed {}: {} issues", source.filePath(), issues.size());
        return FileRecord.succeeded(source.filePath(), LANGUAGE, issues, metrics);
    }

    private static Issue syntaxIssue(SourceText source, PythonSyntaxException e) {
        int line = Math.min(e.line(), Math.max(1, source.lineCount()));
        return Issue.builder()
                .id(IssueIds.of(source.filePath(), "syntax", line))
                .title("Python Syntax Error")
                .description(e.getMessage())
                .severity(Severity.CRITICAL)
                .category(Category.BUG)
                .location(new Location(source.filePath(), line, line, e.column(), null))
                .codeSnippet(source.snippet(line, line))
                .ruleId("syntax")
                .build();
    }
}
