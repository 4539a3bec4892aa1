package io.sagescan.detectors;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import io.sagescan.javasrc.BroadCatchCheck;
import io.sagescan.javasrc.ComplexityCheck;
import io.sagescan.javasrc.JavaCheck;
import io.sagescan.javasrc.JavaComplexity;
import io.sagescan.javasrc.MethodLengthCheck;
import io.sagescan.javasrc.ParameterCountCheck;
import io.sagescan.javasrc.StringIdentityCheck;
import io.sagescan.javasrc.WildcardImportCheck;
import io.sagescan.model.Category;
import io.sagescan.model.CodeMetrics;
import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.IssueIds;
import io.sagescan.model.Location;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * AST detector for Java sources, built on JavaParser.
 * <p>
 * A parser instance is created per file since {@link JavaParser} is not thread-safe.
 */
public class JavaDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(JavaDetector.class);

    public static final String LANGUAGE = "java";

    private final AnalysisSettings settings;
    private final List<JavaCheck> checks;

    public JavaDetector(AnalysisSettings settings) {
        this(settings, defaultChecks());
    }

    public JavaDetector(AnalysisSettings settings, List<JavaCheck> checks) {
        this.settings = settings;
        this.checks = List.copyOf(checks);
    }

    public static List<JavaCheck> defaultChecks() {
        return List.of(
                new MethodLengthCheck(),
                new ParameterCountCheck(),
                new ComplexityCheck(),
                new BroadCatchCheck(),
                new WildcardImportCheck(),
                new StringIdentityCheck()
        );
    }

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public boolean canAnalyze(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".java");
    }

    @Override
    public FileRecord analyzeSource(SourceText source) {
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(source.content());

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            Issue issue = syntaxIssue(source, result.getProblems());
            log.debug("Syntax error in {} at line {}: {}", source.filePath(), issue.startLine(), issue.description());
            return FileRecord.succeeded(source.filePath(), LANGUAGE, List.of(issue), null);
        }

        CompilationUnit unit = result.getResult().get();
        List<Issue> issues = new ArrayList<>();
        for (JavaCheck check : checks) {
            issues.addAll(check.check(unit, source, settings));
        }
        CodeMetrics metrics = source.lineMetrics(List.of("//")).withComplexity(JavaComplexity.average(unit));
        log.debug("Analyzed {}: {} issues", source.filePath(), issues.size());
        return FileRecord.succeeded(source.filePath(), LANGUAGE, issues, metrics);
    }

    private static Issue syntaxIssue(SourceText source, List<Problem> problems) {
        Problem first = problems.isEmpty() ? null : problems.get(0);
        Optional<Range> range = first == null
                ? Optional.empty()
                : first.getLocation().flatMap(tokens -> tokens.getBegin().getRange());
        int line = range.map(r -> r.begin.line).orElse(1);
        line = Math.max(1, Math.min(line, Math.max(1, source.lineCount())));
        Integer column = range.map(r -> r.begin.column).orElse(null);
        String message = first != null ? first.getMessage() : "Unparseable compilation unit";
        return Issue.builder()
                .id(IssueIds.of(source.filePath(), "syntax", line))
                .title("Java Syntax Error")
                .description(firstLine(message))
                .severity(Severity.CRITICAL)
                .category(Category.BUG)
                .location(new Location(source.filePath(), line, line, column, null))
                .codeSnippet(source.snippet(line, line))
                .ruleId("syntax")
                .metadata("problems", problems.size())
                .build();
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline).trim() : message;
    }
}
