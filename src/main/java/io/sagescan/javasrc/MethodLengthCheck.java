package io.sagescan.javasrc;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.CallableDeclaration;
import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags methods and constructors whose line span exceeds the configured maximum.
 */
public class MethodLengthCheck implements JavaCheck {

    @Override
    public String id() {
        return "method-length";
    }

    @Override
    public String description() {
        return "Detects methods longer than the configured maximum";
    }

    @Override
    public List<Issue> check(CompilationUnit unit, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        int max = settings.maxFunctionLength();
        for (CallableDeclaration<?> callable : JavaCheck.callables(unit)) {
            int start = JavaCheck.beginLine(callable);
            int end = callable.getEnd().map(p -> p.line).orElse(start);
            int length = end - start;
            if (length > max) {
                issues.add(issueAt(source, callable)
                        .title("Long Method: " + callable.getNameAsString())
                        .description("Method has " + length + " lines, exceeding the recommended " + max + " lines")
                        .severity(Severity.LOW)
                        .category(Category.CODE_SMELL)
                        .suggestedFix("Extract parts of the method into smaller, well-named methods.")
                        .metadata("length", length)
                        .build());
            }
        }
        return issues;
    }
}
