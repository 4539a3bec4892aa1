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

public class ComplexityCheck implements JavaCheck {

    @Override
    public String id() {
        return "complexity";
    }

    @Override
    public String description() {
        return "Detects methods whose cyclomatic complexity exceeds the configured maximum";
    }

    @Override
    public List<Issue> check(CompilationUnit unit, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        int max = settings.maxComplexity();
        for (CallableDeclaration<?> callable : JavaCheck.callables(unit)) {
            int complexity = JavaComplexity.of(callable);
            if (complexity > max) {
                issues.add(issueAt(source, callable)
                        .title("High Complexity: " + callable.getNameAsString())
                        .description("Cyclomatic complexity of " + complexity + " exceeds threshold of " + max)
                        .severity(Severity.MEDIUM)
                        .category(Category.COMPLEXITY)
                        .suggestedFix("Consider breaking this method into smaller, more focused methods.")
                        .metadata("complexity", complexity)
                        .build());
            }
        }
        return issues;
    }
}
