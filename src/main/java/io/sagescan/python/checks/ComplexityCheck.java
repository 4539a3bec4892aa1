package io.sagescan.python.checks;

import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;
import io.sagescan.python.ast.FunctionDef;
import io.sagescan.python.ast.Module;
import io.sagescan.python.ast.PyVisitor;
import io.sagescan.python.ast.PyWalker;

import java.util.ArrayList;
import java.util.List;

public class ComplexityCheck implements PythonCheck {

    @Override
    public String id() {
        return "complexity";
    }

    @Override
    public String description() {
        return "Detects functions whose cyclomatic complexity exceeds the configured maximum";
    }

    @Override
    public List<Issue> check(Module module, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        int max = settings.maxComplexity();
        PyWalker.walk(module, new PyVisitor() {
            @Override
            public void visitFunction(FunctionDef function) {
                int complexity = CyclomaticComplexity.of(function);
                if (complexity > max) {
                    issues.add(issueAt(source, function.span().line(), function.span().endLine())
                            .title("High Complexity: " + function.name())
                            .description("Cyclomatic complexity of " + complexity + " exceeds threshold of " + max)
                            .severity(Severity.MEDIUM)
                            .category(Category.COMPLEXITY)
                            .suggestedFix("Consider breaking this function into smaller, more focused functions.")
                            .metadata("complexity", complexity)
                            .build());
                }
            }
        });
        return issues;
    }
}
