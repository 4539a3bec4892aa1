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

public class FunctionLengthCheck implements PythonCheck {

    @Override
    public String id() {
        return "function-length";
    }

    @Override
    public String description() {
        return "Detects functions longer than the configured maximum";
    }

    @Override
    public List<Issue> check(Module module, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        int max = settings.maxFunctionLength();
        PyWalker.walk(module, new PyVisitor() {
            @Override
            public void visitFunction(FunctionDef function) {
                int start = function.span().line();
                int end = function.span().endLine();
                int length = end - start;
                if (length > max) {
                    issues.add(issueAt(source, start, end)
                            .title("Long Function: " + function.name())
                            .description("Function has " + length + " lines, exceeding the recommended " + max + " lines")
                            .severity(Severity.LOW)
                            .category(Category.CODE_SMELL)
                            .suggestedFix("Consider breaking this function into smaller, more focused functions.")
                            .metadata("length", length)
                            .build());
                }
            }
        });
        return issues;
    }
}
