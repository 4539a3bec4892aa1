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

/**
 * Flags functions declaring more ordinary parameters than allowed. Positional-only and
 * keyword-only parameters are not counted, nor are {@code *args} and {@code **kwargs}.
 */
public class ParameterCountCheck implements PythonCheck {

    @Override
    public String id() {
        return "parameter-count";
    }

    @Override
    public String description() {
        return "Detects functions with too many parameters";
    }

    @Override
    public List<Issue> check(Module module, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        PyWalker.walk(module, new PyVisitor() {
            @Override
            public void visitFunction(FunctionDef function) {
                int count = function.positionalOrKeywordParams().size();
                if (count > settings.maxParameters()) {
                    int line = function.span().line();
                    issues.add(issueAt(source, line, line)
                            .title("Too Many Parameters: " + function.name())
                            .description("Function has " + count + " parameters. Consider using a configuration object.")
                            .severity(Severity.LOW)
                            .category(Category.CODE_SMELL)
                            .metadata("parameters", count)
                            .build());
                }
            }
        });
        return issues;
    }
}
