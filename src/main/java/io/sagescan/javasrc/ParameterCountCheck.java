package io.sagescan.javasrc;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.CallableDeclaration;
import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Location;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;

import java.util.ArrayList;
import java.util.List;

public class ParameterCountCheck implements JavaCheck {

    @Override
    public String id() {
        return "parameter-count";
    }

    @Override
    public String description() {
        return "Detects methods and constructors with too many parameters";
    }

    @Override
    public List<Issue> check(CompilationUnit unit, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        for (CallableDeclaration<?> callable : JavaCheck.callables(unit)) {
            int count = callable.getParameters().size();
            if (count > settings.maxParameters()) {
                int line = callable.getName().getBegin().map(p -> p.line).orElse(JavaCheck.beginLine(callable));
                issues.add(issueAt(source, callable)
                        .location(Location.line(source.filePath(), line))
                        .codeSnippet(source.snippet(line, line))
                        .title("Too Many Parameters: " + callable.getNameAsString())
                        .description("Method has " + count + " parameters. Consider introducing a parameter object.")
                        .severity(Severity.LOW)
                        .category(Category.CODE_SMELL)
                        .metadata("parameters", count)
                        .build());
            }
        }
        return issues;
    }
}
