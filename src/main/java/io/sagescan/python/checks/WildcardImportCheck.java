package io.sagescan.python.checks;

import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;
import io.sagescan.python.ast.ImportFrom;
import io.sagescan.python.ast.Module;
import io.sagescan.python.ast.PyVisitor;
import io.sagescan.python.ast.PyWalker;

import java.util.ArrayList;
import java.util.List;

public class WildcardImportCheck implements PythonCheck {

    @Override
    public String id() {
        return "wildcard-import";
    }

    @Override
    public String description() {
        return "Detects 'from module import *'";
    }

    @Override
    public List<Issue> check(Module module, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        PyWalker.walk(module, new PyVisitor() {
            @Override
            public void visitImportFrom(ImportFrom importFrom) {
                if (!importFrom.isWildcard()) {
                    return;
                }
                String from = importFrom.module() != null
                        ? ".".repeat(importFrom.level()) + importFrom.module()
                        : ".".repeat(importFrom.level());
                issues.add(issueAt(source, importFrom.span().line(), importFrom.span().endLine())
                        .title("Wildcard Import")
                        .description("Avoid wildcard imports from " + from + ". Import specific names instead.")
                        .severity(Severity.LOW)
                        .category(Category.BEST_PRACTICE)
                        .build());
            }
        });
        return issues;
    }
}
