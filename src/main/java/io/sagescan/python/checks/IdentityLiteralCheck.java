package io.sagescan.python.checks;

import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;
import io.sagescan.python.ast.Compare;
import io.sagescan.python.ast.Module;
import io.sagescan.python.ast.PyVisitor;
import io.sagescan.python.ast.PyWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags {@code is} / {@code is not} against number, string and bytes literals.
 * Only the right-hand operand is inspected.
 */
public class IdentityLiteralCheck implements PythonCheck {

    @Override
    public String id() {
        return "is-literal";
    }

    @Override
    public String description() {
        return "Detects identity comparison against literals";
    }

    @Override
    public List<Issue> check(Module module, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        PyWalker.walk(module, new PyVisitor() {
            @Override
            public void visitCompare(Compare compare) {
                if (!compare.isIdentity() || !compare.right().isValueLiteral()) {
                    return;
                }
                issues.add(issueAt(source, compare.span().line(), compare.span().endLine())
                        .title("Identity Check with Literal")
                        .description("Use '==' for value comparison, not 'is'")
                        .severity(Severity.MEDIUM)
                        .category(Category.BUG)
                        .suggestedFix(compare.operator().equals("is not") ? "Replace 'is not' with '!='" : "Replace 'is' with '=='")
                        .autoFixable(true)
                        .metadata("literal", compare.right().text())
                        .build());
            }
        });
        return issues;
    }
}
