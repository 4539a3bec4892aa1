package io.sagescan.javasrc;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.BinaryExpr;
import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags {@code ==} and {@code !=} with a string literal on either side.
 */
public class StringIdentityCheck implements JavaCheck {

    @Override
    public String id() {
        return "string-identity";
    }

    @Override
    public String description() {
        return "Detects reference comparison against string literals";
    }

    @Override
    public List<Issue> check(CompilationUnit unit, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        for (BinaryExpr expr : unit.findAll(BinaryExpr.class)) {
            boolean equality = expr.getOperator() == BinaryExpr.Operator.EQUALS
                    || expr.getOperator() == BinaryExpr.Operator.NOT_EQUALS;
            if (equality && (expr.getLeft().isStringLiteralExpr() || expr.getRight().isStringLiteralExpr())) {
                boolean negated = expr.getOperator() == BinaryExpr.Operator.NOT_EQUALS;
                issues.add(issueAt(source, expr)
                        .title("String Comparison with " + (negated ? "!=" : "=="))
                        .description("'" + expr.getOperator().asString() + "' compares references, not string contents")
                        .severity(Severity.MEDIUM)
                        .category(Category.BUG)
                        .suggestedFix(negated ? "Use !\"literal\".equals(value)" : "Use \"literal\".equals(value)")
                        .autoFixable(true)
                        .build());
            }
        }
        return issues;
    }
}
