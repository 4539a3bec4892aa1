package io.sagescan.javasrc;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags on-demand imports such as {@code import java.util.*;}. Static imports are left alone.
 */
public class WildcardImportCheck implements JavaCheck {

    @Override
    public String id() {
        return "wildcard-import";
    }

    @Override
    public String description() {
        return "Detects wildcard imports";
    }

    @Override
    public List<Issue> check(CompilationUnit unit, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        for (ImportDeclaration imp : unit.getImports()) {
            if (imp.isAsterisk() && !imp.isStatic()) {
                issues.add(issueAt(source, imp)
                        .title("Wildcard Import")
                        .description("Avoid wildcard imports from " + imp.getNameAsString() + ". Import specific names instead.")
                        .severity(Severity.LOW)
                        .category(Category.BEST_PRACTICE)
                        .build());
            }
        }
        return issues;
    }
}
