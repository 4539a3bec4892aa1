package io.sagescan.javasrc;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.type.Type;
import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flags catch clauses for {@code Exception}, {@code Throwable} or {@code RuntimeException},
 * including as members of a multi-catch.
 */
public class BroadCatchCheck implements JavaCheck {

    private static final Set<String> BROAD_TYPES = Set.of("Exception", "Throwable", "RuntimeException");

    @Override
    public String id() {
        return "broad-catch";
    }

    @Override
    public String description() {
        return "Detects overly broad catch clauses";
    }

    @Override
    public List<Issue> check(CompilationUnit unit, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        for (CatchClause clause : unit.findAll(CatchClause.class)) {
            Type type = clause.getParameter().getType();
            List<Type> caught = type.isUnionType()
                    ? new ArrayList<>(type.asUnionType().getElements())
                    : List.of(type);
            for (Type t : caught) {
                String name = simpleName(t.asString());
                if (BROAD_TYPES.contains(name)) {
                    issues.add(issueAt(source, clause)
                            .title("Overly Broad Catch: " + name)
                            .description("Catching " + name + " hides unrelated failures. Catch the specific exceptions instead.")
                            .severity(Severity.MEDIUM)
                            .category(Category.BEST_PRACTICE)
                            .suggestedFix("Catch the specific exception types the try block can throw")
                            .build());
                    break;
                }
            }
        }
        return issues;
    }

    private static String simpleName(String typeName) {
        int dot = typeName.lastIndexOf('.');
        return dot >= 0 ? typeName.substring(dot + 1) : typeName;
    }
}
