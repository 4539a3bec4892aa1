package io.sagescan.python.checks;

import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;
import io.sagescan.python.ast.FunctionDef;
import io.sagescan.python.ast.Module;
import io.sagescan.python.ast.Param;
import io.sagescan.python.ast.PyVisitor;
import io.sagescan.python.ast.PyWalker;
import io.sagescan.python.ast.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags list, dict and set displays used as parameter defaults.
 * Comprehensions and calls such as {@code list()} are not displays and are not flagged.
 */
public class MutableDefaultCheck implements PythonCheck {

    @Override
    public String id() {
        return "mutable-default";
    }

    @Override
    public String description() {
        return "Detects mutable default arguments";
    }

    @Override
    public List<Issue> check(Module module, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        PyWalker.walk(module, new PyVisitor() {
            @Override
            public void visitFunction(FunctionDef function) {
                for (Param param : function.params()) {
                    if (isMutableDisplay(param.defaultValue())) {
                        int line = function.span().line();
                        issues.add(issueAt(source, line, line)
                                .title("Mutable Default Argument: " + function.name())
                                .description("Using mutable objects as default arguments can lead to unexpected behavior")
                                .severity(Severity.HIGH)
                                .category(Category.BUG)
                                .suggestedFix("Use None as default and create the mutable object inside the function")
                                .autoFixable(true)
                                .metadata("parameter", param.name())
                                .build());
                        return;
                    }
                }
            }
        });
        return issues;
    }

    static boolean isMutableDisplay(List<Token> value) {
        if (value.size() < 2) {
            return false;
        }
        Token first = value.get(0);
        if (!first.isOp("[") && !first.isOp("{")) {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < value.size(); i++) {
            Token t = value.get(i);
            if (t.isOp("(") || t.isOp("[") || t.isOp("{")) {
                depth++;
            } else if (t.isOp(")") || t.isOp("]") || t.isOp("}")) {
                depth--;
                if (depth == 0 && i != value.size() - 1) {
                    return false;
                }
            } else if (depth == 1 && (t.isName("for") || t.isName("async"))) {
                return false;
            }
        }
        return true;
    }
}
