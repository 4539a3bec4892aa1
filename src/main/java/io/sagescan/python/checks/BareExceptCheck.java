package io.sagescan.python.checks;

import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import io.sagescan.model.SourceText;
import io.sagescan.python.ast.ExceptHandler;
import io.sagescan.python.ast.Module;
import io.sagescan.python.ast.PyVisitor;
import io.sagescan.python.ast.PyWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags {@code except:} and {@code except BaseException:} handlers.
 */
public class BareExceptCheck implements PythonCheck {

    @Override
    public String id() {
        return "bare-except";
    }

    @Override
    public String description() {
        return "Detects bare and overly broad exception handlers";
    }

    @Override
    public List<Issue> check(Module module, SourceText source, AnalysisSettings settings) {
        List<Issue> issues = new ArrayList<>();
        PyWalker.walk(module, new PyVisitor() {
            @Override
            public void visitExceptHandler(ExceptHandler handler) {
                int start = handler.span().line();
                int end = handler.span().endLine();
                if (handler.isBare()) {
                    issues.add(issueAt(source, start, end)
                            .title("Bare Except Clause")
                            .description("Using bare 'except:' is discouraged. Catch specific exceptions instead.")
                            .severity(Severity.MEDIUM)
                            .category(Category.BEST_PRACTICE)
                            .suggestedFix("Replace with 'except Exception:' or catch specific exceptions")
                            .autoFixable(true)
                            .build());
                } else if (handler.type().equals("BaseException")) {
                    issues.add(issueAt(source, start, end)
                            .title("Overly Broad Exception Handler")
                            .description("Catching BaseException also traps SystemExit and KeyboardInterrupt.")
                            .severity(Severity.LOW)
                            .category(Category.BEST_PRACTICE)
                            .suggestedFix("Catch Exception or a more specific exception type")
                            .build());
                }
            }
        });
        return issues;
    }
}
