package io.sagescan.python.checks;

import io.sagescan.python.ast.ClassDef;
import io.sagescan.python.ast.Clause;
import io.sagescan.python.ast.CompoundStmt;
import io.sagescan.python.ast.ExceptHandler;
import io.sagescan.python.ast.FunctionDef;
import io.sagescan.python.ast.Module;
import io.sagescan.python.ast.PyVisitor;
import io.sagescan.python.ast.PyWalker;
import io.sagescan.python.ast.SimpleStmt;
import io.sagescan.python.ast.Stmt;
import io.sagescan.python.ast.Token;
import io.sagescan.python.ast.TokenType;
import io.sagescan.python.ast.Try;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * McCabe complexity of Python functions.
 * <p>
 * A function starts at 1 and gains one point per {@code if}, {@code elif}, loop, {@code case},
 * {@code except} handler, boolean operator and conditional or comprehension clause inside
 * expressions, plus one for an {@code else} on a loop or {@code try}. Nested functions and
 * classes are measured on their own and do not count toward the enclosing function.
 */
public final class CyclomaticComplexity {

    private static final Set<String> BRANCH_CLAUSES = Set.of("if", "elif", "for", "while", "case");
    private static final Set<String> EXPRESSION_BRANCHES = Set.of("if", "for", "and", "or");

    private CyclomaticComplexity() {
    }

    public static int of(FunctionDef function) {
        return 1 + count(function.body());
    }

    /**
     * Complexity of every function in the module, in source order.
     */
    public static List<Integer> allFunctions(Module module) {
        List<Integer> result = new ArrayList<>();
        PyWalker.walk(module, new PyVisitor() {
            @Override
            public void visitFunction(FunctionDef function) {
                result.add(of(function));
            }
        });
        return result;
    }

    public static double average(Module module) {
        return allFunctions(module).stream().mapToInt(Integer::intValue).average().orElse(0.0);
    }

    private static int count(List<Stmt> body) {
        int total = 0;
        for (Stmt stmt : body) {
            total += count(stmt);
        }
        return total;
    }

    private static int count(Stmt stmt) {
        if (stmt instanceof FunctionDef || stmt instanceof ClassDef) {
            return 0;
        }
        if (stmt instanceof SimpleStmt simple) {
            return expressionBranches(simple.tokens());
        }
        if (stmt instanceof Try tryStmt) {
            int total = tryStmt.handlers().size() + (tryStmt.orElse().isEmpty() ? 0 : 1);
            total += count(tryStmt.body());
            for (ExceptHandler handler : tryStmt.handlers()) {
                total += count(handler.body());
            }
            total += count(tryStmt.orElse());
            total += count(tryStmt.finalBody());
            return total;
        }
        if (stmt instanceof CompoundStmt compound) {
            int total = 0;
            for (Clause clause : compound.clauses()) {
                if (BRANCH_CLAUSES.contains(clause.keyword())) {
                    total++;
                } else if (clause.keyword().equals("else") && compound.isLoop()) {
                    total++;
                }
                total += expressionBranches(clause.header());
                total += count(clause.body());
            }
            return total;
        }
        return 0;
    }

    private static int expressionBranches(List<Token> tokens) {
        int total = 0;
        for (Token t : tokens) {
            if (t.is(TokenType.NAME) && EXPRESSION_BRANCHES.contains(t.text())) {
                total++;
            }
        }
        return total;
    }
}
