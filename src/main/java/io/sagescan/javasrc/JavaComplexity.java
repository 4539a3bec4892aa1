package io.sagescan.javasrc;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * McCabe complexity of Java methods and constructors. Anonymous and local classes are
 * measured on their own; lambdas count toward the enclosing method.
 */
public final class JavaComplexity {

    private static final DecisionCounter COUNTER = new DecisionCounter();

    private JavaComplexity() {
    }

    public static int of(CallableDeclaration<?> callable) {
        AtomicInteger decisions = new AtomicInteger();
        if (callable instanceof MethodDeclaration method) {
            method.getBody().ifPresent(body -> body.accept(COUNTER, decisions));
        } else if (callable instanceof ConstructorDeclaration constructor) {
            constructor.getBody().accept(COUNTER, decisions);
        }
        return 1 + decisions.get();
    }

    public static double average(CompilationUnit unit) {
        return JavaCheck.callables(unit).stream()
                .mapToInt(JavaComplexity::of)
                .average()
                .orElse(0.0);
    }

    private static final class DecisionCounter extends VoidVisitorAdapter<AtomicInteger> {

        @Override
        public void visit(IfStmt n, AtomicInteger count) {
            count.incrementAndGet();
            super.visit(n, count);
        }

        @Override
        public void visit(ForStmt n, AtomicInteger count) {
            count.incrementAndGet();
            super.visit(n, count);
        }

        @Override
        public void visit(ForEachStmt n, AtomicInteger count) {
            count.incrementAndGet();
            super.visit(n, count);
        }

        @Override
        public void visit(WhileStmt n, AtomicInteger count) {
            count.incrementAndGet();
            super.visit(n, count);
        }

        @Override
        public void visit(DoStmt n, AtomicInteger count) {
            count.incrementAndGet();
            super.visit(n, count);
        }

        @Override
        public void visit(CatchClause n, AtomicInteger count) {
            count.incrementAndGet();
            super.visit(n, count);
        }

        @Override
        public void visit(ConditionalExpr n, AtomicInteger count) {
            count.incrementAndGet();
            super.visit(n, count);
        }

        @Override
        public void visit(SwitchEntry n, AtomicInteger count) {
            if (!n.getLabels().isEmpty()) {
                count.incrementAndGet();
            }
            super.visit(n, count);
        }

        @Override
        public void visit(BinaryExpr n, AtomicInteger count) {
            if (n.getOperator() == BinaryExpr.Operator.AND || n.getOperator() == BinaryExpr.Operator.OR) {
                count.incrementAndGet();
            }
            super.visit(n, count);
        }

        @Override
        public void visit(ObjectCreationExpr n, AtomicInteger count) {
            // anonymous class bodies are not part of this method
            n.getScope().ifPresent(scope -> scope.accept(this, count));
            n.getArguments().forEach(arg -> arg.accept(this, count));
        }

        @Override
        public void visit(LocalClassDeclarationStmt n, AtomicInteger count) {
            // measured separately
        }

        @Override
        public void visit(LocalRecordDeclarationStmt n, AtomicInteger count) {
            // measured separately
        }
    }
}
