package io.sagescan.python.ast;

import java.util.List;

/**
 * Depth-first, source-order traversal of a {@link Module}.
 */
public final class PyWalker {

    private PyWalker() {
    }

    public static void walk(Module module, PyVisitor visitor) {
        walk(module.body(), visitor);
    }

    public static void walk(List<Stmt> statements, PyVisitor visitor) {
        for (Stmt stmt : statements) {
            walk(stmt, visitor);
        }
    }

    public static void walk(Stmt stmt, PyVisitor visitor) {
        if (stmt instanceof FunctionDef function) {
            visitor.visitFunction(function);
            walk(function.body(), visitor);
        } else if (stmt instanceof ClassDef cls) {
            visitor.visitClass(cls);
            walk(cls.body(), visitor);
        } else if (stmt instanceof Try tryStmt) {
            visitor.visitTry(tryStmt);
            walk(tryStmt.body(), visitor);
            for (ExceptHandler handler : tryStmt.handlers()) {
                visitor.visitExceptHandler(handler);
                walk(handler.body(), visitor);
            }
            walk(tryStmt.orElse(), visitor);
            walk(tryStmt.finalBody(), visitor);
        } else if (stmt instanceof Import importStmt) {
            visitor.visitImport(importStmt);
        } else if (stmt instanceof ImportFrom importFrom) {
            visitor.visitImportFrom(importFrom);
        } else if (stmt instanceof CompoundStmt compound) {
            visitor.visitCompound(compound);
            for (Clause clause : compound.clauses()) {
                clause.comparisons().forEach(visitor::visitCompare);
                walk(clause.body(), visitor);
            }
        } else if (stmt instanceof SimpleStmt simple) {
            visitor.visitSimple(simple);
            simple.comparisons().forEach(visitor::visitCompare);
        }
    }
}
