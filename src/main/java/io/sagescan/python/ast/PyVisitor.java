package io.sagescan.python.ast;

/**
 * Callbacks for the node kinds the Python checks care about. {@link PyWalker} calls them
 * in source order; every method defaults to doing nothing.
 */
public interface PyVisitor {

    default void visitFunction(FunctionDef function) {
    }

    default void visitClass(ClassDef cls) {
    }

    default void visitTry(Try tryStmt) {
    }

    default void visitExceptHandler(ExceptHandler handler) {
    }

    default void visitImport(Import importStmt) {
    }

    default void visitImportFrom(ImportFrom importFrom) {
    }

    default void visitCompound(CompoundStmt compound) {
    }

    default void visitSimple(SimpleStmt simple) {
    }

    default void visitCompare(Compare compare) {
    }
}
