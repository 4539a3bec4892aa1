package io.sagescan.python.ast;

/**
 * A Python statement. The set of statement kinds is closed; checks dispatch on it
 * through {@link PyWalker} rather than through reflection.
 */
public sealed interface Stmt permits FunctionDef, ClassDef, Try, Import, ImportFrom, CompoundStmt, SimpleStmt {

    Span span();

    default int line() {
        return span().line();
    }
}
