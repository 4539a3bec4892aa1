package io.sagescan.python.ast;

import java.util.List;

/**
 * {@code if}, {@code while}, {@code for}, {@code with}, {@code match} and {@code case} statements.
 * {@code async for} and {@code async with} use the plain keyword.
 */
public record CompoundStmt(String keyword, List<Clause> clauses, Span span) implements Stmt {

    public CompoundStmt {
        clauses = List.copyOf(clauses);
    }

    public boolean isLoop() {
        return keyword.equals("for") || keyword.equals("while");
    }
}
