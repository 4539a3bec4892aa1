package io.sagescan.python.ast;

import java.util.List;

/**
 * Any statement without a block: expressions, assignments, {@code return}, decorators and so on.
 * The tokens are kept as-is; comparisons are extracted at parse time.
 */
public record SimpleStmt(List<Token> tokens, List<Compare> comparisons, Span span) implements Stmt {

    public SimpleStmt {
        tokens = List.copyOf(tokens);
        comparisons = List.copyOf(comparisons);
    }
}
