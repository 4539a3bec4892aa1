package io.sagescan.python.ast;

import java.util.List;

/**
 * One keyword-headed block of a compound statement, e.g. the {@code elif} part of an {@code if}.
 *
 * @param keyword     Clause keyword ({@code if}, {@code elif}, {@code else}, {@code for}, {@code case}, ...)
 * @param header      Tokens between the keyword and the block colon
 * @param comparisons Equality and identity comparisons found in the header
 */
public record Clause(String keyword, List<Token> header, List<Compare> comparisons, List<Stmt> body, Span span) {

    public Clause {
        header = List.copyOf(header);
        comparisons = List.copyOf(comparisons);
        body = List.copyOf(body);
    }
}
