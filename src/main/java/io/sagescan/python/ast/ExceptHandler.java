package io.sagescan.python.ast;

import java.util.List;

/**
 * An {@code except} clause.
 *
 * @param type  Source text of the caught type expression, or null for a bare {@code except:}
 * @param alias Name bound with {@code as}, or null
 */
public record ExceptHandler(String type, String alias, List<Stmt> body, Span span) {

    public ExceptHandler {
        body = List.copyOf(body);
    }

    public boolean isBare() {
        return type == null;
    }
}
