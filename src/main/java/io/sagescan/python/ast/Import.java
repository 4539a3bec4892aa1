package io.sagescan.python.ast;

import java.util.List;

/**
 * {@code import a.b, c as d}. Names are the dotted module names, aliases dropped.
 */
public record Import(List<String> names, Span span) implements Stmt {

    public Import {
        names = List.copyOf(names);
    }
}
