package io.sagescan.python.ast;

import java.util.List;

/**
 * {@code from module import names}.
 *
 * @param module Dotted module name, or null for {@code from . import x}
 * @param names  Imported names, {@code *} for a wildcard import
 * @param level  Number of leading dots
 */
public record ImportFrom(String module, List<String> names, int level, Span span) implements Stmt {

    public ImportFrom {
        names = List.copyOf(names);
    }

    public boolean isWildcard() {
        return names.contains("*");
    }
}
