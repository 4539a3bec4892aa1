package io.sagescan.python.ast;

import java.util.List;

/**
 * Root of a parsed file.
 */
public record Module(List<Stmt> body) {

    public Module {
        body = List.copyOf(body);
    }
}
