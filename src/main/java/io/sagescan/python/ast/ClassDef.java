package io.sagescan.python.ast;

import java.util.List;

public record ClassDef(String name, List<Stmt> body, Span span) implements Stmt {

    public ClassDef {
        body = List.copyOf(body);
    }
}
