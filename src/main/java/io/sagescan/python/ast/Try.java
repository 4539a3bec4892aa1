package io.sagescan.python.ast;

import java.util.List;

public record Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orElse, List<Stmt> finalBody, Span span)
        implements Stmt {

    public Try {
        body = List.copyOf(body);
        handlers = List.copyOf(handlers);
        orElse = List.copyOf(orElse);
        finalBody = List.copyOf(finalBody);
    }
}
