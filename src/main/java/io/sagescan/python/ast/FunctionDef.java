package io.sagescan.python.ast;

import java.util.List;

/**
 * {@code def} or {@code async def}. The span starts at the {@code def} line and ends
 * with the last token of the body.
 */
public record FunctionDef(String name, List<Param> params, List<Stmt> body, boolean async, Span span) implements Stmt {

    public FunctionDef {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    /**
     * Ordinary parameters: not positional-only, keyword-only, {@code *args} or {@code **kwargs}.
     */
    public List<Param> positionalOrKeywordParams() {
        return params.stream().filter(p -> p.kind() == Param.Kind.POSITIONAL_OR_KEYWORD).toList();
    }
}
