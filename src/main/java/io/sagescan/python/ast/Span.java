package io.sagescan.python.ast;

/**
 * Source range of a node. Lines and columns are 1-based; the end column is exclusive.
 */
public record Span(int line, int column, int endLine, int endColumn) {

    public Span to(Span end) {
        return new Span(line, column, end.endLine, end.endColumn);
    }

    public int lineCount() {
        return endLine - line + 1;
    }
}
