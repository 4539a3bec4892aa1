package io.sagescan.python;

/**
 * Raised by the tokenizer or parser when the source is not valid Python.
 * Line and column are 1-based and point at the offending token.
 */
public class PythonSyntaxException extends Exception {

    private final int line;
    private final int column;

    public PythonSyntaxException(String message, int line, int column) {
        super(message);
        this.line = Math.max(1, line);
        this.column = Math.max(1, column);
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    @Override
    public String toString() {
        return getMessage() + " (line " + line + ", column " + column + ")";
    }
}
