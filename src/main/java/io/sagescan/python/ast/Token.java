package io.sagescan.python.ast;

import java.util.Locale;

/**
 * A lexical token. Positions are 1-based; {@code endColumn} is exclusive.
 */
public record Token(TokenType type, String text, int line, int column, int endLine, int endColumn) {

    public boolean isName(String name) {
        return type == TokenType.NAME && text.equals(name);
    }

    public boolean isOp(String op) {
        return type == TokenType.OP && text.equals(op);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Lowercase string prefix, e.g. {@code rb} for {@code rb"..."}; empty for other token types.
     */
    public String stringPrefix() {
        if (type != TokenType.STRING) {
            return "";
        }
        int i = 0;
        while (i < text.length() && text.charAt(i) != '"' && text.charAt(i) != '\'') {
            i++;
        }
        return text.substring(0, i).toLowerCase(Locale.ROOT);
    }

    public boolean isFString() {
        return stringPrefix().indexOf('f') >= 0;
    }

    public boolean isBytes() {
        return stringPrefix().indexOf('b') >= 0;
    }

    public Span span() {
        return new Span(line, column, endLine, endColumn);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
