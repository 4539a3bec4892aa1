package io.sagescan.python;

import io.sagescan.python.ast.Token;
import io.sagescan.python.ast.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits Python source into tokens, producing NEWLINE, INDENT and DEDENT tokens
 * the way the CPython tokenizer does. Comments, blank lines and line breaks inside
 * brackets produce no tokens.
 */
public final class PythonTokenizer {

    private static final int TAB_SIZE = 8;

    private static final List<String> OPERATORS = List.of(
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "="
    );

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "f", "b", "br", "rb", "fr", "rf"
    );

    private record Bracket(char open, int line, int column) {
    }

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Bracket> brackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean atLineStart = true;

    private PythonTokenizer(String src) {
        this.src = src;
        indents.push(0);
    }

    public static List<Token> tokenize(String source) throws PythonSyntaxException {
        return new PythonTokenizer(source).run();
    }

    private List<Token> run() throws PythonSyntaxException {
        int n = src.length();
        while (pos < n) {
            if (atLineStart && brackets.isEmpty()) {
                if (!readIndentation()) {
                    continue;
                }
            }
            if (pos >= n) {
                break;
            }
            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                readContinuation();
            } else if (c == '\n' || c == '\r') {
                endLine();
            } else if (isIdentifierStart(c)) {
                readNameOrString();
            } else if (c == '"' || c == '\'') {
                readString(pos);
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < n && Character.isDigit(src.charAt(pos + 1)))) {
                readNumber();
            } else {
                readOperator();
            }
        }

        if (!brackets.isEmpty()) {
            Bracket open = brackets.peek();
            throw new PythonSyntaxException("'" + open.open() + "' was never closed", open.line(), open.column());
        }
        if (lastIsContent()) {
            add(TokenType.NEWLINE, "", line, column(), line, column());
        }
        while (indents.size() > 1) {
            indents.pop();
            add(TokenType.DEDENT, "", line, 1, line, 1);
        }
        add(TokenType.EOF, "", line, column(), line, column());
        return tokens;
    }

    /**
     * Measures the indentation of a new logical line and emits INDENT/DEDENT tokens.
     *
     * @return false when the line was blank or comment-only and has been consumed
     */
    private boolean readIndentation() throws PythonSyntaxException {
        int width = 0;
        int p = pos;
        while (p < src.length()) {
            char c = src.charAt(p);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            p++;
        }
        pos = p;
        if (p >= src.length()) {
            return true;
        }
        char c = src.charAt(p);
        if (c == '#') {
            skipComment();
            return false;
        }
        if (c == '\n' || c == '\r') {
            consumeLineBreak();
            return false;
        }

        atLineStart = false;
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            add(TokenType.INDENT, "", line, 1, line, column());
        } else if (width < current) {
            while (width < indents.peek()) {
                indents.pop();
                add(TokenType.DEDENT, "", line, column(), line, column());
            }
            if (width != indents.peek()) {
                throw new PythonSyntaxException("unindent does not match any outer indentation level", line, column());
            }
        }
        return true;
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
            pos++;
        }
    }

    private void readContinuation() throws PythonSyntaxException {
        int next = pos + 1;
        if (next < src.length() && (src.charAt(next) == '\n' || src.charAt(next) == '\r')) {
            pos = next;
            consumeLineBreak();
            return;
        }
        if (next >= src.length()) {
            throw new PythonSyntaxException("unexpected EOF while parsing", line, column());
        }
        throw new PythonSyntaxException("unexpected character after line continuation character", line, column() + 1);
    }

    private void endLine() {
        if (brackets.isEmpty() && lastIsContent()) {
            add(TokenType.NEWLINE, "", line, column(), line, column() + 1);
        }
        consumeLineBreak();
        atLineStart = brackets.isEmpty();
    }

    private void consumeLineBreak() {
        if (src.charAt(pos) == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
            pos++;
        }
        pos++;
        line++;
        lineStart = pos;
    }

    private void readNameOrString() throws PythonSyntaxException {
        int start = pos;
        int startColumn = column();
        pos++;
        while (pos < src.length() && isIdentifierPart(src.charAt(pos))) {
            pos++;
        }
        String word = src.substring(start, pos);
        if (pos < src.length() && (src.charAt(pos) == '"' || src.charAt(pos) == '\'')
                && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
            pos = start;
            readString(start + word.length());
            return;
        }
        add(TokenType.NAME, word, line, startColumn, line, column());
    }

    /**
     * Reads a string literal whose optional prefix begins at {@code pos} and whose
     * opening quote is at {@code quoteAt}.
     */
    private void readString(int quoteAt) throws PythonSyntaxException {
        int start = pos;
        int startLine = line;
        int startColumn = column();
        char quote = src.charAt(quoteAt);
        boolean triple = quoteAt + 2 < src.length()
                && src.charAt(quoteAt + 1) == quote && src.charAt(quoteAt + 2) == quote;
        pos = quoteAt + (triple ? 3 : 1);

        while (true) {
            if (pos >= src.length()) {
                String kind = triple ? "unterminated triple-quoted string literal" : "unterminated string literal";
                throw new PythonSyntaxException(kind + " (detected at line " + line + ")", startLine, startColumn);
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < src.length()) {
                    if (src.charAt(pos) == '\n' || src.charAt(pos) == '\r') {
                        consumeLineBreak();
                    } else {
                        pos++;
                    }
                }
                continue;
            }
            if (c == '\n' || c == '\r') {
                if (!triple) {
                    throw new PythonSyntaxException(
                            "unterminated string literal (detected at line " + line + ")", startLine, startColumn);
                }
                consumeLineBreak();
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (pos + 2 < src.length() && src.charAt(pos + 1) == quote && src.charAt(pos + 2) == quote) {
                    pos += 3;
                    break;
                }
            }
            pos++;
        }
        add(TokenType.STRING, src.substring(start, pos), startLine, startColumn, line, column());
    }

    private void readNumber() {
        int start = pos;
        int startColumn = column();
        if (src.charAt(pos) == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            skipDigits();
            if (pos < src.length() && src.charAt(pos) == '.') {
                pos++;
                skipDigits();
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    skipDigits();
                } else {
                    pos = mark;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
                pos++;
            }
        }
        add(TokenType.NUMBER, src.substring(start, pos), line, startColumn, line, column());
    }

    private void skipDigits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void readOperator() throws PythonSyntaxException {
        int startColumn = column();
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                trackBracket(op.charAt(0), startColumn);
                pos += op.length();
                add(TokenType.OP, op, line, startColumn, line, column());
                return;
            }
        }
        char c = src.charAt(pos);
        if (c == '!' || c == '$' || c == '?' || c == '`') {
            throw new PythonSyntaxException("invalid syntax", line, startColumn);
        }
        throw new PythonSyntaxException(
                String.format("invalid character '%c' (U+%04X)", c, (int) c), line, startColumn);
    }

    private void trackBracket(char c, int startColumn) throws PythonSyntaxException {
        switch (c) {
            case '(', '[', '{' -> brackets.push(new Bracket(c, line, startColumn));
            case ')', ']', '}' -> {
                if (brackets.isEmpty()) {
                    throw new PythonSyntaxException("unmatched '" + c + "'", line, startColumn);
                }
                Bracket open = brackets.pop();
                if (closing(open.open()) != c) {
                    String message = "closing parenthesis '" + c + "' does not match opening parenthesis '" + open.open() + "'";
                    if (open.line() != line) {
                        message += " on line " + open.line();
                    }
                    throw new PythonSyntaxException(message, line, startColumn);
                }
            }
            default -> {
            }
        }
    }

    private static char closing(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    private boolean lastIsContent() {
        if (tokens.isEmpty()) {
            return false;
        }
        TokenType last = tokens.get(tokens.size() - 1).type();
        return last != TokenType.NEWLINE && last != TokenType.INDENT && last != TokenType.DEDENT;
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private void add(TokenType type, String text, int startLine, int startColumn, int endLine, int endColumn) {
        tokens.add(new Token(type, text, startLine, startColumn, endLine, endColumn));
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
    }
}
