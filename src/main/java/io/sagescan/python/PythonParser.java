package io.sagescan.python;

import io.sagescan.python.ast.Clause;
import io.sagescan.python.ast.ClassDef;
import io.sagescan.python.ast.Compare;
import io.sagescan.python.ast.CompoundStmt;
import io.sagescan.python.ast.ExceptHandler;
import io.sagescan.python.ast.FunctionDef;
import io.sagescan.python.ast.Import;
import io.sagescan.python.ast.ImportFrom;
import io.sagescan.python.ast.Module;
import io.sagescan.python.ast.Param;
import io.sagescan.python.ast.SimpleStmt;
import io.sagescan.python.ast.Span;
import io.sagescan.python.ast.Stmt;
import io.sagescan.python.ast.Token;
import io.sagescan.python.ast.TokenType;
import io.sagescan.python.ast.Try;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Statement-level parser for Python 3.
 * <p>
 * Builds the block structure (functions, classes, compound statements, exception handlers,
 * imports) exactly and keeps expressions as token runs, from which equality and identity
 * comparisons are extracted. Structural errors are reported with CPython's messages.
 */
public final class PythonParser {

    private static final Set<String> OPERAND_CONTINUATIONS = Set.of(
            "(", "[", ".", "+", "-", "*", "/", "//", "%", "**", "@", "<<", ">>", "&", "|", "^"
    );

    private static final Set<String> NOT_A_SOFT_KEYWORD_FOLLOWER = Set.of(
            "=", ":", ".", ",", ")", "]", "}", ";", "+=", "-=", "*=", "/=", "//=", "%=", "**=",
            "@=", "&=", "|=", "^=", ">>=", "<<=", ":="
    );

    private final List<Token> tokens;
    private int pos;
    private Token lastContent;

    private PythonParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Module parse(String source) throws PythonSyntaxException {
        return new PythonParser(PythonTokenizer.tokenize(source)).parseModule();
    }

    private Module parseModule() throws PythonSyntaxException {
        List<Stmt> body = new ArrayList<>();
        while (!peek().is(TokenType.EOF)) {
            body.add(parseStatement());
        }
        return new Module(body);
    }

    private Stmt parseStatement() throws PythonSyntaxException {
        Token t = peek();
        if (t.is(TokenType.INDENT)) {
            throw error("unexpected indent", t);
        }
        if (t.is(TokenType.DEDENT)) {
            throw error("invalid syntax", t);
        }
        if (t.is(TokenType.NAME)) {
            switch (t.text()) {
                case "def":
                    return parseFunction(t, false);
                case "class":
                    return parseClass(t);
                case "async":
                    Token after = peek(1);
                    if (after.isName("def")) {
                        next();
                        return parseFunction(t, true);
                    }
                    if (after.isName("for") || after.isName("with")) {
                        next();
                        return after.isName("for") ? parseLoop(t) : parseWith(t);
                    }
                    break;
                case "if":
                    return parseIf(t);
                case "for":
                case "while":
                    return parseLoop(t);
                case "with":
                    return parseWith(t);
                case "try":
                    return parseTry(t);
                case "import":
                    return parseImport(t);
                case "from":
                    return parseImportFrom(t);
                case "except":
                case "elif":
                case "else":
                case "finally":
                    throw error("invalid syntax", t);
                case "match":
                    if (isSoftKeywordBlock()) {
                        return parseMatch(t);
                    }
                    break;
                default:
                    break;
            }
        }
        return parseSimple();
    }

    // ---- compound statements ----

    private FunctionDef parseFunction(Token start, boolean async) throws PythonSyntaxException {
        Token def = next();
        Token name = expect(TokenType.NAME, "invalid syntax");
        if (peek().isOp("[")) {
            skipTypeParams();
        }
        Token open = next();
        if (!open.isOp("(")) {
            throw error("invalid syntax", open);
        }
        List<Token> inner = new ArrayList<>();
        int depth = 1;
        while (true) {
            Token t = next();
            if (t.is(TokenType.EOF) || t.is(TokenType.NEWLINE)) {
                throw error("invalid syntax", t);
            }
            if (isOpener(t)) {
                depth++;
            } else if (isCloser(t)) {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            inner.add(t);
        }
        List<Param> params = parseParams(inner);
        readHeader();
        List<Stmt> body = parseBlock("function definition", def.line());
        return new FunctionDef(name.text(), params, body, async, spanFrom(start));
    }

    /**
     * Skips a generic type parameter list such as {@code [T, *Ts, **P]}.
     */
    private void skipTypeParams() throws PythonSyntaxException {
        Token open = next();
        int depth = 1;
        boolean empty = true;
        while (depth > 0) {
            Token t = next();
            if (t.is(TokenType.EOF) || t.is(TokenType.NEWLINE)) {
                throw error("invalid syntax", t);
            }
            if (isOpener(t)) {
                depth++;
            } else if (isCloser(t)) {
                depth--;
            }
            if (depth > 0) {
                empty = false;
            }
        }
        if (empty) {
            throw error("Type parameter list cannot be empty", open);
        }
    }

    private List<Param> parseParams(List<Token> inner) throws PythonSyntaxException {
        List<Param> params = new ArrayList<>();
        boolean keywordOnly = false;
        for (List<Token> segment : splitTopLevel(inner, ",")) {
            if (segment.isEmpty()) {
                continue;
            }
            Token first = segment.get(0);
            if (first.isOp("/") && segment.size() == 1) {
                for (int i = 0; i < params.size(); i++) {
                    Param p = params.get(i);
                    params.set(i, new Param(p.name(), Param.Kind.POSITIONAL_ONLY, p.annotation(), p.defaultValue(), p.span()));
                }
                continue;
            }
            if (first.isOp("*") && segment.size() == 1) {
                keywordOnly = true;
                continue;
            }
            Param.Kind kind = keywordOnly ? Param.Kind.KEYWORD_ONLY : Param.Kind.POSITIONAL_OR_KEYWORD;
            int nameIndex = 0;
            if (first.isOp("*")) {
                kind = Param.Kind.VAR_POSITIONAL;
                keywordOnly = true;
                nameIndex = 1;
            } else if (first.isOp("**")) {
                kind = Param.Kind.VAR_KEYWORD;
                nameIndex = 1;
            }
            if (nameIndex >= segment.size() || !segment.get(nameIndex).is(TokenType.NAME)) {
                throw error("invalid syntax", nameIndex < segment.size() ? segment.get(nameIndex) : first);
            }
            Token name = segment.get(nameIndex);
            List<Token> rest = segment.subList(nameIndex + 1, segment.size());
            List<Token> annotation = List.of();
            List<Token> defaultValue = List.of();
            int eq = indexOfTopLevel(rest, "=");
            if (!rest.isEmpty() && rest.get(0).isOp(":")) {
                annotation = rest.subList(1, eq >= 0 ? eq : rest.size());
            } else if (!rest.isEmpty() && eq != 0) {
                throw error("invalid syntax", rest.get(0));
            }
            if (eq >= 0) {
                defaultValue = rest.subList(eq + 1, rest.size());
                if (defaultValue.isEmpty()) {
                    throw error("expected default value expression", rest.get(eq));
                }
            }
            Token last = segment.get(segment.size() - 1);
            params.add(new Param(name.text(), kind, annotation, defaultValue, first.span().to(last.span())));
        }
        return params;
    }

    private ClassDef parseClass(Token start) throws PythonSyntaxException {
        next();
        Token name = expect(TokenType.NAME, "invalid syntax");
        readHeader();
        List<Stmt> body = parseBlock("class definition", start.line());
        return new ClassDef(name.text(), body, spanFrom(start));
    }

    private CompoundStmt parseIf(Token start) throws PythonSyntaxException {
        List<Clause> clauses = new ArrayList<>();
        clauses.add(parseClause());
        while (peek().isName("elif")) {
            clauses.add(parseClause());
        }
        if (peek().isName("else")) {
            clauses.add(parseClause());
        }
        return new CompoundStmt("if", clauses, spanFrom(start));
    }

    private CompoundStmt parseLoop(Token start) throws PythonSyntaxException {
        String keyword = peek().text();
        List<Clause> clauses = new ArrayList<>();
        clauses.add(parseClause());
        if (peek().isName("else")) {
            clauses.add(parseClause());
        }
        return new CompoundStmt(keyword, clauses, spanFrom(start));
    }

    private CompoundStmt parseWith(Token start) throws PythonSyntaxException {
        return new CompoundStmt("with", List.of(parseClause()), spanFrom(start));
    }

    private CompoundStmt parseMatch(Token start) throws PythonSyntaxException {
        Token keyword = next();
        List<Token> header = readHeader();
        Token newline = next();
        if (!newline.is(TokenType.NEWLINE)) {
            throw error("invalid syntax", newline);
        }
        if (!peek().is(TokenType.INDENT)) {
            throw error("expected an indented block after 'match' statement on line " + keyword.line(), peek());
        }
        next();
        List<Stmt> cases = new ArrayList<>();
        while (!peek().is(TokenType.DEDENT) && !peek().is(TokenType.EOF)) {
            Token caseToken = peek();
            if (!caseToken.isName("case")) {
                throw error("invalid syntax", caseToken);
            }
            Clause clause = parseClause();
            cases.add(new CompoundStmt("case", List.of(clause), clause.span()));
        }
        if (peek().is(TokenType.DEDENT)) {
            next();
        }
        Clause clause = new Clause("match", header, comparisons(header), cases, spanFrom(start));
        return new CompoundStmt("match", List.of(clause), spanFrom(start));
    }

    private Try parseTry(Token start) throws PythonSyntaxException {
        next();
        readHeader();
        List<Stmt> body = parseBlock("'try' statement", start.line());

        List<ExceptHandler> handlers = new ArrayList<>();
        while (peek().isName("except")) {
            Token except = next();
            List<Token> header = new ArrayList<>(readHeader());
            if (!header.isEmpty() && header.get(0).isOp("*")) {
                header.remove(0);
            }
            String type = null;
            String alias = null;
            if (!header.isEmpty()) {
                int as = indexOfTopLevelName(header, "as");
                List<Token> typeTokens = as >= 0 ? header.subList(0, as) : header;
                if (typeTokens.isEmpty()) {
                    throw error("invalid syntax", header.get(0));
                }
                type = sourceText(typeTokens);
                if (as >= 0 && as + 1 < header.size()) {
                    alias = header.get(as + 1).text();
                }
            }
            List<Stmt> handlerBody = parseBlock("'except' statement", except.line());
            handlers.add(new ExceptHandler(type, alias, handlerBody, spanFrom(except)));
        }

        List<Stmt> orElse = List.of();
        if (peek().isName("else")) {
            Token elseToken = next();
            readHeader();
            orElse = parseBlock("'else' statement", elseToken.line());
        }
        List<Stmt> finalBody = List.of();
        boolean hasFinally = false;
        if (peek().isName("finally")) {
            Token finallyToken = next();
            readHeader();
            finalBody = parseBlock("'finally' statement", finallyToken.line());
            hasFinally = true;
        }
        if (handlers.isEmpty() && !hasFinally) {
            throw error("expected 'except' or 'finally' block", peek());
        }
        return new Try(body, handlers, orElse, finalBody, spanFrom(start));
    }

    /**
     * Parses {@code keyword header ':' block} starting at the keyword.
     */
    private Clause parseClause() throws PythonSyntaxException {
        Token keyword = next();
        List<Token> header = readHeader();
        List<Stmt> body = parseBlock("'" + keyword.text() + "' statement", keyword.line());
        return new Clause(keyword.text(), header, comparisons(header), body, spanFrom(keyword));
    }

    /**
     * Reads the tokens up to the block colon and consumes the colon. Colons inside brackets
     * and lambda colons do not end the header.
     */
    private List<Token> readHeader() throws PythonSyntaxException {
        List<Token> header = new ArrayList<>();
        int depth = 0;
        int lambdas = 0;
        while (true) {
            Token t = peek();
            if (t.is(TokenType.NEWLINE) || t.is(TokenType.EOF)) {
                throw error("expected ':'", t);
            }
            next();
            if (isOpener(t)) {
                depth++;
            } else if (isCloser(t)) {
                depth--;
            } else if (depth == 0 && t.isName("lambda")) {
                lambdas++;
            } else if (depth == 0 && t.isOp(":")) {
                if (lambdas == 0) {
                    return header;
                }
                lambdas--;
            }
            header.add(t);
        }
    }

    private List<Stmt> parseBlock(String context, int headerLine) throws PythonSyntaxException {
        if (!peek().is(TokenType.NEWLINE)) {
            return List.of(parseSimple());
        }
        next();
        if (!peek().is(TokenType.INDENT)) {
            throw error("expected an indented block after " + context + " on line " + headerLine, peek());
        }
        next();
        List<Stmt> body = new ArrayList<>();
        while (!peek().is(TokenType.DEDENT) && !peek().is(TokenType.EOF)) {
            body.add(parseStatement());
        }
        if (peek().is(TokenType.DEDENT)) {
            next();
        }
        return body;
    }

    // ---- simple statements ----

    private Import parseImport(Token start) throws PythonSyntaxException {
        next();
        List<Token> rest = readLine();
        List<String> names = new ArrayList<>();
        for (List<Token> segment : splitTopLevel(rest, ",")) {
            int as = indexOfTopLevelName(segment, "as");
            List<Token> nameTokens = as >= 0 ? segment.subList(0, as) : segment;
            if (nameTokens.isEmpty()) {
                throw error("invalid syntax", start);
            }
            names.add(joinTexts(nameTokens));
        }
        if (names.isEmpty()) {
            throw error("invalid syntax", start);
        }
        return new Import(names, spanFrom(start));
    }

    private ImportFrom parseImportFrom(Token start) throws PythonSyntaxException {
        next();
        List<Token> rest = readLine();
        int importAt = indexOfTopLevelName(rest, "import");
        if (importAt < 0) {
            throw error("invalid syntax", rest.isEmpty() ? start : rest.get(rest.size() - 1));
        }
        int level = 0;
        int i = 0;
        while (i < importAt && (rest.get(i).isOp(".") || rest.get(i).isOp("..."))) {
            level += rest.get(i).text().length();
            i++;
        }
        String module = i < importAt ? joinTexts(rest.subList(i, importAt)) : null;
        if (module == null && level == 0) {
            throw error("invalid syntax", rest.get(importAt));
        }

        List<Token> nameTokens = new ArrayList<>(rest.subList(importAt + 1, rest.size()));
        if (!nameTokens.isEmpty() && nameTokens.get(0).isOp("(")) {
            nameTokens.remove(0);
            if (!nameTokens.isEmpty() && nameTokens.get(nameTokens.size() - 1).isOp(")")) {
                nameTokens.remove(nameTokens.size() - 1);
            }
        }
        List<String> names = new ArrayList<>();
        for (List<Token> segment : splitTopLevel(nameTokens, ",")) {
            if (!segment.isEmpty()) {
                names.add(segment.get(0).text());
            }
        }
        if (names.isEmpty()) {
            throw error("invalid syntax", rest.get(importAt));
        }
        return new ImportFrom(module, names, level, spanFrom(start));
    }

    private SimpleStmt parseSimple() throws PythonSyntaxException {
        Token start = peek();
        List<Token> line = readLine();
        if (line.isEmpty()) {
            throw error("invalid syntax", start);
        }
        return new SimpleStmt(line, comparisons(line), spanFrom(start));
    }

    /**
     * Reads the rest of the logical line and consumes its NEWLINE.
     */
    private List<Token> readLine() {
        List<Token> line = new ArrayList<>();
        while (!peek().is(TokenType.NEWLINE) && !peek().is(TokenType.EOF)) {
            line.add(next());
        }
        if (peek().is(TokenType.NEWLINE)) {
            next();
        }
        return line;
    }

    /**
     * {@code match} is a keyword only when its line ends with the block colon.
     */
    private boolean isSoftKeywordBlock() {
        Token follower = peek(1);
        if (follower.is(TokenType.NEWLINE) || follower.is(TokenType.EOF)
                || (follower.is(TokenType.OP) && NOT_A_SOFT_KEYWORD_FOLLOWER.contains(follower.text()))) {
            return false;
        }
        int i = pos + 1;
        while (i < tokens.size() && !tokens.get(i).is(TokenType.NEWLINE) && !tokens.get(i).is(TokenType.EOF)) {
            i++;
        }
        return tokens.get(i - 1).isOp(":");
    }

    // ---- comparisons ----

    /**
     * Extracts {@code is}, {@code is not}, {@code ==} and {@code !=} comparisons from a token run.
     */
    static List<Compare> comparisons(List<Token> run) {
        List<Compare> result = new ArrayList<>();
        for (int i = 0; i < run.size(); i++) {
            Token t = run.get(i);
            String operator;
            int operandAt;
            if (t.isName("is")) {
                boolean negated = i + 1 < run.size() && run.get(i + 1).isName("not");
                operator = negated ? "is not" : "is";
                operandAt = negated ? i + 2 : i + 1;
            } else if (t.isOp("==") || t.isOp("!=")) {
                operator = t.text();
                operandAt = i + 1;
            } else {
                continue;
            }
            Compare.Operand operand = classify(run, operandAt);
            Token end = operandAt < run.size() ? run.get(operandAt) : t;
            result.add(new Compare(operator, operand, t.span().to(end.span())));
        }
        return result;
    }

    private static Compare.Operand classify(List<Token> run, int at) {
        if (at >= run.size()) {
            return new Compare.Operand(Compare.Operand.Kind.OTHER, "");
        }
        Token first = run.get(at);
        Compare.Operand.Kind kind;
        int next = at + 1;
        if (first.isName("None") || first.isName("True") || first.isName("False") || first.isOp("...")) {
            return new Compare.Operand(Compare.Operand.Kind.SINGLETON, first.text());
        } else if (first.is(TokenType.NUMBER)) {
            kind = Compare.Operand.Kind.NUMBER;
        } else if (first.is(TokenType.STRING)) {
            boolean fString = first.isFString();
            boolean bytes = first.isBytes();
            while (next < run.size() && run.get(next).is(TokenType.STRING)) {
                fString |= run.get(next).isFString();
                next++;
            }
            kind = fString ? Compare.Operand.Kind.FSTRING
                    : bytes ? Compare.Operand.Kind.BYTES
                    : Compare.Operand.Kind.STRING;
        } else {
            return new Compare.Operand(Compare.Operand.Kind.OTHER, first.text());
        }
        if (next < run.size() && run.get(next).is(TokenType.OP) && OPERAND_CONTINUATIONS.contains(run.get(next).text())) {
            return new Compare.Operand(Compare.Operand.Kind.OTHER, first.text());
        }
        return new Compare.Operand(kind, first.text());
    }

    // ---- token helpers ----

    private Token peek() {
        return peek(0);
    }

    private Token peek(int ahead) {
        int i = Math.min(pos + ahead, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        if (t.is(TokenType.NAME) || t.is(TokenType.NUMBER) || t.is(TokenType.STRING) || t.is(TokenType.OP)) {
            lastContent = t;
        }
        return t;
    }

    private Token expect(TokenType type, String message) throws PythonSyntaxException {
        Token t = peek();
        if (!t.is(type)) {
            throw error(message, t);
        }
        return next();
    }

    private Span spanFrom(Token start) {
        Token end = lastContent != null ? lastContent : start;
        return start.span().to(end.span());
    }

    private static boolean isOpener(Token t) {
        return t.isOp("(") || t.isOp("[") || t.isOp("{");
    }

    private static boolean isCloser(Token t) {
        return t.isOp(")") || t.isOp("]") || t.isOp("}");
    }

    private static List<List<Token>> splitTopLevel(List<Token> run, String separator) {
        List<List<Token>> parts = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (Token t : run) {
            if (isOpener(t)) {
                depth++;
            } else if (isCloser(t)) {
                depth--;
            } else if (depth == 0 && t.isOp(separator)) {
                parts.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(t);
        }
        parts.add(current);
        return parts;
    }

    private static int indexOfTopLevel(List<Token> run, String op) {
        int depth = 0;
        for (int i = 0; i < run.size(); i++) {
            Token t = run.get(i);
            if (isOpener(t)) {
                depth++;
            } else if (isCloser(t)) {
                depth--;
            } else if (depth == 0 && t.isOp(op)) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOfTopLevelName(List<Token> run, String name) {
        int depth = 0;
        for (int i = 0; i < run.size(); i++) {
            Token t = run.get(i);
            if (isOpener(t)) {
                depth++;
            } else if (isCloser(t)) {
                depth--;
            } else if (depth == 0 && t.isName(name)) {
                return i;
            }
        }
        return -1;
    }

    private static String joinTexts(List<Token> run) {
        StringBuilder sb = new StringBuilder();
        run.forEach(t -> sb.append(t.text()));
        return sb.toString();
    }

    /**
     * Rebuilds source text, keeping a single space wherever the original had whitespace.
     */
    static String sourceText(List<Token> run) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token t : run) {
            if (previous != null && (previous.endLine() != t.line() || previous.endColumn() < t.column())) {
                sb.append(' ');
            }
            sb.append(t.text());
            previous = t;
        }
        return sb.toString();
    }

    private static PythonSyntaxException error(String message, Token at) {
        return new PythonSyntaxException(message, at.line(), at.column());
    }
}
