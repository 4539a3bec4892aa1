package io.sagescan.python.ast;

import java.util.List;

/**
 * One entry of a function's parameter list.
 *
 * @param name         Parameter name without stars
 * @param kind         Position in the signature
 * @param annotation   Annotation tokens, empty when absent
 * @param defaultValue Default value tokens, empty when absent
 */
public record Param(String name, Kind kind, List<Token> annotation, List<Token> defaultValue, Span span) {

    public enum Kind {
        POSITIONAL_ONLY,
        POSITIONAL_OR_KEYWORD,
        VAR_POSITIONAL,
        KEYWORD_ONLY,
        VAR_KEYWORD
    }

    public Param {
        annotation = List.copyOf(annotation);
        defaultValue = List.copyOf(defaultValue);
    }

    public boolean hasDefault() {
        return !defaultValue.isEmpty();
    }

    public boolean isStarred() {
        return kind == Kind.VAR_POSITIONAL || kind == Kind.VAR_KEYWORD;
    }
}
