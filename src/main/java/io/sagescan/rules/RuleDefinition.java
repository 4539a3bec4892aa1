package io.sagescan.rules;

import io.sagescan.model.Category;
import io.sagescan.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Uncompiled rule as read from a rule file.
 *
 * @param flags Names of {@link Pattern} flags, e.g. {@code CASE_INSENSITIVE}
 */
public record RuleDefinition(
        String id,
        String name,
        String description,
        String pattern,
        Severity severity,
        Category category,
        Set<String> languages,
        String message,
        String fixSuggestion,
        boolean autoFixable,
        List<String> flags
) {
    public RuleDefinition {
        languages = languages == null ? Set.of() : Set.copyOf(languages);
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    /**
     * Compiles the pattern.
     *
     * @throws PatternSyntaxException   if the regex is invalid
     * @throws IllegalArgumentException if a flag name is unknown
     */
    public Rule compile() {
        Pattern compiled = Pattern.compile(pattern, flagBits(flags));
        return new Rule(id, name, description, compiled, severity, category, languages,
                message, fixSuggestion, autoFixable);
    }

    /**
     * Builds a definition from a parsed YAML/JSON entry.
     *
     * @throws IllegalArgumentException when a required key is missing or a value is invalid
     */
    public static RuleDefinition fromMap(Map<?, ?> entry) {
        String id = requiredString(entry, "id");
        String name = requiredString(entry, "name");
        String pattern = requiredString(entry, "pattern");
        Severity severity = Severity.parse(stringOr(entry, "severity", "medium"));
        Category category = Category.parse(stringOr(entry, "category", "code_smell"));
        return new RuleDefinition(
                id,
                name,
                stringOr(entry, "description", ""),
                pattern,
                severity,
                category,
                Set.copyOf(stringList(entry, "languages")),
                stringOr(entry, "message", ""),
                stringOr(entry, "fixSuggestion", stringOr(entry, "fix_suggestion", null)),
                Boolean.TRUE.equals(entry.get("autoFixable")) || Boolean.TRUE.equals(entry.get("auto_fixable")),
                stringList(entry, "flags")
        );
    }

    private static int flagBits(List<String> names) {
        int bits = 0;
        for (String flag : names) {
            bits |= switch (flag.trim().toUpperCase(Locale.ROOT)) {
                case "CASE_INSENSITIVE", "IGNORECASE", "I" -> Pattern.CASE_INSENSITIVE;
                case "MULTILINE", "M" -> Pattern.MULTILINE;
                case "DOTALL", "S" -> Pattern.DOTALL;
                case "UNICODE_CASE" -> Pattern.UNICODE_CASE;
                case "COMMENTS", "X" -> Pattern.COMMENTS;
                default -> throw new IllegalArgumentException("Unknown pattern flag: " + flag);
            };
        }
        return bits;
    }

    private static String requiredString(Map<?, ?> entry, String key) {
        Object value = entry.get(key);
        if (!(value instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException("missing required key '" + key + "'");
        }
        return s;
    }

    private static String stringOr(Map<?, ?> entry, String key, String fallback) {
        Object value = entry.get(key);
        return value != null ? value.toString() : fallback;
    }

    private static List<String> stringList(Map<?, ?> entry, String key) {
        Object value = entry.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("'" + key + "' must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
