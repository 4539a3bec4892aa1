package io.sagescan.rules;

import io.sagescan.model.Category;
import io.sagescan.model.Severity;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A compiled, immutable pattern rule.
 *
 * @param id            Unique rule id, e.g. {@code hardcoded-password}
 * @param name          Human name, used as the issue title
 * @param description   What the rule looks for
 * @param pattern       Compiled pattern, applied line by line
 * @param severity      Severity of produced issues
 * @param category      Category of produced issues
 * @param languages     Language ids the rule applies to
 * @param message       Issue description
 * @param fixSuggestion Suggested fix text (may be null)
 * @param autoFixable   Whether produced issues are auto-fixable
 */
public record Rule(
        String id,
        String name,
        String description,
        Pattern pattern,
        Severity severity,
        Category category,
        Set<String> languages,
        String message,
        String fixSuggestion,
        boolean autoFixable
) {
    public Rule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id cannot be null or blank");
        }
        if (pattern == null) {
            throw new IllegalArgumentException("Rule " + id + " has no pattern");
        }
        languages = languages == null ? Set.of() : Set.copyOf(languages);
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (message == null || message.isBlank()) {
            message = description != null ? description : name;
        }
    }

    /**
     * A rule never runs against a language it does not list.
     */
    public boolean appliesTo(String language) {
        return languages.contains(language);
    }

    /**
     * Regex flags the pattern was compiled with.
     */
    public int flags() {
        return pattern.flags();
    }

    public Optional<String> fix() {
        return Optional.ofNullable(fixSuggestion);
    }
}
