package io.sagescan.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Categories of issues. Unordered; each carries the weight it adds to an issue's priority.
 */
public enum Category {
    SECURITY(20),
    BUG(15),
    CODE_SMELL(3),
    TYPE_ERROR(10),
    STYLE(1),
    PERFORMANCE(8),
    BEST_PRACTICE(5),
    DUPLICATION(2),
    COMPLEXITY(4),
    MAINTAINABILITY(3);

    private final int weight;

    Category(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * Lowercase name used in rule files and reports, e.g. {@code code_smell}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a category label such as {@code best_practice} or {@code BEST-PRACTICE}.
     *
     * @throws IllegalArgumentException for unknown labels
     */
    public static Category parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Category cannot be null");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + value));
    }
}
