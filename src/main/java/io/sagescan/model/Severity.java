package io.sagescan.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;

/**
 * Severity levels for issues.
 * <p>
 * The total order INFO &lt; LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL is carried by the
 * explicit {@link #rank()} of each constant, not by declaration order.
 */
public enum Severity {
    /**
     * Will break at runtime or exposes a secret. Fails the CLI run.
     */
    CRITICAL(5, 100, "critical"),

    /**
     * Likely bug or exploitable weakness.
     */
    HIGH(4, 75, "high"),

    /**
     * Questionable construct that deserves a fix.
     */
    MEDIUM(3, 50, "medium"),

    /**
     * Style or maintainability nit.
     */
    LOW(2, 25, "low"),

    /**
     * Informational only.
     */
    INFO(1, 10, "info");

    /**
     * Orders severities from least to most severe.
     */
    public static final Comparator<Severity> BY_RANK = Comparator.comparingInt(Severity::rank);

    private final int rank;
    private final int weight;
    private final String label;

    Severity(int rank, int weight, String label) {
        this.rank = rank;
        this.weight = weight;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    /**
     * Ranking weight used by the aggregator's priority score.
     */
    public int weight() {
        return weight;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank >= threshold.rank;
    }

    /**
     * Parses a severity label, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown labels
     */
    public static Severity parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.label.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + value
                        + " (valid values: critical, high, medium, low, info)"));
    }
}
