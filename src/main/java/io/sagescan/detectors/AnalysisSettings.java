package io.sagescan.detectors;

/**
 * Thresholds shared by the structural checks of every AST detector.
 *
 * @param maxComplexity     Highest cyclomatic complexity a function may have without an issue
 * @param maxFunctionLength Highest line span ({@code endLine - startLine}) a function may have
 * @param maxParameters     Highest number of positional-or-keyword parameters a function may declare
 */
public record AnalysisSettings(int maxComplexity, int maxFunctionLength, int maxParameters) {

    public static final int DEFAULT_MAX_COMPLEXITY = 15;
    public static final int DEFAULT_MAX_FUNCTION_LENGTH = 50;
    public static final int DEFAULT_MAX_PARAMETERS = 5;

    public AnalysisSettings {
        if (maxComplexity < 1 || maxFunctionLength < 1 || maxParameters < 0) {
            throw new IllegalArgumentException("Thresholds must be positive: complexity=" + maxComplexity
                    + ", functionLength=" + maxFunctionLength + ", parameters=" + maxParameters);
        }
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(DEFAULT_MAX_COMPLEXITY, DEFAULT_MAX_FUNCTION_LENGTH, DEFAULT_MAX_PARAMETERS);
    }
}
