package io.sagescan.model;

/**
 * Basic code metrics for one file.
 *
 * @param linesOfCode          Total physical lines
 * @param sourceLinesOfCode    Lines that are neither blank nor comments
 * @param commentLines         Comment-only lines
 * @param blankLines           Blank lines
 * @param cyclomaticComplexity Average cyclomatic complexity per function (0 when unknown)
 */
public record CodeMetrics(
        int linesOfCode,
        int sourceLinesOfCode,
        int commentLines,
        int blankLines,
        double cyclomaticComplexity
) {
    public static final CodeMetrics EMPTY = new CodeMetrics(0, 0, 0, 0, 0.0);

    public CodeMetrics withComplexity(double complexity) {
        return new CodeMetrics(linesOfCode, sourceLinesOfCode, commentLines, blankLines, complexity);
    }
}
