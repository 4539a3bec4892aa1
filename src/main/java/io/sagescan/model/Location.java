package io.sagescan.model;

/**
 * Location of an issue in a file.
 *
 * @param filePath    Path of the file, in the same form for the whole run
 * @param startLine   1-based first line
 * @param endLine     1-based last line, inclusive
 * @param startColumn Start column, or null when unknown
 * @param endColumn   End column, or null when unknown
 */
public record Location(
        String filePath,
        int startLine,
        int endLine,
        Integer startColumn,
        Integer endColumn
) {
    public Location {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("filePath cannot be null or blank");
        }
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, was " + startLine);
        }
        if (endLine < startLine) {
            endLine = startLine;
        }
    }

    public static Location line(String filePath, int line) {
        return new Location(filePath, line, line, null, null);
    }

    public static Location lines(String filePath, int startLine, int endLine) {
        return new Location(filePath, startLine, endLine, null, null);
    }

    /**
     * Two locations denote the same place iff file path and start line match.
     */
    public boolean samePlace(Location other) {
        return other != null && filePath.equals(other.filePath) && startLine == other.startLine;
    }

    @Override
    public String toString() {
        if (startLine == endLine) {
            return filePath + ":" + startLine;
        }
        return filePath + ":" + startLine + "-" + endLine;
    }
}
