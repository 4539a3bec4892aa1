package io.sagescan.model;

import java.util.List;

/**
 * File content split into lines, with snippet extraction.
 *
 * @param filePath Path of the file, as used in issue locations
 * @param content  Full text
 * @param lines    Lines without terminators
 */
public record SourceText(String filePath, String content, List<String> lines) {

    private static final int SNIPPET_CONTEXT = 2;

    public SourceText {
        lines = List.copyOf(lines);
    }

    public static SourceText of(String filePath, String content) {
        return new SourceText(filePath, content, content.lines().toList());
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Returns the given 1-based line, or an empty string when out of range.
     */
    public String line(int number) {
        if (number < 1 || number > lines.size()) {
            return "";
        }
        return lines.get(number - 1);
    }

    /**
     * Returns lines {@code start..end} with two lines of context, the flagged lines marked with an arrow.
     */
    public String snippet(int start, int end) {
        if (lines.isEmpty()) {
            return "";
        }
        int from = Math.max(0, start - 1 - SNIPPET_CONTEXT);
        int to = Math.min(lines.size(), end + SNIPPET_CONTEXT);
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            String prefix = (i >= start - 1 && i < end) ? "→ " : "  ";
            sb.append(prefix).append(String.format("%4d | ", i + 1)).append(lines.get(i));
        }
        return sb.toString();
    }

    /**
     * Counts blank and comment-only lines given the language's line-comment prefixes.
     */
    public CodeMetrics lineMetrics(List<String> commentPrefixes) {
        int blank = 0;
        int comments = 0;
        boolean inBlock = false;
        for (String raw : lines) {
            String stripped = raw.strip();
            if (stripped.isEmpty()) {
                blank++;
                continue;
            }
            if (inBlock) {
                comments++;
                if (stripped.contains("*/")) {
                    inBlock = false;
                }
                continue;
            }
            if (stripped.startsWith("/*")) {
                comments++;
                inBlock = !stripped.contains("*/");
                continue;
            }
            if (commentPrefixes.stream().anyMatch(stripped::startsWith)) {
                comments++;
            }
        }
        int total = lines.size();
        return new CodeMetrics(total, total - blank - comments, comments, blank, 0.0);
    }
}
