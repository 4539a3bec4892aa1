package io.sagescan.report;

import io.sagescan.model.Category;
import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.ProjectResult;
import io.sagescan.model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * Layout:
 * - Summary header with compact stats
 * - Category breakdown
 * - Issues grouped by file, in ranked order
 * - Failed files
 * <p>
 * Use the detailed mode to include code snippets, fixes and explanations.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private static final int WIDTH = 70;

    private final boolean useColors;
    private final boolean detailed;

    public ConsoleReporter() {
        this(true, false);
    }

    public ConsoleReporter(boolean useColors) {
        this(useColors, false);
    }

    public ConsoleReporter(boolean useColors, boolean detailed) {
        this.useColors = useColors;
        this.detailed = detailed;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(ProjectResult result, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, result);
        printCompactSummary(out, result);
        printCategoryBreakdown(out, result);
        printIssuesByFile(out, result);
        printFailedFiles(out, result);
        printFooter(out, result);
        out.flush();
    }

    private void printHeader(PrintWriter out, ProjectResult result) {
        out.println();
        out.println(line('=', WIDTH));
        out.println(center("SAGE-SCAN REPORT", WIDTH));
        out.println(line('=', WIDTH));
        out.println();

        out.println("Project: " + result.projectPath());
        out.println("Scan Date: " + result.timestamp());
        out.println();
    }

    private void printCompactSummary(PrintWriter out, ProjectResult result) {
        out.println(bold("SUMMARY"));
        out.println(line('-', WIDTH));

        out.println(String.format("Scanned: %,d files | %d failed | %.1fs",
                result.totalFiles(),
                result.failedFileCount(),
                result.totalTime().toMillis() / 1000.0));

        int critical = result.countBySeverity(Severity.CRITICAL);
        int high = result.countBySeverity(Severity.HIGH);
        StringBuilder issues = new StringBuilder("Issues: ");
        issues.append(critical > 0 ? color(RED, critical + " critical") : "0 critical").append(" | ");
        issues.append(high > 0 ? color(YELLOW, high + " high") : "0 high").append(" | ");
        issues.append(result.countBySeverity(Severity.MEDIUM)).append(" medium | ");
        issues.append(result.countBySeverity(Severity.LOW)).append(" low | ");
        issues.append(result.countBySeverity(Severity.INFO)).append(" info");
        out.println(issues);

        out.println("Auto-fixable: " + result.summary().autoFixableCount());
        if (!result.languages().isEmpty()) {
            StringBuilder languages = new StringBuilder("Languages: ");
            result.languages().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> languages.append(e.getKey()).append(" (").append(e.getValue()).append(") "));
            out.println(languages.toString().stripTrailing());
        }
        out.println();
    }

    private void printCategoryBreakdown(PrintWriter out, ProjectResult result) {
        Map<Category, Integer> byCategory = result.summary().categoryCounts();
        if (byCategory.isEmpty()) {
            return;
        }

        out.println(bold("CATEGORY BREAKDOWN"));
        out.println(line('-', 40));
        byCategory.entrySet().stream()
                .sorted(Map.Entry.<Category, Integer>comparingByValue().reversed()
                        .thenComparing(e -> e.getKey().name()))
                .forEach(e -> out.printf("  %s: %d%n", e.getKey().label(), e.getValue()));
        out.println();
    }

    private void printIssuesByFile(PrintWriter out, ProjectResult result) {
        List<FileRecord> withIssues = result.files().stream()
                .filter(f -> !f.issues().isEmpty())
                .sorted(Comparator.comparingInt((FileRecord f) -> f.issues().size()).reversed())
                .toList();
        if (withIssues.isEmpty()) {
            return;
        }

        out.println(bold("ISSUES BY FILE") + color(CYAN, " (" + withIssues.size() + " files)"));
        out.println(line('=', WIDTH));

        for (FileRecord file : withIssues) {
            out.println(bold(file.filePath()) + color(CYAN, " [" + file.issues().size() + " issues]"));
            for (Issue issue : file.issues()) {
                printIssue(out, issue);
            }
            out.println();
        }
    }

    private void printIssue(PrintWriter out, Issue issue) {
        String fix = issue.autoFixable() ? color(GREEN, " (auto-fixable)") : "";
        out.printf("  %s line %d: %s%s%n",
                getSeverityIndicator(issue.severity()),
                issue.startLine(),
                issue.title(),
                fix);
        if (!issue.description().isEmpty()) {
            out.println("      " + issue.description());
        }
        if (!detailed) {
            return;
        }
        if (issue.codeSnippet() != null && !issue.codeSnippet().isEmpty()) {
            issue.codeSnippet().lines().forEach(l -> out.println("      " + l));
        }
        if (issue.suggestedFix() != null) {
            out.println("      " + color(GREEN, "Fix: " + issue.suggestedFix()));
        }
        if (issue.fixDescription() != null) {
            out.println("      " + issue.fixDescription());
        }
        if (issue.aiExplanation() != null) {
            out.println("      " + color(CYAN, "Explanation:"));
            issue.aiExplanation().lines().forEach(l -> out.println("        " + l));
        }
    }

    private void printFailedFiles(PrintWriter out, ProjectResult result) {
        List<FileRecord> failed = result.files().stream().filter(f -> !f.success()).toList();
        if (failed.isEmpty()) {
            return;
        }
        out.println(bold("FAILED FILES") + color(CYAN, " (" + failed.size() + ")"));
        out.println(line('-', WIDTH));
        for (FileRecord file : failed) {
            out.println("  " + file.filePath() + " - " + file.error());
        }
        out.println();
    }

    private void printFooter(PrintWriter out, ProjectResult result) {
        out.println(line('=', WIDTH));

        int critical = result.countBySeverity(Severity.CRITICAL);
        int high = result.countBySeverity(Severity.HIGH);

        if (critical > 0) {
            out.println(color(RED, bold("ACTION REQUIRED: " + critical + " critical issue(s) must be fixed.")));
        } else if (high > 0) {
            out.println(color(YELLOW, "ATTENTION: " + high + " high-severity issue(s) should be reviewed."));
        } else if (result.totalIssues() == 0) {
            out.println(color(GREEN, "No issues found."));
        } else {
            out.println(color(GREEN, "No critical issues found. Review medium/low issues as needed."));
        }

        if (!detailed && result.totalIssues() > 0) {
            out.println();
            out.println("Run with --detailed for code snippets and fixes.");
        }

        out.println();
    }

    private String getSeverityIndicator(Severity severity) {
        return switch (severity) {
            case CRITICAL -> color(RED, "[CRIT]");
            case HIGH -> color(YELLOW, "[HIGH]");
            case MEDIUM -> "[MED] ";
            case LOW -> "[LOW] ";
            case INFO -> color(CYAN, "[INFO]");
        };
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
