package io.sagescan.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.sagescan.model.Category;
import io.sagescan.model.CodeMetrics;
import io.sagescan.model.FileRecord;
import io.sagescan.model.Issue;
import io.sagescan.model.Location;
import io.sagescan.model.ProjectResult;
import io.sagescan.model.Severity;

import java.io.IOException;
import java.io.Writer;
import java.util.Comparator;
import java.util.Map;

/**
 * Writes the result as a JSON document mirroring the result graph.
 * Severities and categories use their lowercase labels; the timestamp is ISO-8601.
 */
public class JsonReporter implements Reporter {

    static final String TOOL_VERSION = "1.0.0";

    private final ObjectMapper mapper;
    private final boolean pretty;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean pretty) {
        this.pretty = pretty;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // the caller owns the writer
        this.mapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(ProjectResult result, Writer writer) throws IOException {
        ObjectNode root = toJson(result);
        if (pretty) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, root);
        } else {
            mapper.writeValue(writer, root);
        }
    }

    ObjectNode toJson(ProjectResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("tool", "sage-scan");
        root.put("version", TOOL_VERSION);
        root.put("projectPath", result.projectPath());
        root.set("timestamp", mapper.valueToTree(result.timestamp()));
        root.put("totalFiles", result.totalFiles());
        root.put("totalIssues", result.totalIssues());
        root.put("totalTimeMs", result.totalTime().toMillis());

        ObjectNode languages = root.putObject("languages");
        result.languages().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> languages.put(e.getKey(), e.getValue()));

        ObjectNode summary = root.putObject("summary");
        ObjectNode severities = summary.putObject("bySeverity");
        result.summary().severityCounts().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Severity.BY_RANK.reversed()))
                .forEach(e -> severities.put(e.getKey().label(), e.getValue()));
        ObjectNode categories = summary.putObject("byCategory");
        result.summary().categoryCounts().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.comparing(Category::name)))
                .forEach(e -> categories.put(e.getKey().label(), e.getValue()));
        summary.put("autoFixable", result.summary().autoFixableCount());
        summary.put("failedFiles", result.failedFileCount());

        ArrayNode files = root.putArray("files");
        for (FileRecord record : result.files()) {
            files.add(fileJson(record));
        }
        return root;
    }

    private ObjectNode fileJson(FileRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put("path", record.filePath());
        node.put("language", record.language());
        node.put("success", record.success());
        if (record.error() != null) {
            node.put("error", record.error());
        }
        node.put("durationMs", record.duration().toMillis());
        if (record.metrics() != null) {
            CodeMetrics m = record.metrics();
            ObjectNode metrics = node.putObject("metrics");
            metrics.put("linesOfCode", m.linesOfCode());
            metrics.put("sourceLines", m.sourceLinesOfCode());
            metrics.put("commentLines", m.commentLines());
            metrics.put("blankLines", m.blankLines());
            metrics.put("averageComplexity", m.cyclomaticComplexity());
        }
        ArrayNode issues = node.putArray("issues");
        for (Issue issue : record.issues()) {
            issues.add(issueJson(issue));
        }
        return node;
    }

    private ObjectNode issueJson(Issue issue) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", issue.id());
        node.put("title", issue.title());
        node.put("description", issue.description());
        node.put("severity", issue.severity().label());
        node.put("category", issue.category().label());

        Location loc = issue.location();
        ObjectNode location = node.putObject("location");
        location.put("file", loc.filePath());
        location.put("startLine", loc.startLine());
        location.put("endLine", loc.endLine());
        if (loc.startColumn() != null) {
            location.put("startColumn", loc.startColumn());
        }
        if (loc.endColumn() != null) {
            location.put("endColumn", loc.endColumn());
        }

        putIfPresent(node, "codeSnippet", issue.codeSnippet());
        putIfPresent(node, "suggestedFix", issue.suggestedFix());
        putIfPresent(node, "fixDescription", issue.fixDescription());
        putIfPresent(node, "aiExplanation", issue.aiExplanation());
        node.put("confidence", issue.confidence());
        node.put("autoFixable", issue.autoFixable());
        putIfPresent(node, "ruleId", issue.ruleId());
        if (!issue.metadata().isEmpty()) {
            node.set("metadata", mapper.valueToTree(issue.metadata()));
        }
        return node;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
