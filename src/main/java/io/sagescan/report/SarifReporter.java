package io.sagescan.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sagescan.model.Issue;
import io.sagescan.model.Location;
import io.sagescan.model.ProjectResult;
import io.sagescan.model.Severity;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a SARIF 2.1.0 log with one run.
 * <p>
 * Rules are the distinct rule or check ids of the reported issues, in first-seen order.
 * Levels: CRITICAL and HIGH map to {@code error}, MEDIUM to {@code warning}, the rest to {@code note}.
 */
public class SarifReporter implements Reporter {

    static final String SCHEMA = "https://json.schemastore.org/sarif-2.1.0.json";

    private final ObjectMapper mapper = new ObjectMapper();

    public SarifReporter() {
        mapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    @Override
    public String format() {
        return "sarif";
    }

    @Override
    public void write(ProjectResult result, Writer writer) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(writer, toSarif(result));
    }

    ObjectNode toSarif(ProjectResult result) {
        List<Issue> issues = result.allIssues();

        Map<String, Issue> rules = new LinkedHashMap<>();
        for (Issue issue : issues) {
            rules.putIfAbsent(ruleIdOf(issue), issue);
        }
        Map<String, Integer> ruleIndex = new LinkedHashMap<>();

        ObjectNode root = mapper.createObjectNode();
        root.put("$schema", SCHEMA);
        root.put("version", "2.1.0");
        ObjectNode run = root.putArray("runs").addObject();

        ObjectNode driver = run.putObject("tool").putObject("driver");
        driver.put("name", "sage-scan");
        driver.put("version", JsonReporter.TOOL_VERSION);
        ArrayNode ruleArray = driver.putArray("rules");
        for (Map.Entry<String, Issue> entry : rules.entrySet()) {
            Issue sample = entry.getValue();
            ruleIndex.put(entry.getKey(), ruleIndex.size());
            ObjectNode rule = ruleArray.addObject();
            rule.put("id", entry.getKey());
            rule.put("name", sample.title());
            rule.putObject("shortDescription").put("text", sample.title());
            if (!sample.description().isEmpty()) {
                rule.putObject("fullDescription").put("text", sample.description());
            }
            rule.putObject("defaultConfiguration").put("level", level(sample.severity()));
            rule.putObject("properties").put("category", sample.category().label());
        }

        ArrayNode results = run.putArray("results");
        for (Issue issue : issues) {
            String ruleId = ruleIdOf(issue);
            ObjectNode entry = results.addObject();
            entry.put("ruleId", ruleId);
            entry.put("ruleIndex", ruleIndex.get(ruleId));
            entry.put("level", level(issue.severity()));
            String text = issue.description().isEmpty() ? issue.title() : issue.title() + ": " + issue.description();
            entry.putObject("message").put("text", text);

            Location loc = issue.location();
            ObjectNode physical = entry.putArray("locations").addObject().putObject("physicalLocation");
            physical.putObject("artifactLocation").put("uri", toUri(loc.filePath()));
            ObjectNode region = physical.putObject("region");
            region.put("startLine", loc.startLine());
            region.put("endLine", loc.endLine());
            if (loc.startColumn() != null) {
                region.put("startColumn", loc.startColumn());
            }
            if (loc.endColumn() != null) {
                // SARIF end columns are exclusive
                region.put("endColumn", loc.endColumn() + 1);
            }
            entry.putObject("partialFingerprints").put("sageScanIssueId/v1", issue.id());
            if (issue.suggestedFix() != null) {
                entry.putObject("properties").put("suggestedFix", issue.suggestedFix());
            }
        }
        return root;
    }

    static String level(Severity severity) {
        return switch (severity) {
            case CRITICAL, HIGH -> "error";
            case MEDIUM -> "warning";
            case LOW, INFO -> "note";
        };
    }

    private static String ruleIdOf(Issue issue) {
        return issue.ruleId() != null ? issue.ruleId() : issue.title();
    }

    private static String toUri(String path) {
        return path.replace('\\', '/');
    }
}
