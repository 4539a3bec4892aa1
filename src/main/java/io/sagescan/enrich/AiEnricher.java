package io.sagescan.enrich;

import io.sagescan.model.Issue;
import io.sagescan.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Enriches issues through an {@link LlmClient}: an explanation for every issue that has none,
 * and a fix for MEDIUM and more severe issues that have no suggested fix yet.
 * A failed request leaves that issue unchanged and moves on to the next one.
 */
public class AiEnricher implements IssueEnricher {

    private static final Logger log = LoggerFactory.getLogger(AiEnricher.class);

    static final String SYSTEM_PROMPT = "You are an expert software engineer explaining code issues.";

    private static final Map<String, String> LANGUAGES = Map.of(
            ".py", "python",
            ".pyw", "python",
            ".java", "java",
            ".js", "javascript",
            ".jsx", "javascript",
            ".mjs", "javascript",
            ".cjs", "javascript",
            ".ts", "typescript",
            ".tsx", "typescript"
    );

    private static final Pattern CODE_FENCE = Pattern.compile("```[A-Za-z0-9_+-]*");

    private final LlmClient client;

    public AiEnricher(LlmClient client) {
        this.client = client;
    }

    @Override
    public List<Issue> enrich(List<Issue> issues) {
        log.info("Enriching {} issues", issues.size());
        List<Issue> result = new ArrayList<>(issues.size());
        for (Issue issue : issues) {
            result.add(enrichOne(issue));
        }
        return result;
    }

    private Issue enrichOne(Issue issue) {
        try {
            String language = languageOf(issue.filePath());
            String explanation = null;
            if (issue.aiExplanation() == null) {
                explanation = client.complete(SYSTEM_PROMPT, explainPrompt(issue, language)).text().strip();
            }
            FixSuggestion fix = null;
            if (issue.suggestedFix() == null && issue.severity().isAtLeast(Severity.MEDIUM)) {
                fix = FixSuggestion.parse(client.complete(SYSTEM_PROMPT, fixPrompt(issue, language)).text());
            }
            log.debug("Enriched issue {} ({})", issue.id(), issue.title());
            return issue.withEnrichment(
                    blankToNull(explanation),
                    fix != null ? blankToNull(fix.code()) : null,
                    fix != null ? blankToNull(fix.explanation()) : null);
        } catch (EnrichmentException e) {
            log.warn("Failed to enrich issue {} at {}: {}", issue.id(), issue.location(), e.getMessage());
            return issue;
        }
    }

    static String explainPrompt(Issue issue, String language) {
        return """
                Explain this code issue in detail:

                Issue: %s

                Code (%s):
                ```%s
                %s
                ```

                Provide:
                1. Why this is an issue
                2. Potential impact
                3. How to fix it
                4. Best practices to avoid it

                Keep the explanation clear and concise.""".formatted(
                issue.description(), language, language, snippetOf(issue));
    }

    static String fixPrompt(Issue issue, String language) {
        return """
                Suggest a fix for this code issue:

                Issue: %s

                Original Code (%s):
                ```%s
                %s
                ```

                Provide:
                1. Brief explanation of the fix
                2. Fixed code

                Format your response as:
                EXPLANATION:
                [your explanation]

                FIXED_CODE:
                ```%s
                [fixed code]
                ```
                """.formatted(issue.description(), language, language, snippetOf(issue), language);
    }

    static String languageOf(String filePath) {
        int dot = filePath.lastIndexOf('.');
        if (dot < 0) {
            return "unknown";
        }
        return LANGUAGES.getOrDefault(filePath.substring(dot).toLowerCase(Locale.ROOT), "unknown");
    }

    private static String snippetOf(Issue issue) {
        return issue.codeSnippet() != null ? issue.codeSnippet() : "";
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * A fix answer split into its explanation and code parts.
     */
    record FixSuggestion(String explanation, String code) {

        static FixSuggestion parse(String response) {
            int marker = response.indexOf("FIXED_CODE:");
            String head = marker >= 0 ? response.substring(0, marker) : response;
            String explanation = head.replace("EXPLANATION:", "").strip();
            String code = "";
            if (marker >= 0) {
                code = CODE_FENCE.matcher(response.substring(marker + "FIXED_CODE:".length()))
                        .replaceAll("")
                        .strip();
            }
            return new FixSuggestion(explanation, code);
        }
    }
}
