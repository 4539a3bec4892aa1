package io.sagescan.enrich;

import io.sagescan.model.Category;
import io.sagescan.model.Issue;
import io.sagescan.model.Location;
import io.sagescan.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AiEnricherTest {

    private static final String FIX_ANSWER = """
            EXPLANATION:
            Compare values with ==.

            FIXED_CODE:
            ```python
            if x == 5:
            ```
            """;

    /**
     * Answers fix prompts with a canned fix and everything else with a fixed explanation.
     */
    private static final class ScriptedClient implements LlmClient {
        final List<String> prompts = new ArrayList<>();

        @Override
        public Completion complete(String systemPrompt, String prompt) {
            prompts.add(prompt);
            String text = prompt.startsWith("Suggest a fix") ? FIX_ANSWER : "  Identity is not equality.  ";
            return new Completion(text, new Usage(10, 20));
        }
    }

    private static Issue issue(Severity severity, String suggestedFix) {
        return Issue.builder()
                .id("abc123")
                .title("Identity Check with Literal")
                .description("Use '==' for value comparison, not 'is'")
                .severity(severity)
                .category(Category.BUG)
                .location(Location.line("pkg/checker.py", 5))
                .codeSnippet("→    5 | if x is 5:")
                .suggestedFix(suggestedFix)
                .build();
    }

    @Test
    void enrich_addsExplanationAndFixForMediumIssue() {
        ScriptedClient client = new ScriptedClient();

        List<Issue> enriched = new AiEnricher(client).enrich(List.of(issue(Severity.MEDIUM, null)));

        assertThat(enriched).singleElement().satisfies(issue -> {
            assertThat(issue.aiExplanation()).isEqualTo("Identity is not equality.");
            assertThat(issue.suggestedFix()).isEqualTo("if x == 5:");
            assertThat(issue.fixDescription()).isEqualTo("Compare values with ==.");
        });
        assertThat(client.prompts).hasSize(2);
        assertThat(client.prompts.get(0)).contains("Code (python):").contains("if x is 5:");
    }

    @Test
    void enrich_keepsExistingFixAndSkipsFixForLowSeverity() {
        ScriptedClient client = new ScriptedClient();

        List<Issue> enriched = new AiEnricher(client).enrich(List.of(
                issue(Severity.HIGH, "Replace 'is' with '=='"),
                issue(Severity.LOW, null)));

        assertThat(enriched.get(0).suggestedFix()).isEqualTo("Replace 'is' with '=='");
        assertThat(enriched.get(1).suggestedFix()).isNull();
        assertThat(enriched).allSatisfy(i -> assertThat(i.aiExplanation()).isNotNull());
        assertThat(client.prompts).hasSize(2).noneMatch(p -> p.startsWith("Suggest a fix"));
    }

    @Test
    void enrich_leavesIssueUnchangedWhenClientFails() {
        LlmClient failing = (system, prompt) -> {
            throw new EnrichmentException("rate limited");
        };
        Issue original = issue(Severity.CRITICAL, null);

        List<Issue> enriched = new AiEnricher(failing).enrich(List.of(original, original));

        assertThat(enriched).containsExactly(original, original);
    }

    @Test
    void fixSuggestion_parsesAnswerWithoutFence() {
        AiEnricher.FixSuggestion fix = AiEnricher.FixSuggestion.parse("EXPLANATION: use a set\nFIXED_CODE:\nitems = set()\n");

        assertThat(fix.explanation()).isEqualTo("use a set");
        assertThat(fix.code()).isEqualTo("items = set()");
    }

    @Test
    void fixSuggestion_treatsUnstructuredAnswerAsExplanation() {
        AiEnricher.FixSuggestion fix = AiEnricher.FixSuggestion.parse("Just use ==.");

        assertThat(fix.explanation()).isEqualTo("Just use ==.");
        assertThat(fix.code()).isEmpty();
    }

    @Test
    void languageOf_mapsKnownExtensions() {
        assertThat(AiEnricher.languageOf("src/app.TSX")).isEqualTo("typescript");
        assertThat(AiEnricher.languageOf("Main.java")).isEqualTo("java");
        assertThat(AiEnricher.languageOf("Makefile")).isEqualTo("unknown");
        assertThat(AiEnricher.languageOf("notes.txt")).isEqualTo("unknown");
    }
}
