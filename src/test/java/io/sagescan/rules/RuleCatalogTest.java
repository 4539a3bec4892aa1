package io.sagescan.rules;

import io.sagescan.model.Category;
import io.sagescan.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class RuleCatalogTest {

    private static RuleDefinition definition(String id, String pattern, String... languages) {
        return new RuleDefinition(id, id, "", pattern, Severity.LOW, Category.STYLE,
                Set.of(languages), "msg", null, false, List.of());
    }

    @Test
    void loadDefault_containsBuiltInRules() {
        RuleCatalog catalog = RuleCatalog.loadDefault();

        assertThat(catalog.size()).isEqualTo(8);
        assertThat(catalog.get("hardcoded-password")).isPresent();
        assertThat(catalog.get("except-pass").orElseThrow().languages()).containsExactly("python");
    }

    @Test
    void loadDefault_compilesFlags() {
        Rule password = RuleCatalog.loadDefault().get("hardcoded-password").orElseThrow();

        assertThat(password.flags() & Pattern.CASE_INSENSITIVE).isNotZero();
        assertThat(password.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(password.category()).isEqualTo(Category.SECURITY);
    }

    @Test
    void loadLexical_containsJavaScriptRules() {
        RuleCatalog catalog = RuleCatalog.loadLexical();

        assertThat(catalog.rulesFor("javascript")).extracting(Rule::id)
                .contains("js-console-log", "js-loose-equality", "js-var", "js-eval", "js-debugger");
        assertThat(catalog.rulesFor("python")).isEmpty();
    }

    @Test
    void builder_skipsRuleWithInvalidPattern() {
        RuleCatalog catalog = RuleCatalog.builder()
                .add(definition("broken", "([unclosed", "python"))
                .add(definition("fine", "x", "python"))
                .build();

        assertThat(catalog.rules()).extracting(Rule::id).containsExactly("fine");
    }

    @Test
    void builder_skipsRuleWithUnknownFlag() {
        RuleDefinition flagged = new RuleDefinition("flagged", "Flagged", "", "x", Severity.LOW,
                Category.STYLE, Set.of("python"), "msg", null, false, List.of("NOT_A_FLAG"));

        assertThat(RuleCatalog.builder().add(flagged).build().size()).isZero();
    }

    @Test
    void builder_keepsFirstRuleForDuplicateId() {
        RuleCatalog catalog = RuleCatalog.builder()
                .add(definition("dup", "first", "python"))
                .add(definition("dup", "second", "python"))
                .build();

        assertThat(catalog.size()).isEqualTo(1);
        assertThat(catalog.get("dup").orElseThrow().pattern().pattern()).isEqualTo("first");
    }

    @Test
    void extend_appendsNewRulesAfterExisting() {
        RuleCatalog base = RuleCatalog.builder().add(definition("a", "a", "python")).build();

        RuleCatalog extended = base.extend(List.of(definition("b", "b", "python"), definition("a", "z", "python")));

        assertThat(extended.rules()).extracting(Rule::id).containsExactly("a", "b");
        assertThat(base.size()).isEqualTo(1);
    }

    @Test
    void rulesFor_returnsOnlyRulesListingTheLanguage() {
        RuleCatalog catalog = RuleCatalog.builder()
                .add(definition("py", "x", "python"))
                .add(definition("both", "x", "python", "java"))
                .add(definition("none", "x"))
                .build();

        assertThat(catalog.rulesFor("java")).extracting(Rule::id).containsExactly("both");
        assertThat(catalog.rulesFor("python")).extracting(Rule::id).containsExactly("py", "both");
    }
}
