package io.sagescan.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable set of pattern rules.
 * <p>
 * Built once through {@link Builder}; each rule's pattern is compiled on registration.
 * Rules whose pattern does not compile are logged and skipped, so a single bad rule
 * never prevents the rest of the catalog from loading.
 */
public class RuleCatalog {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalog.class);

    private static final String DEFAULT_RULES = "/default-rules.yaml";
    private static final String LEXICAL_RULES = "/lexical-rules.yaml";

    private final List<Rule> rules;

    private RuleCatalog(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RuleCatalog empty() {
        return new RuleCatalog(List.of());
    }

    /**
     * Loads the built-in cross-language rules from the classpath.
     */
    public static RuleCatalog loadDefault() {
        return loadResource(DEFAULT_RULES);
    }

    /**
     * Loads the built-in rules used by the lexical detector for languages without a parser.
     */
    public static RuleCatalog loadLexical() {
        return loadResource(LEXICAL_RULES);
    }

    private static RuleCatalog loadResource(String resource) {
        try (InputStream is = RuleCatalog.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Built-in rules not found: " + resource);
            }
            return builder().addAll(RuleFileLoader.parseYaml(is, resource)).build();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load built-in rules " + resource, e);
        }
    }

    /**
     * Returns a new catalog holding this catalog's rules followed by the given ones.
     * Definitions whose id is already present are skipped.
     */
    public RuleCatalog extend(List<RuleDefinition> definitions) {
        Builder builder = builder();
        rules.forEach(builder::add);
        return builder.addAll(definitions).build();
    }

    public List<Rule> rules() {
        return rules;
    }

    /**
     * Returns the rules that list the given language, in registration order.
     */
    public List<Rule> rulesFor(String language) {
        return rules.stream()
                .filter(r -> r.appliesTo(language))
                .toList();
    }

    public Optional<Rule> get(String id) {
        return rules.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public int size() {
        return rules.size();
    }

    public static class Builder {
        private final Map<String, Rule> rules = new LinkedHashMap<>();

        /**
         * Compiles and registers a rule definition. Invalid patterns are logged and skipped.
         */
        public Builder add(RuleDefinition definition) {
            if (rules.containsKey(definition.id())) {
                log.warn("Skipping rule '{}': a rule with this id is already registered", definition.id());
                return this;
            }
            try {
                rules.put(definition.id(), definition.compile());
            } catch (PatternSyntaxException e) {
                log.warn("Skipping rule '{}': invalid pattern: {}", definition.id(), e.getDescription());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping rule '{}': {}", definition.id(), e.getMessage());
            }
            return this;
        }

        public Builder add(Rule rule) {
            if (rules.containsKey(rule.id())) {
                log.warn("Skipping rule '{}': a rule with this id is already registered", rule.id());
                return this;
            }
            rules.put(rule.id(), rule);
            return this;
        }

        public Builder addAll(List<RuleDefinition> definitions) {
            definitions.forEach(this::add);
            return this;
        }

        public RuleCatalog build() {
            return new RuleCatalog(new ArrayList<>(rules.values()));
        }
    }
}
