package io.sagescan.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagescan.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads rule definitions from JSON or YAML files.
 * <p>
 * Both formats hold a top-level {@code rules} list. Entries that are malformed
 * (missing keys, unknown severity or category) are logged and skipped.
 */
public final class RuleFileLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleFileLoader.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private RuleFileLoader() {
    }

    /**
     * Loads a user rule file. {@code .json} files are read as JSON, anything else as YAML.
     *
     * @throws ConfigurationException if the file cannot be read or is not a rule file at all
     */
    public static List<RuleDefinition> load(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        try (InputStream is = Files.newInputStream(file)) {
            List<RuleDefinition> definitions = name.endsWith(".json")
                    ? parseJson(is, file.toString())
                    : parseYaml(is, file.toString());
            log.info("Loaded {} custom rules from {}", definitions.size(), file);
            return definitions;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read rule file " + file + ": " + e.getMessage(), e);
        }
    }

    public static List<RuleDefinition> parseYaml(InputStream is, String source) {
        Object data;
        try {
            data = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in rule file " + source + ": " + e.getMessage(), e);
        }
        return fromDocument(data, source);
    }

    public static List<RuleDefinition> parseJson(InputStream is, String source) throws IOException {
        Object data;
        try {
            data = JSON.readValue(is, Object.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid JSON in rule file " + source + ": " + e.getOriginalMessage(), e);
        }
        return fromDocument(data, source);
    }

    private static List<RuleDefinition> fromDocument(Object data, String source) {
        if (data == null) {
            return List.of();
        }
        if (!(data instanceof Map<?, ?> document)) {
            throw new ConfigurationException("Rule file " + source + " must contain a mapping with a 'rules' list");
        }
        Object rules = document.get("rules");
        if (rules == null) {
            return List.of();
        }
        if (!(rules instanceof List<?> entries)) {
            throw new ConfigurationException("'rules' in " + source + " must be a list");
        }

        List<RuleDefinition> definitions = new ArrayList<>();
        int index = 0;
        for (Object entry : entries) {
            index++;
            if (!(entry instanceof Map<?, ?> map)) {
                log.warn("Skipping rule #{} in {}: not a mapping", index, source);
                continue;
            }
            try {
                definitions.add(RuleDefinition.fromMap(map));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping rule #{} ({}) in {}: {}", index, map.get("id"), source, e.getMessage());
            }
        }
        return definitions;
    }
}
