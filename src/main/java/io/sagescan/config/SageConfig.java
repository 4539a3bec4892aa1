package io.sagescan.config;

import io.sagescan.detectors.AnalysisSettings;
import io.sagescan.enrich.AiProvider;
import io.sagescan.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Run configuration loaded from YAML.
 * <p>
 * The built-in defaults ({@code /sage-scan-defaults.yaml}) are always loaded first; a user
 * file only needs the keys it changes. Keys may be written in camelCase or snake_case.
 * Every value is validated when the configuration is built, so an invalid file fails fast
 * with a {@link ConfigurationException} naming the offending key.
 */
public class SageConfig {

    private static final Logger log = LoggerFactory.getLogger(SageConfig.class);

    public static final String DEFAULT_CONFIG = "/sage-scan-defaults.yaml";
    public static final String PROJECT_CONFIG_FILE = "sage-scan.yaml";

    private static final Set<String> SECTIONS = Set.of("analysis", "security", "ai");
    private static final Set<String> TOP_LEVEL_LISTS = Set.of("includePatterns", "ignorePatterns");

    private final Map<String, Object> raw;

    private final int maxComplexity;
    private final int maxFunctionLength;
    private final int maxParameters;
    private final boolean parallel;
    private final int maxWorkers;
    private final Severity minSeverity;
    private final String customRules;

    private final boolean securityEnabled;
    private final double minEntropy;

    private final boolean aiEnabled;
    private final AiProvider aiProvider;
    private final String aiModel;
    private final String aiBaseUrl;
    private final String aiApiKeyEnv;
    private final int aiMaxIssues;
    private final int aiMaxTokens;
    private final double aiTemperature;
    private final int aiTimeoutSeconds;

    private final List<String> includePatterns;
    private final List<String> ignorePatterns;

    private SageConfig(Map<String, Object> raw) {
        this.raw = raw;
        Map<String, Object> analysis = section(raw, "analysis");
        Map<String, Object> security = section(raw, "security");
        Map<String, Object> ai = section(raw, "ai");

        this.maxComplexity = positiveInt(analysis, "analysis", "maxComplexity", AnalysisSettings.DEFAULT_MAX_COMPLEXITY);
        this.maxFunctionLength = positiveInt(analysis, "analysis", "maxFunctionLength",
                AnalysisSettings.DEFAULT_MAX_FUNCTION_LENGTH);
        this.maxParameters = nonNegativeInt(analysis, "analysis", "maxParameters", AnalysisSettings.DEFAULT_MAX_PARAMETERS);
        this.parallel = bool(analysis, "analysis", "parallel", true);
        this.maxWorkers = positiveInt(analysis, "analysis", "maxWorkers", 4);
        this.minSeverity = severity(analysis, "analysis", "minSeverity", Severity.INFO);
        this.customRules = string(analysis, "analysis", "customRules", null);

        this.securityEnabled = bool(security, "security", "enabled", true);
        this.minEntropy = number(security, "security", "minEntropy", 4.5);
        if (minEntropy < 0) {
            throw new ConfigurationException("security.minEntropy must be >= 0, was " + minEntropy);
        }

        this.aiEnabled = bool(ai, "ai", "enabled", false);
        this.aiProvider = provider(ai, "ai", "provider", AiProvider.OPENAI);
        this.aiModel = string(ai, "ai", "model", aiProvider.defaultModel());
        this.aiBaseUrl = string(ai, "ai", "baseUrl", aiProvider.defaultBaseUrl());
        this.aiApiKeyEnv = string(ai, "ai", "apiKeyEnv", aiProvider.defaultApiKeyEnv());
        this.aiMaxIssues = nonNegativeInt(ai, "ai", "maxIssues", 10);
        this.aiMaxTokens = positiveInt(ai, "ai", "maxTokens", 2000);
        this.aiTemperature = number(ai, "ai", "temperature", 0.3);
        this.aiTimeoutSeconds = positiveInt(ai, "ai", "timeoutSeconds", 30);

        this.includePatterns = stringList(raw, "includePatterns");
        this.ignorePatterns = stringList(raw, "ignorePatterns");

        for (String key : raw.keySet()) {
            if (!SECTIONS.contains(key) && !TOP_LEVEL_LISTS.contains(key)) {
                log.warn("Ignoring unknown configuration key '{}'", key);
            }
        }
    }

    /**
     * Loads the built-in defaults from the classpath.
     */
    public static SageConfig loadDefault() {
        return new SageConfig(defaultMap());
    }

    /**
     * Loads a user file on top of the defaults.
     *
     * @throws ConfigurationException if the file cannot be read or holds invalid values
     */
    public static SageConfig loadFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            Map<String, Object> user = parse(is, path.toString());
            log.debug("Loaded configuration from {}", path);
            return new SageConfig(merge(defaultMap(), user));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the configuration for a run: the explicit file when given, otherwise
     * {@code sage-scan.yaml} in the project directory, otherwise the defaults.
     */
    public static SageConfig resolve(Path explicitFile, Path projectRoot) {
        if (explicitFile != null) {
            if (!Files.isRegularFile(explicitFile)) {
                throw new ConfigurationException("Configuration file not found: " + explicitFile);
            }
            return loadFromFile(explicitFile);
        }
        if (projectRoot != null && Files.isDirectory(projectRoot)) {
            Path projectConfig = projectRoot.resolve(PROJECT_CONFIG_FILE);
            if (Files.isRegularFile(projectConfig)) {
                return loadFromFile(projectConfig);
            }
        }
        return loadDefault();
    }

    /**
     * Returns the text of the built-in default file, as written by {@code sage-scan init}.
     */
    public static String defaultYaml() {
        try (InputStream is = openDefault()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_CONFIG, e);
        }
    }

    /**
     * Merges two configuration documents, {@code override} taking precedence.
     * Sections merge key by key; {@code ignorePatterns} are combined, other lists are replaced.
     */
    static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> entry : override.entrySet()) {
            String key = normalize(entry.getKey());
            Object value = entry.getValue();
            Object current = merged.get(key);
            if (current instanceof Map<?, ?> currentMap && value instanceof Map<?, ?> valueMap) {
                Map<String, Object> section = new LinkedHashMap<>();
                currentMap.forEach((k, v) -> section.put(normalize(String.valueOf(k)), v));
                valueMap.forEach((k, v) -> section.put(normalize(String.valueOf(k)), v));
                merged.put(key, section);
            } else if ("ignorePatterns".equals(key) && current instanceof List<?> a && value instanceof List<?> b) {
                Set<Object> union = new LinkedHashSet<>(a);
                union.addAll(b);
                merged.put(key, new ArrayList<>(union));
            } else {
                merged.put(key, value);
            }
        }
        return merged;
    }

    /**
     * Returns a copy with one section value replaced, validated like a loaded file.
     */
    public SageConfig with(String section, String key, Object value) {
        Map<String, Object> override = Map.of(section, Map.of(key, value));
        return new SageConfig(merge(raw, override));
    }

    public SageConfig withSecurityEnabled(boolean enabled) {
        return with("security", "enabled", enabled);
    }

    public SageConfig withAiEnabled(boolean enabled) {
        return with("ai", "enabled", enabled);
    }

    public SageConfig withParallel(boolean enabled) {
        return with("analysis", "parallel", enabled);
    }

    public SageConfig withMaxWorkers(int workers) {
        return with("analysis", "maxWorkers", workers);
    }

    public SageConfig withMinSeverity(Severity severity) {
        return with("analysis", "minSeverity", severity.label());
    }

    public AnalysisSettings toAnalysisSettings() {
        return new AnalysisSettings(maxComplexity, maxFunctionLength, maxParameters);
    }

    // ---- Loading helpers ----

    private static InputStream openDefault() {
        InputStream is = SageConfig.class.getResourceAsStream(DEFAULT_CONFIG);
        if (is == null) {
            throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
        }
        return is;
    }

    private static Map<String, Object> defaultMap() {
        try (InputStream is = openDefault()) {
            return parse(is, DEFAULT_CONFIG);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    private static Map<String, Object> parse(InputStream is, String source) {
        Object data;
        try {
            data = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (data == null) {
            return Map.of();
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Configuration " + source + " must be a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(normalize(String.valueOf(k)), v));
        return result;
    }

    /**
     * Converts snake_case keys to camelCase.
     */
    static String normalize(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder sb = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = sb.length() > 0;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }

    private static Map<String, Object> section(Map<String, Object> root, String name) {
        Object value = root.get(name);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException("'" + name + "' must be a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(normalize(String.valueOf(k)), v));
        return result;
    }

    private static int positiveInt(Map<String, Object> section, String name, String key, int fallback) {
        int value = integer(section, name, key, fallback);
        if (value < 1) {
            throw new ConfigurationException(name + "." + key + " must be >= 1, was " + value);
        }
        return value;
    }

    private static int nonNegativeInt(Map<String, Object> section, String name, String key, int fallback) {
        int value = integer(section, name, key, fallback);
        if (value < 0) {
            throw new ConfigurationException(name + "." + key + " must be >= 0, was " + value);
        }
        return value;
    }

    private static int integer(Map<String, Object> section, String name, String key, int fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return n.intValue();
        }
        throw new ConfigurationException(name + "." + key + " must be an integer, was '" + value + "'");
    }

    private static double number(Map<String, Object> section, String name, String key, double fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new ConfigurationException(name + "." + key + " must be a number, was '" + value + "'");
    }

    private static boolean bool(Map<String, Object> section, String name, String key, boolean fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new ConfigurationException(name + "." + key + " must be true or false, was '" + value + "'");
    }

    private static String string(Map<String, Object> section, String name, String key, String fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof String s) {
            return s.isBlank() ? fallback : s.trim();
        }
        throw new ConfigurationException(name + "." + key + " must be a string, was '" + value + "'");
    }

    private static Severity severity(Map<String, Object> section, String name, String key, Severity fallback) {
        String value = string(section, name, key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Severity.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(name + "." + key + ": " + e.getMessage(), e);
        }
    }

    private static AiProvider provider(Map<String, Object> section, String name, String key, AiProvider fallback) {
        String value = string(section, name, key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return AiProvider.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(name + "." + key + ": " + e.getMessage(), e);
        }
    }

    private static List<String> stringList(Map<String, Object> root, String key) {
        Object value = root.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list of glob patterns");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof String s)) {
                throw new ConfigurationException("'" + key + "' entries must be strings, found '" + item + "'");
            }
            if (!s.isBlank()) {
                result.add(s.trim());
            }
        }
        return List.copyOf(result);
    }

    // ---- Getters ----

    public int getMaxComplexity() {
        return maxComplexity;
    }

    public int getMaxFunctionLength() {
        return maxFunctionLength;
    }

    public int getMaxParameters() {
        return maxParameters;
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public Severity getMinSeverity() {
        return minSeverity;
    }

    public Optional<String> getCustomRules() {
        return Optional.ofNullable(customRules);
    }

    public boolean isSecurityEnabled() {
        return securityEnabled;
    }

    public double getMinEntropy() {
        return minEntropy;
    }

    public boolean isAiEnabled() {
        return aiEnabled;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public String getAiModel() {
        return aiModel;
    }

    public String getAiBaseUrl() {
        return aiBaseUrl;
    }

    public String getAiApiKeyEnv() {
        return aiApiKeyEnv;
    }

    public int getAiMaxIssues() {
        return aiMaxIssues;
    }

    public int getAiMaxTokens() {
        return aiMaxTokens;
    }

    public double getAiTemperature() {
        return aiTemperature;
    }

    public int getAiTimeoutSeconds() {
        return aiTimeoutSeconds;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getIgnorePatterns() {
        return ignorePatterns;
    }
}
