package io.sagescan.enrich;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Supported completion services and their defaults.
 */
public enum AiProvider {

    OPENAI("openai", "gpt-4-turbo-preview", OpenAiClient.DEFAULT_BASE_URL, "OPENAI_API_KEY") {
        @Override
        public LlmClient createClient(String apiKey, String model, String baseUrl, int maxTokens,
                                      double temperature, Duration timeout) {
            return new OpenAiClient(apiKey, model, baseUrl, maxTokens, temperature, timeout);
        }
    },
    ANTHROPIC("anthropic", "claude-3-5-sonnet-20241022", AnthropicClient.DEFAULT_BASE_URL, "ANTHROPIC_API_KEY") {
        @Override
        public LlmClient createClient(String apiKey, String model, String baseUrl, int maxTokens,
                                      double temperature, Duration timeout) {
            return new AnthropicClient(apiKey, model, baseUrl, maxTokens, temperature, timeout);
        }
    };

    private final String label;
    private final String defaultModel;
    private final String defaultBaseUrl;
    private final String defaultApiKeyEnv;

    AiProvider(String label, String defaultModel, String defaultBaseUrl, String defaultApiKeyEnv) {
        this.label = label;
        this.defaultModel = defaultModel;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultApiKeyEnv = defaultApiKeyEnv;
    }

    public String label() {
        return label;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String defaultApiKeyEnv() {
        return defaultApiKeyEnv;
    }

    public abstract LlmClient createClient(String apiKey, String model, String baseUrl, int maxTokens,
                                           double temperature, Duration timeout);

    /**
     * Case-insensitive lookup by label.
     *
     * @throws IllegalArgumentException for unknown providers
     */
    public static AiProvider parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("AI provider cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.label.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown AI provider: " + value
                        + " (valid values: " + Arrays.stream(values()).map(AiProvider::label)
                        .collect(Collectors.joining(", ")) + ")"));
    }
}
