package io.sagescan.enrich;

/**
 * Minimal text-generation client.
 */
public interface LlmClient {

    record Usage(int inputTokens, int outputTokens) {
    }

    record Completion(String text, Usage usage) {
    }

    /**
     * Sends one prompt and returns the generated text.
     *
     * @throws EnrichmentException if the service fails or answers with an error status
     */
    Completion complete(String systemPrompt, String prompt);
}
