package io.sagescan.enrich;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link LlmClient} for OpenAI's Chat Completions API ({@code POST /v1/chat/completions}).
 */
public class OpenAiClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.openai.com";

    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String model;
    private final String baseUrl;
    private final int maxTokens;
    private final double temperature;
    private final Duration timeout;

    public OpenAiClient(String apiKey, String model, String baseUrl, int maxTokens, double temperature,
                        Duration timeout) {
        this.apiKey = Objects.requireNonNull(apiKey, "API key missing");
        this.model = Objects.requireNonNull(model, "model missing");
        this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : stripSlash(baseUrl);
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public Completion complete(String systemPrompt, String prompt) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/chat/completions"))
                .header("Authorization", "Bearer " + apiKey)
                .header("content-type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(systemPrompt, prompt)))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EnrichmentException("Request to " + baseUrl + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnrichmentException("Request to " + baseUrl + " interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new EnrichmentException("OpenAI API error " + response.statusCode() + ": " + response.body());
        }
        return parseResponse(response.body());
    }

    String requestBody(String systemPrompt, String prompt) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        ArrayNode messages = body.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.addObject()
                    .put("role", "system")
                    .put("content", systemPrompt);
        }
        messages.addObject()
                .put("role", "user")
                .put("content", prompt);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new EnrichmentException("Cannot encode request", e);
        }
    }

    Completion parseResponse(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EnrichmentException("Malformed response: " + e.getOriginalMessage(), e);
        }
        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new EnrichmentException("Response has no choices");
        }
        String text = choice.path("message").path("content").asText("");
        Usage usage = new Usage(
                root.path("usage").path("prompt_tokens").asInt(0),
                root.path("usage").path("completion_tokens").asInt(0));
        log.debug("Completion used {} input and {} output tokens", usage.inputTokens(), usage.outputTokens());
        return new Completion(text, usage);
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
