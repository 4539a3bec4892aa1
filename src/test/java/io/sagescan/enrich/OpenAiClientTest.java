package io.sagescan.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiClientTest {

    private static final String ANSWER = """
            {"id": "chatcmpl-1", "object": "chat.completion",
             "choices": [
               {"index": 0, "message": {"role": "assistant", "content": "Use equality."}, "finish_reason": "stop"}
             ],
             "usage": {"prompt_tokens": 12, "completion_tokens": 3, "total_tokens": 15}}
            """;

    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String reply = ANSWER;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private OpenAiClient client() {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new OpenAiClient("test-key", "gpt-4-turbo-preview", baseUrl, 256, 0.3, Duration.ofSeconds(5));
    }

    @Test
    void complete_postsChatMessagesAndReadsFirstChoice() throws IOException {
        LlmClient.Completion completion = client().complete("system text", "explain this");

        assertThat(completion.text()).isEqualTo("Use equality.");
        assertThat(completion.usage()).isEqualTo(new LlmClient.Usage(12, 3));
        assertThat(lastAuthorization.get()).isEqualTo("Bearer test-key");

        JsonNode body = mapper.readTree(lastBody.get());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4-turbo-preview");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(256);
        JsonNode messages = body.path("messages");
        assertThat(messages.size()).isEqualTo(2);
        assertThat(messages.get(0).path("role").asText()).isEqualTo("system");
        assertThat(messages.get(0).path("content").asText()).isEqualTo("system text");
        assertThat(messages.get(1).path("role").asText()).isEqualTo("user");
        assertThat(messages.get(1).path("content").asText()).isEqualTo("explain this");
    }

    @Test
    void complete_failsOnErrorStatus() {
        status = 429;
        reply = "{\"error\":{\"type\":\"rate_limit_exceeded\"}}";

        assertThatThrownBy(() -> client().complete("s", "p"))
                .isInstanceOf(EnrichmentException.class)
                .hasMessageContaining("429");
    }

    @Test
    void parseResponse_rejectsMissingChoicesAndMalformedJson() {
        assertThatThrownBy(() -> client().parseResponse("{\"choices\": []}"))
                .isInstanceOf(EnrichmentException.class)
                .hasMessageContaining("no choices");
        assertThatThrownBy(() -> client().parseResponse("not json"))
                .isInstanceOf(EnrichmentException.class)
                .hasMessageContaining("Malformed response");
    }

    @Test
    void requestBody_omitsBlankSystemPrompt() throws IOException {
        JsonNode body = mapper.readTree(client().requestBody(" ", "hello"));

        assertThat(body.path("messages").size()).isEqualTo(1);
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.3);
    }
}
