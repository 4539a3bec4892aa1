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

class AnthropicClientTest {

    private static final String ANSWER = """
            {"id": "msg_1", "type": "message", "role": "assistant",
             "content": [
               {"type": "text", "text": "Use "},
               {"type": "tool_use", "id": "t1", "name": "x", "input": {}},
               {"type": "text", "text": "equality."}
             ],
             "usage": {"input_tokens": 12, "output_tokens": 3}}
            """;

    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastApiKey = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String reply = ANSWER;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/messages", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastApiKey.set(exchange.getRequestHeaders().getFirst("x-api-key"));
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

    private AnthropicClient client() {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new AnthropicClient("test-key", "claude-3-5-sonnet-20241022", baseUrl, 256, 0.3, Duration.ofSeconds(5));
    }

    @Test
    void complete_postsMessageAndConcatenatesTextBlocks() throws IOException {
        LlmClient.Completion completion = client().complete("system text", "explain this");

        assertThat(completion.text()).isEqualTo("Use equality.");
        assertThat(completion.usage()).isEqualTo(new LlmClient.Usage(12, 3));
        assertThat(lastApiKey.get()).isEqualTo("test-key");

        JsonNode body = mapper.readTree(lastBody.get());
        assertThat(body.path("model").asText()).isEqualTo("claude-3-5-sonnet-20241022");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(256);
        assertThat(body.path("system").asText()).isEqualTo("system text");
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("user");
        assertThat(body.path("messages").get(0).path("content").asText()).isEqualTo("explain this");
    }

    @Test
    void complete_failsOnErrorStatus() {
        status = 529;
        reply = "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\"}}";

        assertThatThrownBy(() -> client().complete("s", "p"))
                .isInstanceOf(EnrichmentException.class)
                .hasMessageContaining("529");
    }

    @Test
    void parseResponse_rejectsMalformedJson() {
        assertThatThrownBy(() -> client().parseResponse("not json"))
                .isInstanceOf(EnrichmentException.class)
                .hasMessageContaining("Malformed response");
    }

    @Test
    void requestBody_omitsBlankSystemPrompt() throws IOException {
        JsonNode body = mapper.readTree(client().requestBody("", "hello"));

        assertThat(body.has("system")).isFalse();
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.3);
    }
}
