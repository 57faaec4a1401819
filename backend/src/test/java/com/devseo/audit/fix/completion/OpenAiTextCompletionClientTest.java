package com.devseo.audit.fix.completion;

import com.devseo.audit.config.AuditProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiTextCompletionClientTest {
    private static final String COMPLETION_BODY = """
        {
          "id": "chatcmpl-1",
          "object": "chat.completion",
          "created": 1700000000,
          "model": "gpt-5-mini",
          "choices": [
            {
              "index": 0,
              "finish_reason": "stop",
              "logprobs": null,
              "message": {"role": "assistant", "content": "{\\"improvedH1\\": \\"Welcome\\"}", "refusal": null}
            }
          ]
        }
        """;

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void returnsMessageContentAndRequestsJson() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody(COMPLETION_BODY));

        String content = client("sk-test").complete("Fix this page", new CompletionRequest(512, true));

        assertThat(content).isEqualTo("{\"improvedH1\": \"Welcome\"}");
        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"json_object\"").contains("Fix this page").contains("max_completion_tokens");
    }

    @Test
    void mapsTooManyRequestsToRateLimited() {
        server.enqueue(new MockResponse()
            .setResponseCode(429)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"error\": {\"message\": \"slow down\", \"type\": \"rate_limit\"}}"));

        assertThatThrownBy(() -> client("sk-test").complete("prompt", new CompletionRequest(64, true)))
            .isInstanceOf(RateLimitedCompletionException.class);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void mapsServerErrorToCompletionFailure() {
        server.enqueue(new MockResponse()
            .setResponseCode(500)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"error\": {\"message\": \"boom\"}}"));

        assertThatThrownBy(() -> client("sk-test").complete("prompt", new CompletionRequest(64, true)))
            .isInstanceOf(TextCompletionException.class)
            .isNotInstanceOf(RateLimitedCompletionException.class)
            .hasMessageContaining("HTTP 500");
    }

    @Test
    void isUnavailableWithoutApiKey() {
        assertThat(client("").isAvailable()).isFalse();
        assertThat(client("not-configured").isAvailable()).isFalse();
        assertThatThrownBy(() -> client(null).complete("prompt", new CompletionRequest(64, true)))
            .isInstanceOf(TextCompletionException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void normalizesBaseUrl() {
        assertThat(OpenAiTextCompletionClient.normalizeBaseUrl(null)).isEqualTo("https://api.openai.com/v1");
        assertThat(OpenAiTextCompletionClient.normalizeBaseUrl(" https://proxy.local/v1// "))
            .isEqualTo("https://proxy.local/v1");
    }

    private OpenAiTextCompletionClient client(String apiKey) {
        AuditProperties properties = new AuditProperties();
        properties.getAi().setApiKey(apiKey);
        properties.getAi().setBaseUrl(server.url("/v1").toString());
        properties.getAi().setRequestTimeoutSeconds(5);
        properties.getAi().setReadTimeoutSeconds(5);
        return new OpenAiTextCompletionClient(properties);
    }
}
