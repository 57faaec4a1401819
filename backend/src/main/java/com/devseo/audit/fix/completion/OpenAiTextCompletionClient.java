package com.devseo.audit.fix.completion;

import com.devseo.audit.config.AuditProperties;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ChatModel;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * OpenAI chat completions. Retries are left to the caller, so the SDK's own retries are disabled.
 */
@Component
public class OpenAiTextCompletionClient implements TextCompletionClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiTextCompletionClient.class);
    private static final String API_KEY_SENTINEL = "not-configured";
    private static final int RATE_LIMIT_STATUS = 429;

    private final OpenAIClient openAiClient;
    private final boolean available;
    private final String model;
    private final Duration requestTimeout;
    private final Duration readTimeout;

    public OpenAiTextCompletionClient(AuditProperties properties) {
        AuditProperties.Ai ai = properties.getAi();
        this.model = StringUtils.hasText(ai.getModel()) ? ai.getModel().trim() : "gpt-5-mini";
        this.requestTimeout = Duration.ofSeconds(ai.getRequestTimeoutSeconds());
        this.readTimeout = Duration.ofSeconds(ai.getReadTimeoutSeconds());

        String apiKey = ai.getApiKey();
        if (StringUtils.hasText(apiKey) && !API_KEY_SENTINEL.equals(apiKey.trim())) {
            String baseUrl = normalizeBaseUrl(ai.getBaseUrl());
            this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(baseUrl)
                .maxRetries(0)
                .build();
            this.available = true;
            log.info("AI fix generation configured (model={}, baseUrl={})", model, baseUrl);
            return;
        }
        this.openAiClient = null;
        this.available = false;
        log.warn("AI fix generation is disabled: no API key configured, fallback fixes will be used");
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String complete(String prompt, CompletionRequest request) {
        if (!available) {
            throw new TextCompletionException("Text completion backend is not configured");
        }
        ChatCompletionCreateParams.Builder params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(model))
            .addUserMessage(prompt)
            .maxCompletionTokens(request.maxTokens());
        if (request.forceJson()) {
            params.responseFormat(ResponseFormatJsonObject.builder().build());
        }

        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder()
                .request(requestTimeout)
                .read(readTimeout)
                .build())
            .build();

        try {
            ChatCompletion completion = openAiClient.chat().completions().create(params.build(), options);
            if (completion.choices().isEmpty()) {
                throw new TextCompletionException("Completion response contained no choices");
            }
            return completion.choices().get(0).message().content().orElse("");
        } catch (OpenAIServiceException e) {
            if (e.statusCode() == RATE_LIMIT_STATUS) {
                throw new RateLimitedCompletionException("Completion rate limited (model=" + model + ")", e);
            }
            throw new TextCompletionException("Completion failed (model=" + model + "): HTTP " + e.statusCode(), e);
        } catch (OpenAIIoException e) {
            throw new TextCompletionException("Completion network error: " + e.getMessage(), e);
        } catch (OpenAIException e) {
            throw new TextCompletionException("Completion failed (model=" + model + "): " + e.getMessage(), e);
        }
    }

    static String normalizeBaseUrl(String baseUrl) {
        if (!StringUtils.hasText(baseUrl)) {
            return "https://api.openai.com/v1";
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
