package com.devseo.audit.crawl.http;

import com.devseo.audit.config.AuditProperties;
import com.devseo.audit.crawl.model.HttpFetchResult;
import com.devseo.audit.retry.RetryPolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class PoliteHttpClient {
    private static final Pattern CHARSET_PARAM = Pattern.compile("charset=\"?([\\w.:-]+)", Pattern.CASE_INSENSITIVE);

    private final AuditProperties properties;
    private final HttpClient client;
    private final RetryPolicy retryPolicy;

    public PoliteHttpClient(AuditProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.retryPolicy = RetryPolicy.exponential(
            properties.getHttp().getMaxRetries(),
            Duration.ofMillis(properties.getHttp().getRetryBaseDelayMs())
        );
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds()));
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout) {
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            lastResult = executeOnce(url, acceptHeader, timeout);
            if (!shouldRetry(lastResult) || attempt >= retryPolicy.maxAttempts()) {
                return lastResult;
            }
            if (!retryPolicy.pause(attempt, null)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(String url, String acceptHeader, Duration timeout) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String userAgent = properties.getCrawler().getUserAgent();
        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        Duration safeTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
            ? Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds())
            : timeout;
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(safeTimeout)
            .header("User-Agent", userAgent)
            .header("Accept", safeAccept)
            .header("Accept-Language", "en-US,en;q=0.8")
            .GET()
            .build();

        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            String responseBody = responseBytes == null ? null : new String(responseBytes, charsetOf(contentType));
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                contentType,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        Matcher matcher = CHARSET_PARAM.matcher(contentType);
        if (!matcher.find()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(matcher.group(1));
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
