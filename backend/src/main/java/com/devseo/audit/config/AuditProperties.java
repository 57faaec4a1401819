package com.devseo.audit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "audit")
public class AuditProperties {
    private static final String DEFAULT_USER_AGENT = "DevSEO-AI/1.0 (SEO Crawler)";

    private Crawler crawler = new Crawler();
    private Http http = new Http();
    private Ai ai = new Ai();
    private Queue queue = new Queue();
    private Worker worker = new Worker();

    public Crawler getCrawler() {
        return crawler;
    }

    public void setCrawler(Crawler crawler) {
        this.crawler = crawler;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Ai getAi() {
        return ai;
    }

    public void setAi(Ai ai) {
        this.ai = ai;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Crawler {
        private int maxPages = 20;
        private int navigationTimeoutMs = 20_000;
        private int settleDelayMs = 1_500;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 1_000;
        private int robotsTimeoutMs = 5_000;
        private String userAgent;
        private String renderer = "playwright";
        private String chromiumPath;

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public int getNavigationTimeoutMs() {
            return Math.max(1, navigationTimeoutMs);
        }

        public void setNavigationTimeoutMs(int navigationTimeoutMs) {
            this.navigationTimeoutMs = Math.max(1, navigationTimeoutMs);
        }

        public int getSettleDelayMs() {
            return Math.max(0, settleDelayMs);
        }

        public void setSettleDelayMs(int settleDelayMs) {
            this.settleDelayMs = Math.max(0, settleDelayMs);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRobotsTimeoutMs() {
            return Math.max(1, robotsTimeoutMs);
        }

        public void setRobotsTimeoutMs(int robotsTimeoutMs) {
            this.robotsTimeoutMs = Math.max(1, robotsTimeoutMs);
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public String getRenderer() {
            return renderer;
        }

        public void setRenderer(String renderer) {
            this.renderer = renderer;
        }

        public String getChromiumPath() {
            return chromiumPath;
        }

        public void setChromiumPath(String chromiumPath) {
            this.chromiumPath = chromiumPath;
        }
    }

    public static class Http {
        private int requestTimeoutSeconds = 20;
        private int maxRetries = 0;
        private int retryBaseDelayMs = 500;

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }
    }

    public static class Ai {
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-5-mini";
        private long maxCompletionTokens = 4096;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 2_000;
        private long requestTimeoutSeconds = 120;
        private long readTimeoutSeconds = 75;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public long getMaxCompletionTokens() {
            return Math.max(1L, maxCompletionTokens);
        }

        public void setMaxCompletionTokens(long maxCompletionTokens) {
            this.maxCompletionTokens = Math.max(1L, maxCompletionTokens);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public long getRequestTimeoutSeconds() {
            return Math.max(1L, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(long requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1L, requestTimeoutSeconds);
        }

        public long getReadTimeoutSeconds() {
            return Math.max(1L, readTimeoutSeconds);
        }

        public void setReadTimeoutSeconds(long readTimeoutSeconds) {
            this.readTimeoutSeconds = Math.max(1L, readTimeoutSeconds);
        }
    }

    public static class Queue {
        private Duration progressRetention = Duration.ofSeconds(60);

        public Duration getProgressRetention() {
            return progressRetention;
        }

        public void setProgressRetention(Duration progressRetention) {
            this.progressRetention = progressRetention == null || progressRetention.isNegative()
                ? Duration.ZERO
                : progressRetention;
        }
    }

    public static class Worker {
        private int concurrency = 2;
        private boolean autoStart = true;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }
}
