package com.devseo.audit.fix;

import com.devseo.audit.analysis.SeoIssue;
import com.devseo.audit.config.AuditProperties;
import com.devseo.audit.crawl.model.CrawledPage;
import com.devseo.audit.fix.completion.CompletionRequest;
import com.devseo.audit.fix.completion.RateLimitedCompletionException;
import com.devseo.audit.fix.completion.TextCompletionClient;
import com.devseo.audit.retry.Backoff;
import com.devseo.audit.retry.RetryPolicy;
import com.devseo.audit.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates one fix per page, one page at a time. Rate-limited calls back off exponentially,
 * other failures after a flat delay; a page whose retries run out gets the fallback fix.
 */
@Service
public class AiFixerService {
    private static final Logger log = LoggerFactory.getLogger(AiFixerService.class);

    private final TextCompletionClient completionClient;
    private final FixPromptBuilder promptBuilder;
    private final AiFixJsonParser parser;
    private final FallbackFixFactory fallbackFactory;
    private final CompletionRequest completionRequest;
    private final RetryPolicy retryPolicy;

    public AiFixerService(
        AuditProperties properties,
        TextCompletionClient completionClient,
        FixPromptBuilder promptBuilder,
        AiFixJsonParser parser,
        FallbackFixFactory fallbackFactory
    ) {
        this.completionClient = completionClient;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.fallbackFactory = fallbackFactory;
        this.completionRequest = new CompletionRequest(properties.getAi().getMaxCompletionTokens(), true);
        this.retryPolicy = new RetryPolicy(
            properties.getAi().getMaxRetries(),
            Duration.ofMillis(properties.getAi().getRetryBaseDelayMs()),
            Backoff.byFailure(
                failure -> failure instanceof RateLimitedCompletionException,
                Backoff.exponential(),
                Backoff.fixed()
            ),
            Sleeper.THREAD
        );
    }

    public AiFixerResult generateFixes(List<CrawledPage> pages, List<SeoIssue> issues) {
        List<AiFix> fixes = new ArrayList<>();
        boolean available = completionClient.isAvailable();
        for (CrawledPage page : pages) {
            AiFix fallback = fallbackFactory.fallbackFor(page);
            if (!available) {
                fixes.add(fallback);
                continue;
            }
            fixes.add(generateFix(page, issues, fallback));
        }
        return AiFixerResult.of(fixes);
    }

    private AiFix generateFix(CrawledPage page, List<SeoIssue> issues, AiFix fallback) {
        String prompt = promptBuilder.build(page, issues);
        String raw;
        try {
            raw = retryPolicy.execute(
                "AI fix " + page.url(),
                () -> completionClient.complete(prompt, completionRequest)
            );
        } catch (Exception e) {
            log.error("AI fix failed for {}, using fallback: {}", page.url(), e.getMessage());
            return fallback;
        }
        try {
            return parser.parse(raw).completeWith(fallback);
        } catch (IllegalArgumentException e) {
            log.warn("AI fix response unusable for {}, using fallback: {}", page.url(), e.getMessage());
            return fallback;
        }
    }
}
