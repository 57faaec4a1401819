package com.devseo.audit.crawl;

import com.devseo.audit.config.AuditProperties;
import com.devseo.audit.crawl.extract.PageDataExtractor;
import com.devseo.audit.crawl.model.CrawlResult;
import com.devseo.audit.crawl.model.CrawledPage;
import com.devseo.audit.crawl.render.PageRenderException;
import com.devseo.audit.crawl.render.PageRenderer;
import com.devseo.audit.crawl.render.RenderOptions;
import com.devseo.audit.crawl.render.RenderSession;
import com.devseo.audit.crawl.render.RenderedPage;
import com.devseo.audit.crawl.render.RenderingBrowser;
import com.devseo.audit.crawl.robots.RobotsRules;
import com.devseo.audit.crawl.robots.RobotsTxtService;
import com.devseo.audit.crawl.util.CrawlUrlUtils;
import com.devseo.audit.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Breadth-first crawl of one host, capped at {@code audit.crawler.max-pages} pages.
 * Never throws: every failure ends up in {@link CrawlResult#errors()}.
 */
@Service
public class SiteCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(SiteCrawlerService.class);

    private final AuditProperties properties;
    private final PageRenderer renderer;
    private final RobotsTxtService robotsTxtService;
    private final PageDataExtractor extractor;
    private final RetryPolicy retryPolicy;

    public SiteCrawlerService(
        AuditProperties properties,
        PageRenderer renderer,
        RobotsTxtService robotsTxtService,
        PageDataExtractor extractor
    ) {
        this.properties = properties;
        this.renderer = renderer;
        this.robotsTxtService = robotsTxtService;
        this.extractor = extractor;
        this.retryPolicy = RetryPolicy.linear(
            properties.getCrawler().getMaxRetries(),
            Duration.ofMillis(properties.getCrawler().getRetryBaseDelayMs())
        );
    }

    public CrawlResult crawl(String startUrl) {
        URI start = CrawlUrlUtils.parseHttpUrl(startUrl);
        if (start == null) {
            return CrawlResult.failed(startUrl, "Invalid URL: " + startUrl);
        }
        String siteBase = CrawlUrlUtils.siteBase(start);
        String domain = CrawlUrlUtils.host(siteBase);
        List<String> errors = new ArrayList<>();

        RobotsRules robots = robotsTxtService.loadRules(siteBase);

        ArrayDeque<String> frontier = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        Set<String> enqueued = new HashSet<>();
        String startNormalized = CrawlUrlUtils.normalize(startUrl, siteBase);
        if (startNormalized != null) {
            frontier.add(startNormalized);
            enqueued.add(startNormalized);
        }

        RenderingBrowser browser;
        try {
            browser = renderer.launch();
        } catch (PageRenderException | RuntimeException e) {
            log.warn("Browser launch failed for {}: {}", domain, e.getMessage());
            return new CrawlResult(domain, 0, List.of(), List.of("Browser launch failed: " + e.getMessage()));
        }

        int maxPages = properties.getCrawler().getMaxPages();
        RenderOptions options = renderOptions();
        List<CrawledPage> pages = new ArrayList<>();
        try {
            while (!frontier.isEmpty() && pages.size() < maxPages) {
                if (Thread.currentThread().isInterrupted()) {
                    errors.add("Crawl interrupted");
                    break;
                }
                String url = frontier.poll();
                if (!visited.add(url)) {
                    continue;
                }
                if (!CrawlUrlUtils.sameHost(url, domain) || CrawlUrlUtils.isAsset(url)) {
                    continue;
                }
                if (!RobotsTxtService.isAllowed(robots, url)) {
                    errors.add("Blocked by robots.txt: " + url);
                    continue;
                }

                log.info("Crawling ({}/{}): {}", pages.size() + 1, maxPages, url);
                CrawledPage page = crawlPage(browser, url, domain, options);
                if (page == null) {
                    errors.add("Failed to crawl: " + url);
                    continue;
                }
                pages.add(page);
                for (String link : page.discoveredLinks()) {
                    String normalized = CrawlUrlUtils.normalize(link, siteBase);
                    if (normalized != null && !visited.contains(normalized) && enqueued.add(normalized)) {
                        frontier.add(normalized);
                    }
                }
            }
        } finally {
            try {
                browser.close();
            } catch (RuntimeException e) {
                log.debug("Ignoring browser close failure for {}: {}", domain, e.getMessage());
            }
        }

        log.info("Crawl finished domain={} pages={} errors={}", domain, pages.size(), errors.size());
        return new CrawlResult(domain, pages.size(), pages, errors);
    }

    private CrawledPage crawlPage(RenderingBrowser browser, String url, String domain, RenderOptions options) {
        try {
            return retryPolicy.execute(url, () -> {
                try (RenderSession session = browser.openSession(options)) {
                    RenderedPage rendered = session.navigate(url);
                    return extractor.extract(url, rendered.url(), rendered.html(), domain);
                }
            });
        } catch (Exception e) {
            log.warn("Failed after {} attempts for {}: {}", retryPolicy.maxAttempts(), url, e.getMessage());
            return null;
        }
    }

    private RenderOptions renderOptions() {
        AuditProperties.Crawler crawler = properties.getCrawler();
        return new RenderOptions(
            Duration.ofMillis(crawler.getNavigationTimeoutMs()),
            Duration.ofMillis(crawler.getSettleDelayMs()),
            crawler.getUserAgent()
        );
    }
}
