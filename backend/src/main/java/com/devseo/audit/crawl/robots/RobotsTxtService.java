package com.devseo.audit.crawl.robots;

import com.devseo.audit.config.AuditProperties;
import com.devseo.audit.crawl.http.PoliteHttpClient;
import com.devseo.audit.crawl.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Loads robots.txt once per crawl. Any failure to fetch or parse it allows everything.
 */
@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final String ROBOTS_ACCEPT = "text/plain,text/*;q=0.9,*/*;q=0.1";

    private final AuditProperties properties;
    private final PoliteHttpClient httpClient;

    public RobotsTxtService(AuditProperties properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    public RobotsRules loadRules(String siteBase) {
        String robotsUrl = stripTrailingSlash(siteBase) + "/robots.txt";
        Duration timeout = Duration.ofMillis(properties.getCrawler().getRobotsTimeoutMs());
        HttpFetchResult fetch;
        try {
            fetch = httpClient.get(robotsUrl, ROBOTS_ACCEPT, timeout);
        } catch (RuntimeException e) {
            log.warn("robots fetch threw url={} decision=allow_all", robotsUrl, e);
            return RobotsRules.allowAll();
        }
        if (fetch == null || !fetch.isSuccessful()) {
            log.info(
                "robots unavailable url={} status={} errorCode={} errorMessage={} decision=allow_all",
                robotsUrl,
                fetch == null ? null : fetch.statusCode(),
                fetch == null ? null : fetch.errorCode(),
                fetch == null ? null : fetch.errorMessage()
            );
            return RobotsRules.allowAll();
        }
        try {
            RobotsRules rules = RobotsRules.parse(fetch.body(), properties.getCrawler().getUserAgent());
            log.debug("Loaded robots for {} allowAll={}", robotsUrl, rules.isAllowAll());
            return rules;
        } catch (RuntimeException e) {
            log.warn("robots parse failed url={} decision=allow_all", robotsUrl, e);
            return RobotsRules.allowAll();
        }
    }

    public static boolean isAllowed(RobotsRules rules, String url) {
        if (rules == null || rules.isAllowAll()) {
            return true;
        }
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rules.isAllowed(path);
    }

    private static String stripTrailingSlash(String value) {
        String result = value == null ? "" : value.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static URI toUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
