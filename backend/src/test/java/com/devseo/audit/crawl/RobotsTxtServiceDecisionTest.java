package com.devseo.audit.crawl;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.devseo.audit.config.AuditProperties;
import com.devseo.audit.crawl.http.PoliteHttpClient;
import com.devseo.audit.crawl.model.HttpFetchResult;
import com.devseo.audit.crawl.robots.RobotsRules;
import com.devseo.audit.crawl.robots.RobotsTxtService;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RobotsTxtServiceDecisionTest {

  @Mock private PoliteHttpClient httpClient;

  @Test
  void unreachableRobotsAllowsEverything() {
    when(httpClient.get(anyString(), anyString(), any(Duration.class))).thenReturn(errorFetch());

    RobotsTxtService service = new RobotsTxtService(new AuditProperties(), httpClient);
    RobotsRules rules = service.loadRules("https://example.com");

    assertTrue(rules.isAllowAll());
    assertTrue(RobotsTxtService.isAllowed(rules, "https://example.com/private"));
  }

  @Test
  void nonSuccessStatusAllowsEverything() {
    when(httpClient.get(anyString(), anyString(), any(Duration.class)))
        .thenReturn(fetch(404, "Not found"));

    RobotsTxtService service = new RobotsTxtService(new AuditProperties(), httpClient);

    assertTrue(service.loadRules("https://example.com").isAllowAll());
  }

  @Test
  void fetchesRobotsFromSiteRootWithConfiguredTimeout() {
    when(httpClient.get(anyString(), anyString(), any(Duration.class)))
        .thenReturn(fetch(200, "User-agent: *\nDisallow: /private\n"));

    AuditProperties properties = new AuditProperties();
    properties.getCrawler().setRobotsTimeoutMs(5000);
    RobotsTxtService service = new RobotsTxtService(properties, httpClient);
    RobotsRules rules = service.loadRules("https://example.com/");

    verify(httpClient)
        .get(eq("https://example.com/robots.txt"), anyString(), eq(Duration.ofMillis(5000)));
    assertFalse(RobotsTxtService.isAllowed(rules, "https://example.com/private/page"));
    assertTrue(RobotsTxtService.isAllowed(rules, "https://example.com/public"));
  }

  private HttpFetchResult fetch(int status, String body) {
    return new HttpFetchResult(
        "https://example.com/robots.txt",
        URI.create("https://example.com/robots.txt"),
        status,
        body,
        "text/plain",
        Instant.now(),
        Duration.ofMillis(5),
        null,
        null);
  }

  private HttpFetchResult errorFetch() {
    return new HttpFetchResult(
        "https://example.com/robots.txt",
        null,
        0,
        null,
        null,
        Instant.now(),
        Duration.ofMillis(5),
        "io_error",
        "connection failed");
  }
}
