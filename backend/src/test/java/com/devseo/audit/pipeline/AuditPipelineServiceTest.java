package com.devseo.audit.pipeline;

import com.devseo.audit.crawl.SiteCrawlerService;
import com.devseo.audit.crawl.model.CrawlResult;
import com.devseo.audit.crawl.model.CrawledPage;
import com.devseo.audit.persistence.AuditJdbcRepository;
import com.devseo.audit.persistence.AuditPageRecord;
import com.devseo.audit.persistence.AuditRecord;
import com.devseo.audit.persistence.AuditStatus;
import com.devseo.audit.persistence.CreditTransaction;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

import static com.devseo.audit.support.TestPages.page;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class AuditPipelineServiceTest {

    @MockBean
    private SiteCrawlerService crawler;

    @Autowired
    private AuditPipelineService pipeline;

    @Autowired
    private AuditSubmissionService submissionService;

    @Autowired
    private AuditJdbcRepository repository;

    @Autowired
    private AuditJobQueue queue;

    @Test
    void completedAuditStoresScoresPagesAndFallbackFixes() {
        String userId = "user-" + UUID.randomUUID();
        AuditRecord submitted = submissionService.submit(userId, "https://example.com");
        CrawledPage home = page("https://example.com/")
            .title("")
            .metaDescription("")
            .h1("Welcome")
            .wordCount(250)
            .image("https://example.com/a.png", "")
            .image("https://example.com/b.png", null)
            .noSchema()
            .build();
        when(crawler.crawl("https://example.com"))
            .thenReturn(new CrawlResult("example.com", 1, List.of(home), List.of()));

        pipeline.process(job(submitted, userId));

        AuditRecord audit = repository.findAudit(submitted.id());
        assertEquals(AuditStatus.COMPLETED, audit.status());
        assertEquals(75, audit.metaScore());
        assertEquals(85, audit.contentScore());
        assertEquals(90, audit.performanceScore());
        assertEquals(90, audit.technicalScore());
        assertEquals(85, audit.overallScore());
        assertEquals(1, audit.pagesCrawled());
        assertEquals(4, audit.issuesFound());
        assertEquals(1, audit.fixesGenerated());
        assertNotNull(audit.completedAt());
        assertTrue(audit.summary().startsWith("Crawled 1 pages on example.com. Overall score: 85/100."));

        JsonNode results = audit.results();
        assertEquals(4, results.path("issues").size());
        assertEquals("Missing Meta Description", results.path("issues").get(0).path("title").asText());
        assertEquals("critical", results.path("issues").get(0).path("severity").asText());
        assertEquals(3, results.path("recommendations").size());
        assertEquals("example.com - Homepage", results.path("fixes").get(0).path("optimizedTitle").asText());
        assertEquals(
            "2 images found, 2 missing alt text",
            results.path("details").path("performance").path("images").asText()
        );

        List<AuditPageRecord> pages = repository.findAuditPages(submitted.id());
        assertEquals(1, pages.size());
        assertEquals(2, pages.get(0).images());
        assertEquals(1, repository.findProfile(userId).totalAudits());
        assertEquals(JobProgress.done(), queue.progress(submitted.id()));
    }

    @Test
    void failedAuditIsMarkedFailedAndRefunded() {
        String userId = "user-" + UUID.randomUUID();
        AuditRecord submitted = submissionService.submit(userId, "https://broken.example");
        assertEquals(9, repository.findProfile(userId).credits());
        when(crawler.crawl("https://broken.example")).thenThrow(new IllegalStateException("Renderer crashed"));

        pipeline.process(job(submitted, userId));

        assertEquals(AuditStatus.FAILED, repository.findAudit(submitted.id()).status());
        assertEquals(10, repository.findProfile(userId).credits());
        assertEquals(0, repository.findProfile(userId).totalAudits());
        List<CreditTransaction> history = repository.findCreditTransactions(userId);
        assertEquals(2, history.size());
        CreditTransaction refund = history.get(0);
        assertEquals("refund", refund.type());
        assertEquals(1, refund.amount());
        assertEquals("Refund for failed audit: https://broken.example", refund.description());
        assertEquals(submitted.id(), refund.auditId());

        JobProgress progress = queue.progress(submitted.id());
        assertEquals(JobStage.ERROR, progress.stage());
        assertEquals("Renderer crashed", progress.message());
        assertEquals(0, progress.percent());
    }

    @Test
    void interruptedCrawlFailsAndRefundsInsteadOfCompleting() {
        String userId = "user-" + UUID.randomUUID();
        AuditRecord submitted = submissionService.submit(userId, "https://slow.example");
        CrawledPage first = page("https://slow.example/").build();
        when(crawler.crawl("https://slow.example")).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return new CrawlResult("slow.example", 1, List.of(first), List.of("Crawl interrupted"));
        });

        try {
            pipeline.process(job(submitted, userId));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        AuditRecord audit = repository.findAudit(submitted.id());
        assertEquals(AuditStatus.FAILED, audit.status());
        assertNull(audit.completedAt());
        assertTrue(repository.findAuditPages(submitted.id()).isEmpty());
        assertEquals(10, repository.findProfile(userId).credits());
        assertEquals(0, repository.findProfile(userId).totalAudits());
        assertEquals("refund", repository.findCreditTransactions(userId).get(0).type());
        assertEquals("Audit interrupted while crawling", queue.progress(submitted.id()).message());
    }

    @Test
    void crawlWithoutPagesStillCompletes() {
        String userId = "user-" + UUID.randomUUID();
        AuditRecord submitted = submissionService.submit(userId, "https://down.example");
        when(crawler.crawl("https://down.example"))
            .thenReturn(CrawlResult.failed("down.example", "Browser launch failed: missing executable"));

        pipeline.process(job(submitted, userId));

        AuditRecord audit = repository.findAudit(submitted.id());
        assertEquals(AuditStatus.COMPLETED, audit.status());
        assertEquals(0, audit.pagesCrawled());
        assertEquals(100, audit.overallScore());
        assertTrue(repository.findAuditPages(submitted.id()).isEmpty());
    }

    private static AuditJob job(AuditRecord audit, String userId) {
        return new AuditJob(audit.id(), userId, audit.url(), audit.domain());
    }
}
