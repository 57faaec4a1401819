package com.devseo.audit.pipeline;

import com.devseo.audit.analysis.RuleAnalysisResult;
import com.devseo.audit.analysis.SeoRuleAnalyzer;
import com.devseo.audit.crawl.SiteCrawlerService;
import com.devseo.audit.crawl.model.CrawlResult;
import com.devseo.audit.fix.AiFixerResult;
import com.devseo.audit.fix.AiFixerService;
import com.devseo.audit.persistence.AuditCompletion;
import com.devseo.audit.persistence.AuditJdbcRepository;
import com.devseo.audit.persistence.AuditStatus;
import com.devseo.audit.persistence.CreditTransactionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Runs one audit job through crawl, rule analysis, fix generation and persistence.
 * A failure at any stage, including an interrupt from the worker pool shutting down, marks the
 * audit failed and refunds the credit spent on it.
 */
@Service
public class AuditPipelineService {
    private static final Logger log = LoggerFactory.getLogger(AuditPipelineService.class);

    private final AuditJobQueue queue;
    private final SiteCrawlerService crawler;
    private final SeoRuleAnalyzer analyzer;
    private final AiFixerService fixer;
    private final AuditScorer scorer;
    private final AuditResultsAssembler assembler;
    private final AuditJdbcRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditPipelineService(
        AuditJobQueue queue,
        SiteCrawlerService crawler,
        SeoRuleAnalyzer analyzer,
        AiFixerService fixer,
        AuditScorer scorer,
        AuditResultsAssembler assembler,
        AuditJdbcRepository repository,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.queue = queue;
        this.crawler = crawler;
        this.analyzer = analyzer;
        this.fixer = fixer;
        this.scorer = scorer;
        this.assembler = assembler;
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void process(AuditJob job) {
        long auditId = job.auditId();
        log.info("Processing audit #{} for {}", auditId, job.url());
        try {
            repository.markAuditStatus(auditId, AuditStatus.PROCESSING);

            queue.setProgress(auditId, JobProgress.crawling());
            CrawlResult crawl = crawler.crawl(job.url());
            log.info("Crawled {} pages for audit #{} errors={}", crawl.pagesCrawled(), auditId, crawl.errors().size());
            ensureNotInterrupted("crawling");

            queue.setProgress(auditId, JobProgress.analyzing());
            RuleAnalysisResult analysis = analyzer.analyze(crawl);
            log.info("Found {} rule-based issues for audit #{}", analysis.meta().totalIssues(), auditId);

            queue.setProgress(auditId, JobProgress.fixing());
            AiFixerResult fixes = fixer.generateFixes(crawl.pages(), analysis.issues());
            log.info("Generated {} fixes for audit #{}", fixes.totalFixesGenerated(), auditId);
            ensureNotInterrupted("generating fixes");

            queue.setProgress(auditId, JobProgress.saving());
            if (!crawl.pages().isEmpty()) {
                repository.insertAuditPages(auditId, assembler.pageRecords(auditId, crawl.pages()));
            }

            CategoryScores scores = scorer.score(analysis.issues());
            AuditResults results = assembler.assemble(crawl, analysis, fixes);
            AuditCompletion completion = new AuditCompletion(
                scores.overall(),
                scores.meta(),
                scores.content(),
                scores.performance(),
                scores.technical(),
                crawl.pagesCrawled(),
                analysis.meta().totalIssues(),
                fixes.totalFixesGenerated(),
                assembler.summary(crawl, analysis, scores),
                objectMapper.valueToTree(results)
            );
            repository.completeAudit(auditId, completion, clock.instant());
            repository.incrementTotalAudits(job.userId());

            queue.setProgress(auditId, JobProgress.done());
            log.info("Audit #{} completed overallScore={}", auditId, scores.overall());
        } catch (Exception e) {
            // Cleared while failing so the refund can reach the database, then restored for the worker.
            boolean interrupted = Thread.interrupted();
            log.warn("Audit #{} failed", auditId, e);
            fail(job, e);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * The crawler and fixer stop early on interrupt and return partial results; such a job must
     * fail as a whole instead of completing with them.
     */
    private static void ensureNotInterrupted(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new AuditInterruptedException("Audit interrupted while " + stage);
        }
    }

    private void fail(AuditJob job, Exception cause) {
        long auditId = job.auditId();
        queue.setProgress(auditId, JobProgress.error(cause.getMessage()));
        try {
            repository.markAuditStatus(auditId, AuditStatus.FAILED);
        } catch (Exception e) {
            log.error("Failed to mark audit #{} failed", auditId, e);
        }
        try {
            if (repository.adjustProfileCredits(job.userId(), 1)) {
                repository.insertCreditTransaction(
                    job.userId(),
                    1,
                    CreditTransactionType.REFUND,
                    "Refund for failed audit: " + job.url(),
                    auditId
                );
            } else {
                log.warn("No profile for user {}; audit #{} not refunded", job.userId(), auditId);
            }
        } catch (Exception e) {
            log.error("Refund failed for audit #{}: {}", auditId, e.getMessage(), e);
        }
    }
}
