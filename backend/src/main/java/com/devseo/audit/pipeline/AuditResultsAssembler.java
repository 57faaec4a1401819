package com.devseo.audit.pipeline;

import com.devseo.audit.analysis.RuleAnalysisResult;
import com.devseo.audit.analysis.SeoIssue;
import com.devseo.audit.crawl.model.CrawlResult;
import com.devseo.audit.crawl.model.CrawledPage;
import com.devseo.audit.crawl.model.IssueSeverity;
import com.devseo.audit.fix.AiFixerResult;
import com.devseo.audit.persistence.AuditPageRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AuditResultsAssembler {
    static final int ADEQUATE_AVERAGE_WORDS = 300;

    public AuditResults assemble(CrawlResult crawl, RuleAnalysisResult analysis, AiFixerResult fixes) {
        List<AuditResults.ResultIssue> issues = analysis.issues().stream()
            .map(issue -> new AuditResults.ResultIssue(
                issue.severity(),
                issue.issueType().displayTitle(),
                issue.explanation(),
                issue.recommendedFix()
            ))
            .toList();
        List<String> recommendations = analysis.issues().stream()
            .filter(issue -> issue.severity() == IssueSeverity.CRITICAL || issue.severity() == IssueSeverity.WARNING)
            .map(SeoIssue::recommendedFix)
            .toList();
        List<CrawledPage> pages = crawl.pages();
        AuditResults.Details details = new AuditResults.Details(
            metaDetails(pages),
            contentDetails(pages),
            performanceDetails(pages),
            technicalDetails(pages)
        );
        return new AuditResults(issues, recommendations, fixes.fixes(), details);
    }

    public String summary(CrawlResult crawl, RuleAnalysisResult analysis, CategoryScores scores) {
        return "Crawled " + crawl.pagesCrawled() + " pages on " + crawl.domain() + ". "
            + "Overall score: " + scores.overall() + "/100. "
            + "Found " + analysis.meta().totalIssues() + " issues ("
            + analysis.meta().critical() + " critical, "
            + analysis.meta().warnings() + " warnings, "
            + analysis.meta().info() + " informational). "
            + "Key areas: Meta " + scores.meta() + "/100, Content " + scores.content() + "/100, "
            + "Performance " + scores.performance() + "/100, Technical " + scores.technical() + "/100.";
    }

    public List<AuditPageRecord> pageRecords(long auditId, List<CrawledPage> pages) {
        return pages.stream()
            .map(page -> new AuditPageRecord(
                null,
                auditId,
                page.url(),
                page.title(),
                page.metaDescription(),
                page.headings(),
                page.wordCount(),
                page.internalLinks(),
                page.externalLinks(),
                page.images().size(),
                page.schemaScripts().stream().map(AuditResultsAssembler::schemaType).toList(),
                page.issues()
            ))
            .toList();
    }

    private AuditResults.Meta metaDetails(List<CrawledPage> pages) {
        long withTitle = pages.stream().filter(page -> !page.title().isEmpty()).count();
        long withDescription = pages.stream().filter(page -> !page.metaDescription().isEmpty()).count();
        long withCanonical = pages.stream().filter(page -> hasText(page.canonical())).count();
        return new AuditResults.Meta(
            withTitle + "/" + pages.size() + " pages have title tags",
            withDescription + "/" + pages.size() + " pages have meta descriptions",
            withCanonical + "/" + pages.size() + " pages have canonical URLs"
        );
    }

    private AuditResults.Content contentDetails(List<CrawledPage> pages) {
        long averageWords = average(pages.stream().mapToInt(CrawledPage::wordCount).sum(), pages.size());
        long singleH1 = pages.stream().filter(page -> page.headings().h1().size() == 1).count();
        return new AuditResults.Content(
            singleH1 + "/" + pages.size() + " pages have exactly one H1",
            "Average word count: " + averageWords,
            averageWords >= ADEQUATE_AVERAGE_WORDS
                ? "Content length is adequate"
                : "Content may be too thin for ranking"
        );
    }

    private AuditResults.Performance performanceDetails(List<CrawledPage> pages) {
        int totalImages = pages.stream().mapToInt(page -> page.images().size()).sum();
        long missingAlt = pages.stream().mapToLong(CrawledPage::imagesMissingAlt).sum();
        long averageLinks = average(pages.stream().mapToInt(CrawledPage::internalLinks).sum(), pages.size());
        return new AuditResults.Performance(
            totalImages + " images found, " + missingAlt + " missing alt text",
            "Average " + averageLinks + " internal links per page",
            "Requires manual testing with Google Mobile-Friendly Test"
        );
    }

    private AuditResults.Technical technicalDetails(List<CrawledPage> pages) {
        long withSchema = pages.stream().filter(page -> !page.schemaScripts().isEmpty()).count();
        long https = pages.stream().filter(page -> page.url().startsWith("https://")).count();
        return new AuditResults.Technical(
            withSchema + "/" + pages.size() + " pages have structured data",
            https + "/" + pages.size() + " pages use HTTPS",
            "URLs analyzed for crawlability and structure"
        );
    }

    private static long average(long total, int count) {
        return count == 0 ? 0 : Math.round((double) total / count);
    }

    private static String schemaType(JsonNode schema) {
        JsonNode type = schema == null ? null : schema.get("@type");
        if (type == null || type.isNull()) {
            return "unknown";
        }
        if (type.isTextual()) {
            return type.asText().isEmpty() ? "unknown" : type.asText();
        }
        return type.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
