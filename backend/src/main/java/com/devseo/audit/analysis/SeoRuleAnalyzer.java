package com.devseo.audit.analysis;

import com.devseo.audit.crawl.model.CrawlResult;
import com.devseo.audit.crawl.model.CrawledPage;
import com.devseo.audit.crawl.model.IssueSeverity;
import com.devseo.audit.crawl.util.CrawlUrlUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic SEO rules over a crawl. Per-page rules emit at most one issue of each type per page;
 * duplicate titles and orphan pages are evaluated across the whole site.
 */
@Component
public class SeoRuleAnalyzer {
    static final int THIN_CONTENT_WORDS = 300;

    public RuleAnalysisResult analyze(CrawlResult crawl) {
        List<CrawledPage> pages = crawl == null ? List.of() : crawl.pages();
        List<SeoIssue> issues = new ArrayList<>();

        for (CrawledPage page : pages) {
            checkMissingMetaDescription(page, issues);
            checkMissingH1(page, issues);
            checkMultipleH1(page, issues);
            checkThinContent(page, issues);
            checkMissingAltTags(page, issues);
            checkNoSchema(page, issues);
        }
        checkDuplicateTitles(pages, issues);
        checkOrphanPages(pages, issues);

        int critical = 0;
        int warnings = 0;
        int info = 0;
        for (SeoIssue issue : issues) {
            if (issue.severity() == IssueSeverity.CRITICAL) {
                critical++;
            } else if (issue.severity() == IssueSeverity.WARNING) {
                warnings++;
            } else {
                info++;
            }
        }
        return new RuleAnalysisResult(
            issues,
            new AnalysisMeta(pages.size(), issues.size(), critical, warnings, info)
        );
    }

    private void checkMissingMetaDescription(CrawledPage page, List<SeoIssue> issues) {
        if (!page.metaDescription().isBlank()) {
            return;
        }
        issues.add(new SeoIssue(
            IssueType.MISSING_META_DESCRIPTION,
            IssueSeverity.CRITICAL,
            "The page \"" + page.url() + "\" has no meta description. Search engines display the meta description"
                + " in search results, and its absence reduces click-through rates.",
            "Add a <meta name=\"description\" content=\"...\"> tag with a concise summary (120-160 characters)"
                + " of the page content.",
            page.url()
        ));
    }

    private void checkMissingH1(CrawledPage page, List<SeoIssue> issues) {
        if (!page.headings().h1().isEmpty()) {
            return;
        }
        issues.add(new SeoIssue(
            IssueType.MISSING_H1,
            IssueSeverity.CRITICAL,
            "The page \"" + page.url() + "\" has no H1 heading. The H1 tag is a strong ranking signal that tells"
                + " search engines the primary topic of the page.",
            "Add a single, descriptive <h1> tag that clearly communicates the main topic of the page."
                + " Place it near the top of the visible content.",
            page.url()
        ));
    }

    private void checkMultipleH1(CrawledPage page, List<SeoIssue> issues) {
        List<String> h1 = page.headings().h1();
        if (h1.size() <= 1) {
            return;
        }
        String listed = h1.stream().map(text -> "\"" + text + "\"").collect(Collectors.joining(", "));
        issues.add(new SeoIssue(
            IssueType.MULTIPLE_H1,
            IssueSeverity.WARNING,
            "The page \"" + page.url() + "\" has " + h1.size() + " H1 tags (" + listed + ")."
                + " Multiple H1 tags dilute the primary topic signal for search engines.",
            "Keep only one H1 per page. Convert the extra H1 tags to H2 or lower-level headings that support"
                + " the main topic.",
            page.url()
        ));
    }

    private void checkThinContent(CrawledPage page, List<SeoIssue> issues) {
        if (page.wordCount() >= THIN_CONTENT_WORDS) {
            return;
        }
        issues.add(new SeoIssue(
            IssueType.THIN_CONTENT,
            IssueSeverity.WARNING,
            "The page \"" + page.url() + "\" has only " + page.wordCount() + " words. Pages with fewer than "
                + THIN_CONTENT_WORDS + " words are considered thin content by search engines and are less likely"
                + " to rank.",
            "Expand the page content to at least " + THIN_CONTENT_WORDS + " words with relevant, high-quality"
                + " information. If the page serves a utility purpose (e.g., contact form), consider adding"
                + " supporting text or FAQ sections.",
            page.url()
        ));
    }

    private void checkMissingAltTags(CrawledPage page, List<SeoIssue> issues) {
        long missing = page.imagesMissingAlt();
        if (missing == 0) {
            return;
        }
        issues.add(new SeoIssue(
            IssueType.MISSING_ALT_TAGS,
            IssueSeverity.WARNING,
            "The page \"" + page.url() + "\" has " + missing + " image(s) without alt text out of "
                + page.images().size() + " total. Missing alt text hurts accessibility and prevents search"
                + " engines from understanding image content.",
            "Add descriptive alt attributes to every <img> tag. Each alt text should concisely describe the"
                + " image content (e.g., alt=\"Team meeting in conference room\").",
            page.url()
        ));
    }

    private void checkNoSchema(CrawledPage page, List<SeoIssue> issues) {
        if (!page.schemaScripts().isEmpty()) {
            return;
        }
        issues.add(new SeoIssue(
            IssueType.NO_SCHEMA,
            IssueSeverity.INFO,
            "The page \"" + page.url() + "\" has no structured data (JSON-LD schema markup). Schema markup helps"
                + " search engines understand page content and can enable rich snippets in search results.",
            "Add JSON-LD structured data relevant to the page type. Common schemas include Organization,"
                + " WebPage, Article, Product, FAQ, and BreadcrumbList. Use Google's Structured Data Testing"
                + " Tool to validate.",
            page.url()
        ));
    }

    private void checkDuplicateTitles(List<CrawledPage> pages, List<SeoIssue> issues) {
        Map<String, List<String>> urlsByTitle = new LinkedHashMap<>();
        for (CrawledPage page : pages) {
            String title = page.title().trim().toLowerCase(Locale.ROOT);
            if (title.isEmpty()) {
                continue;
            }
            urlsByTitle.computeIfAbsent(title, ignored -> new ArrayList<>()).add(page.url());
        }
        for (Map.Entry<String, List<String>> entry : urlsByTitle.entrySet()) {
            List<String> urls = entry.getValue();
            if (urls.size() < 2) {
                continue;
            }
            issues.add(new SeoIssue(
                IssueType.DUPLICATE_TITLES,
                IssueSeverity.WARNING,
                urls.size() + " pages share the identical title \"" + entry.getKey() + "\": "
                    + String.join(", ", urls) + ". Duplicate titles confuse search engines about which page"
                    + " to rank and reduce the unique signal of each page.",
                "Give each page a unique, descriptive title that accurately reflects its specific content."
                    + " Include primary keywords and differentiate by topic or intent.",
                null
            ));
        }
    }

    private void checkOrphanPages(List<CrawledPage> pages, List<SeoIssue> issues) {
        if (pages.size() < 2) {
            return;
        }
        String firstUrl = pages.get(0).url();
        Set<String> reported = new HashSet<>();
        for (CrawledPage page : pages) {
            if (page.internalLinks() != 0 || page.url().equals(firstUrl)) {
                continue;
            }
            reported.add(page.url());
            issues.add(new SeoIssue(
                IssueType.ORPHAN_PAGE,
                IssueSeverity.WARNING,
                "The page \"" + page.url() + "\" has zero internal links pointing outward and may also lack"
                    + " inbound links from other crawled pages. Orphan pages are difficult for search engines"
                    + " to discover and rank.",
                "Add internal links from relevant pages to this page and from this page to other related"
                    + " content. Ensure the page is reachable from the site's main navigation or sitemap.",
                page.url()
            ));
        }

        Set<String> linkedTo = new HashSet<>();
        for (CrawledPage page : pages) {
            for (String link : page.discoveredLinks()) {
                linkedTo.add(CrawlUrlUtils.comparisonKey(link));
            }
        }
        if (linkedTo.isEmpty()) {
            return;
        }
        for (CrawledPage page : pages.subList(1, pages.size())) {
            if (linkedTo.contains(CrawlUrlUtils.comparisonKey(page.url())) || !reported.add(page.url())) {
                continue;
            }
            issues.add(new SeoIssue(
                IssueType.ORPHAN_PAGE,
                IssueSeverity.WARNING,
                "The page \"" + page.url() + "\" was not linked to by any other crawled page. It may be an"
                    + " orphan page that search engines struggle to find.",
                "Add internal links from your key pages to this page. Include it in navigation menus,"
                    + " sitemaps, or contextual link sections.",
                page.url()
            ));
        }
    }
}
