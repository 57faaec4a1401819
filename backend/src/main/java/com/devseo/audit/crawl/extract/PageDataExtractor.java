package com.devseo.audit.crawl.extract;

import com.devseo.audit.crawl.model.CrawledPage;
import com.devseo.audit.crawl.model.IssueSeverity;
import com.devseo.audit.crawl.model.PageHeadings;
import com.devseo.audit.crawl.model.PageImage;
import com.devseo.audit.crawl.model.PageIssue;
import com.devseo.audit.crawl.util.CrawlUrlUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

@Component
public class PageDataExtractor {
    private static final Logger log = LoggerFactory.getLogger(PageDataExtractor.class);
    static final int TITLE_MAX_LENGTH = 60;
    static final int DESCRIPTION_MAX_LENGTH = 160;
    static final int THIN_CONTENT_WORDS = 300;

    private final ObjectMapper objectMapper;

    public PageDataExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CrawledPage extract(String pageUrl, String html, String siteHost) {
        return extract(pageUrl, pageUrl, html, siteHost);
    }

    /**
     * Extracts the SEO-relevant data of one rendered page. Relative links resolve against
     * {@code documentUrl}, the URL the document was finally served from; the page is recorded
     * under {@code pageUrl}. {@code siteHost} decides which links count as internal and which are followed.
     */
    public CrawledPage extract(String pageUrl, String documentUrl, String html, String siteHost) {
        String baseUri = documentUrl == null || documentUrl.isBlank() ? pageUrl : documentUrl;
        Document document = Jsoup.parse(html == null ? "" : html, baseUri);

        Element titleEl = document.selectFirst("title");
        String title = titleEl == null ? "" : titleEl.text().trim();
        Element descriptionEl = document.selectFirst("meta[name=description]");
        String metaDescription = descriptionEl == null ? "" : descriptionEl.attr("content");

        PageHeadings headings = new PageHeadings(
            headingTexts(document, "h1"),
            headingTexts(document, "h2"),
            headingTexts(document, "h3"),
            headingTexts(document, "h4"),
            headingTexts(document, "h5"),
            headingTexts(document, "h6")
        );

        int wordCount = countWords(document.body() == null ? "" : document.body().text());

        int internalLinks = 0;
        int externalLinks = 0;
        LinkedHashSet<String> discovered = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String raw = anchor.attr("href").trim();
            if (isNonNavigable(raw)) {
                continue;
            }
            String absolute = anchor.absUrl("href");
            String host = CrawlUrlUtils.host(absolute);
            if (host == null) {
                continue;
            }
            if (host.equals(siteHost)) {
                internalLinks++;
                String normalized = CrawlUrlUtils.normalize(absolute, baseUri);
                if (normalized != null) {
                    discovered.add(normalized);
                }
            } else {
                externalLinks++;
            }
        }

        List<PageImage> images = new ArrayList<>();
        for (Element img : document.select("img")) {
            String src = img.hasAttr("src") ? img.absUrl("src") : "";
            images.add(new PageImage(src.isEmpty() ? img.attr("src") : src, img.attr("alt")));
        }

        Element canonicalEl = document.selectFirst("link[rel=canonical]");
        String canonical = canonicalEl == null ? null : canonicalEl.attr("href");

        List<JsonNode> schemaScripts = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                schemaScripts.add(objectMapper.readTree(payload));
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD on {}: {}", pageUrl, e.getOriginalMessage());
            }
        }

        List<PageIssue> issues = immediateIssues(title, metaDescription, headings, images, canonical, wordCount);

        return new CrawledPage(
            pageUrl,
            title,
            metaDescription,
            headings,
            wordCount,
            internalLinks,
            externalLinks,
            images,
            canonical,
            schemaScripts,
            issues,
            new ArrayList<>(discovered)
        );
    }

    private List<PageIssue> immediateIssues(
        String title,
        String metaDescription,
        PageHeadings headings,
        List<PageImage> images,
        String canonical,
        int wordCount
    ) {
        List<PageIssue> issues = new ArrayList<>();
        if (title.isEmpty()) {
            issues.add(new PageIssue(IssueSeverity.CRITICAL, "Missing title tag", "Page has no <title> element."));
        } else if (title.length() > TITLE_MAX_LENGTH) {
            issues.add(new PageIssue(
                IssueSeverity.WARNING,
                "Title too long",
                "Title is " + title.length() + " chars (recommended: <" + TITLE_MAX_LENGTH + ")."
            ));
        }
        if (metaDescription.isEmpty()) {
            issues.add(new PageIssue(IssueSeverity.CRITICAL, "Missing meta description", "No meta description found."));
        } else if (metaDescription.length() > DESCRIPTION_MAX_LENGTH) {
            issues.add(new PageIssue(
                IssueSeverity.WARNING,
                "Meta description too long",
                "Meta description is " + metaDescription.length()
                    + " chars (recommended: <" + DESCRIPTION_MAX_LENGTH + ")."
            ));
        }
        int h1Count = headings.h1().size();
        if (h1Count == 0) {
            issues.add(new PageIssue(IssueSeverity.CRITICAL, "Missing H1", "Page has no H1 heading."));
        } else if (h1Count > 1) {
            issues.add(new PageIssue(
                IssueSeverity.WARNING,
                "Multiple H1 tags",
                "Found " + h1Count + " H1 tags (recommended: 1)."
            ));
        }
        long missingAlt = images.stream().filter(PageImage::missingAlt).count();
        if (missingAlt > 0) {
            issues.add(new PageIssue(
                IssueSeverity.WARNING,
                "Images missing alt text",
                missingAlt + " of " + images.size() + " images have no alt attribute."
            ));
        }
        if (canonical == null || canonical.isBlank()) {
            issues.add(new PageIssue(IssueSeverity.INFO, "No canonical URL", "Consider adding a canonical link element."));
        }
        if (wordCount < THIN_CONTENT_WORDS) {
            issues.add(new PageIssue(
                IssueSeverity.WARNING,
                "Thin content",
                "Page has only " + wordCount + " words (recommended: " + THIN_CONTENT_WORDS + "+)."
            ));
        }
        return issues;
    }

    private static List<String> headingTexts(Document document, String tag) {
        List<String> texts = new ArrayList<>();
        for (Element heading : document.select(tag)) {
            texts.add(heading.text().trim());
        }
        return texts;
    }

    static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    private static boolean isNonNavigable(String href) {
        if (href.isEmpty()) {
            return true;
        }
        String lower = href.toLowerCase(Locale.ROOT);
        return lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("tel:");
    }
}
