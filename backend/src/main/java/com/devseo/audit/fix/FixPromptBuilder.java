package com.devseo.audit.fix;

import com.devseo.audit.analysis.SeoIssue;
import com.devseo.audit.crawl.model.CrawledPage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class FixPromptBuilder {

    public String build(CrawledPage page, List<SeoIssue> issues) {
        String pageIssues = issues.stream()
            .filter(issue -> issue.appliesTo(page.url()))
            .map(issue -> "- [" + issue.severity().key() + "] " + issue.issueType().key() + ": " + issue.explanation())
            .collect(Collectors.joining("\n"));
        List<String> h2 = page.headings().h2();

        return """
            You are an expert SEO consultant. Analyze this page and generate optimized SEO fixes.

            PAGE DATA:
            - URL: %s
            - Current Title: %s
            - Current Meta Description: %s
            - Current H1: %s
            - Word Count: %d
            - Internal Links: %d
            - External Links: %d
            - Images: %d (%d missing alt)
            - Schema Markup: %s
            - Canonical: %s
            - H2 Tags: %s

            DETECTED ISSUES:
            %s

            Generate fixes as a JSON object with this exact structure:
            {
              "optimizedTitle": "<SEO-optimized title, 50-60 chars, include primary keyword>",
              "optimizedMetaDescription": "<compelling meta description, 120-160 chars, include call to action>",
              "improvedH1": "<clear, keyword-rich H1 heading>",
              "jsonLdSchema": { <valid JSON-LD WebPage schema object with @context, @type, name, description, url> },
              "suggestedInternalLinkingText": "<2-3 sentences of anchor text suggestions for linking to/from this page>"
            }

            Return ONLY valid JSON. Base suggestions on the actual page data above.
            """.formatted(
            page.url(),
            orPlaceholder(page.title(), "(missing)"),
            orPlaceholder(page.metaDescription(), "(missing)"),
            orPlaceholder(String.join(", ", page.headings().h1()), "(missing)"),
            page.wordCount(),
            page.internalLinks(),
            page.externalLinks(),
            page.images().size(),
            page.imagesMissingAlt(),
            page.schemaScripts().isEmpty() ? "none" : "present",
            orPlaceholder(page.canonical(), "(not set)"),
            orPlaceholder(String.join(", ", h2.subList(0, Math.min(5, h2.size()))), "(none)"),
            pageIssues.isEmpty() ? "No specific issues detected." : pageIssues
        );
    }

    private static String orPlaceholder(String value, String placeholder) {
        return value == null || value.isEmpty() ? placeholder : value;
    }
}
