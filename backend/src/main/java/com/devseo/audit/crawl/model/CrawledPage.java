package com.devseo.audit.crawl.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record CrawledPage(
    String url,
    String title,
    String metaDescription,
    PageHeadings headings,
    int wordCount,
    int internalLinks,
    int externalLinks,
    List<PageImage> images,
    String canonical,
    List<JsonNode> schemaScripts,
    List<PageIssue> issues,
    List<String> discoveredLinks
) {
    public CrawledPage {
        title = title == null ? "" : title;
        metaDescription = metaDescription == null ? "" : metaDescription;
        headings = headings == null ? PageHeadings.empty() : headings;
        images = images == null ? List.of() : List.copyOf(images);
        schemaScripts = schemaScripts == null ? List.of() : List.copyOf(schemaScripts);
        issues = issues == null ? List.of() : List.copyOf(issues);
        discoveredLinks = discoveredLinks == null ? List.of() : List.copyOf(discoveredLinks);
    }

    public long imagesMissingAlt() {
        return images.stream().filter(PageImage::missingAlt).count();
    }
}
