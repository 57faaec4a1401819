package com.devseo.audit.persistence;

import com.devseo.audit.crawl.model.PageHeadings;
import com.devseo.audit.crawl.model.PageIssue;

import java.util.List;

/**
 * Stored summary of one crawled page. {@code images} is the image count; {@code schemaDetected}
 * holds the {@code @type} of each JSON-LD block.
 */
public record AuditPageRecord(
    Long id,
    long auditId,
    String url,
    String title,
    String metaDescription,
    PageHeadings headings,
    int wordCount,
    int internalLinks,
    int externalLinks,
    int images,
    List<String> schemaDetected,
    List<PageIssue> issues
) {
    public AuditPageRecord {
        headings = headings == null ? PageHeadings.empty() : headings;
        schemaDetected = schemaDetected == null ? List.of() : List.copyOf(schemaDetected);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
