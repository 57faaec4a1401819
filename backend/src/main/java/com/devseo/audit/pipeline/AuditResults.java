package com.devseo.audit.pipeline;

import com.devseo.audit.crawl.model.IssueSeverity;
import com.devseo.audit.fix.AiFix;

import java.util.List;

/**
 * Payload stored with a completed audit.
 */
public record AuditResults(
    List<ResultIssue> issues,
    List<String> recommendations,
    List<AiFix> fixes,
    Details details
) {
    public record ResultIssue(IssueSeverity severity, String title, String description, String recommendedFix) {
    }

    public record Details(Meta meta, Content content, Performance performance, Technical technical) {
    }

    public record Meta(String title, String description, String canonical) {
    }

    public record Content(String headings, String wordCount, String readability) {
    }

    public record Performance(String images, String links, String mobile) {
    }

    public record Technical(String schema, String https, String urlStructure) {
    }
}
