package com.devseo.audit.analysis;

import com.devseo.audit.crawl.model.IssueSeverity;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A rule violation. {@code pageUrl} is null for site-wide issues.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeoIssue(
    IssueType issueType,
    IssueSeverity severity,
    String explanation,
    String recommendedFix,
    String pageUrl
) {
    public boolean isSiteWide() {
        return pageUrl == null;
    }

    public boolean appliesTo(String url) {
        return pageUrl == null || pageUrl.equals(url);
    }
}
