package com.devseo.audit.crawl.model;

/**
 * Issue spotted while extracting a single page, before the site-level rule analysis runs.
 */
public record PageIssue(IssueSeverity severity, String title, String description) {
}
