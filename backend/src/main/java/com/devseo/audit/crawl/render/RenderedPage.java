package com.devseo.audit.crawl.render;

/**
 * DOM snapshot after navigation and settling; {@code url} is the final URL after redirects.
 */
public record RenderedPage(String url, String html) {
}
