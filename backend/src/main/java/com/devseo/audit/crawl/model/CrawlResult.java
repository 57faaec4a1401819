package com.devseo.audit.crawl.model;

import java.util.List;

public record CrawlResult(String domain, int pagesCrawled, List<CrawledPage> pages, List<String> errors) {
    public CrawlResult {
        pages = pages == null ? List.of() : List.copyOf(pages);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static CrawlResult failed(String domain, String error) {
        return new CrawlResult(domain, 0, List.of(), List.of(error));
    }
}
