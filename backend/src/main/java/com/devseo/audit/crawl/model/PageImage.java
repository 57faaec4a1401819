package com.devseo.audit.crawl.model;

public record PageImage(String src, String alt) {
    public boolean missingAlt() {
        return alt == null || alt.isBlank();
    }
}
