package com.devseo.audit.crawl.render;

public class PageRenderException extends Exception {
    public PageRenderException(String message) {
        super(message);
    }

    public PageRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
