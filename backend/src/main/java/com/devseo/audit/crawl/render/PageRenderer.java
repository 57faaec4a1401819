package com.devseo.audit.crawl.render;

/**
 * Launches a browser-like rendering engine. One {@link RenderingBrowser} is launched per crawl.
 */
public interface PageRenderer {

    RenderingBrowser launch() throws PageRenderException;
}
