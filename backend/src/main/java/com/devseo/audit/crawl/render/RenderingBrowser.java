package com.devseo.audit.crawl.render;

public interface RenderingBrowser extends AutoCloseable {

    /**
     * Opens an isolated session: no cookies, storage or listeners are shared with other sessions.
     */
    RenderSession openSession(RenderOptions options) throws PageRenderException;

    @Override
    void close();
}
