package com.devseo.audit.crawl.render;

public interface RenderSession extends AutoCloseable {

    RenderedPage navigate(String url) throws PageRenderException;

    @Override
    void close();
}
