package com.devseo.audit.crawl.render;

import com.devseo.audit.crawl.http.PoliteHttpClient;
import com.devseo.audit.crawl.model.HttpFetchResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Renders pages with a plain GET; no scripts run, so the DOM is the server response.
 */
@Component
@ConditionalOnProperty(name = "audit.crawler.renderer", havingValue = "http")
public class HttpPageRenderer implements PageRenderer {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";

    private final PoliteHttpClient httpClient;

    public HttpPageRenderer(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RenderingBrowser launch() {
        return new HttpBrowser();
    }

    private final class HttpBrowser implements RenderingBrowser {
        @Override
        public RenderSession openSession(RenderOptions options) {
            return new HttpSession(options);
        }

        @Override
        public void close() {
        }
    }

    private final class HttpSession implements RenderSession {
        private final RenderOptions options;

        private HttpSession(RenderOptions options) {
            this.options = options;
        }

        @Override
        public RenderedPage navigate(String url) throws PageRenderException {
            HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT, options.navigationTimeout());
            if (fetch.errorCode() != null) {
                throw new PageRenderException(fetch.errorCode() + ": " + fetch.errorMessage());
            }
            // Error pages render like they would in a browser; only a missing response fails.
            if (fetch.statusCode() <= 0) {
                throw new PageRenderException("No response for " + url);
            }
            return new RenderedPage(fetch.finalUrlOrRequested(), fetch.body() == null ? "" : fetch.body());
        }

        @Override
        public void close() {
        }
    }
}
