package com.devseo.audit.crawl.render;

import com.devseo.audit.config.AuditProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

@Component
@ConditionalOnProperty(name = "audit.crawler.renderer", havingValue = "playwright", matchIfMissing = true)
public class PlaywrightPageRenderer implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightPageRenderer.class);
    private static final List<String> CHROMIUM_ARGS = List.of(
        "--no-sandbox",
        "--disable-setuid-sandbox",
        "--disable-dev-shm-usage",
        "--disable-gpu",
        "--disable-extensions"
    );

    private final AuditProperties properties;

    public PlaywrightPageRenderer(AuditProperties properties) {
        this.properties = properties;
    }

    @Override
    public RenderingBrowser launch() throws PageRenderException {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                .setHeadless(true)
                .setArgs(CHROMIUM_ARGS);
            String chromiumPath = properties.getCrawler().getChromiumPath();
            if (chromiumPath != null && !chromiumPath.isBlank()) {
                options.setExecutablePath(Path.of(chromiumPath.trim()));
            }
            Browser browser = playwright.chromium().launch(options);
            return new PlaywrightBrowser(playwright, browser);
        } catch (PlaywrightException e) {
            if (playwright != null) {
                closeQuietly(playwright);
            }
            throw new PageRenderException(e.getMessage(), e);
        }
    }

    private static void closeQuietly(Playwright playwright) {
        try {
            playwright.close();
        } catch (PlaywrightException e) {
            log.debug("Ignoring playwright close failure: {}", e.getMessage());
        }
    }

    private static final class PlaywrightBrowser implements RenderingBrowser {
        private final Playwright playwright;
        private final Browser browser;

        private PlaywrightBrowser(Playwright playwright, Browser browser) {
            this.playwright = playwright;
            this.browser = browser;
        }

        @Override
        public RenderSession openSession(RenderOptions options) throws PageRenderException {
            try {
                BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                    .setUserAgent(options.userAgent())
                    .setViewportSize(1280, 720)
                    .setJavaScriptEnabled(true));
                context.setDefaultTimeout(options.navigationTimeout().toMillis());
                return new PlaywrightSession(context, options);
            } catch (PlaywrightException e) {
                throw new PageRenderException("Failed to open browser context: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                browser.close();
            } catch (PlaywrightException e) {
                log.debug("Ignoring browser close failure: {}", e.getMessage());
            } finally {
                closeQuietly(playwright);
            }
        }
    }

    private static final class PlaywrightSession implements RenderSession {
        private final BrowserContext context;
        private final RenderOptions options;

        private PlaywrightSession(BrowserContext context, RenderOptions options) {
            this.context = context;
            this.options = options;
        }

        @Override
        public RenderedPage navigate(String url) throws PageRenderException {
            try {
                Page page = context.newPage();
                page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(options.navigationTimeout().toMillis()));
                long settleMs = options.settleDelay().toMillis();
                if (settleMs > 0) {
                    page.waitForTimeout(settleMs);
                }
                return new RenderedPage(page.url(), page.content());
            } catch (PlaywrightException e) {
                throw new PageRenderException(e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                context.close();
            } catch (PlaywrightException e) {
                log.debug("Ignoring browser context close failure: {}", e.getMessage());
            }
        }
    }
}
