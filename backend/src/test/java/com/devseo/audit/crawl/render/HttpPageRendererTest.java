package com.devseo.audit.crawl.render;

import com.devseo.audit.config.AuditProperties;
import com.devseo.audit.crawl.http.PoliteHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPageRendererTest {
    private MockWebServer server;
    private ExecutorService executor;
    private HttpPageRenderer renderer;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        AuditProperties properties = new AuditProperties();
        properties.getHttp().setRequestTimeoutSeconds(2);
        renderer = new HttpPageRenderer(new PoliteHttpClient(properties, executor));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void returnsServerHtmlForSuccessAndErrorPages() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html><title>Home</title></html>"));
        server.enqueue(new MockResponse().setResponseCode(404).setBody("<html><h1>Not found</h1></html>"));

        try (RenderingBrowser browser = renderer.launch(); RenderSession session = browser.openSession(options())) {
            RenderedPage home = session.navigate(server.url("/").toString());
            RenderedPage missing = session.navigate(server.url("/gone").toString());

            assertThat(home.html()).contains("<title>Home</title>");
            assertThat(home.url()).isEqualTo(server.url("/").toString());
            assertThat(missing.html()).contains("Not found");
        }
    }

    @Test
    void reportsFinalUrlAfterRedirect() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(301).setHeader("Location", "/docs/"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html><a href=\"intro\">Intro</a></html>"));

        try (RenderingBrowser browser = renderer.launch(); RenderSession session = browser.openSession(options())) {
            RenderedPage docs = session.navigate(server.url("/docs").toString());

            assertThat(docs.url()).isEqualTo(server.url("/docs/").toString());
            assertThat(docs.html()).contains("href=\"intro\"");
        }
    }

    @Test
    void decodesBodyWithDeclaredCharset() throws Exception {
        byte[] latin1 = "<html><title>Caf\u00e9 cr\u00e8me</title></html>".getBytes(StandardCharsets.ISO_8859_1);
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html; charset=ISO-8859-1")
            .setBody(new Buffer().write(latin1)));

        try (RenderingBrowser browser = renderer.launch(); RenderSession session = browser.openSession(options())) {
            RenderedPage page = session.navigate(server.url("/").toString());

            assertThat(page.html()).contains("Caf\u00e9 cr\u00e8me");
        }
    }

    @Test
    void failsWhenNothingAnswers() throws Exception {
        String url = server.url("/").toString();
        server.shutdown();

        try (RenderingBrowser browser = renderer.launch(); RenderSession session = browser.openSession(options())) {
            assertThatThrownBy(() -> session.navigate(url)).isInstanceOf(PageRenderException.class);
        }
    }

    private static RenderOptions options() {
        return new RenderOptions(Duration.ofSeconds(2), Duration.ZERO, "DevSEO-AI/1.0 (SEO Crawler)");
    }
}
