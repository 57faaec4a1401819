package com.devseo.audit.fix;

import com.devseo.audit.crawl.model.CrawledPage;
import com.devseo.audit.crawl.util.CrawlUrlUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Deterministic fix derived from the page itself, used whenever a generated one is unavailable.
 */
@Component
public class FallbackFixFactory {
    static final int TITLE_LIMIT = 60;
    static final int DESCRIPTION_LIMIT = 160;

    private final ObjectMapper objectMapper;

    public FallbackFixFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AiFix fallbackFor(CrawledPage page) {
        String domain = displayDomain(page.url());
        String title = page.title().isEmpty() ? domain + " - Homepage" : page.title();
        String description = page.metaDescription().isEmpty()
            ? "Visit " + domain + " for more information about our products and services."
            : page.metaDescription();
        String h1 = page.headings().h1().isEmpty() || page.headings().h1().get(0).isEmpty()
            ? "Welcome to " + domain
            : page.headings().h1().get(0);

        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("@context", "https://schema.org");
        schema.put("@type", "WebPage");
        schema.put("name", title);
        schema.put("description", description);
        schema.put("url", page.url());

        return new AiFix(
            page.url(),
            truncate(title, TITLE_LIMIT),
            truncate(description, DESCRIPTION_LIMIT),
            h1,
            schema,
            "Learn more about " + domain + ". Explore our content and resources."
                + " Visit related pages for additional information."
        );
    }

    static String truncate(String value, int limit) {
        if (value.length() <= limit) {
            return value;
        }
        return value.substring(0, limit - 3) + "...";
    }

    static String displayDomain(String url) {
        String host = CrawlUrlUtils.host(url);
        if (host == null) {
            return "website";
        }
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
