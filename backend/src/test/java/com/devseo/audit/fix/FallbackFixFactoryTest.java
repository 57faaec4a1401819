package com.devseo.audit.fix;

import com.devseo.audit.crawl.model.CrawledPage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static com.devseo.audit.support.TestPages.page;
import static org.assertj.core.api.Assertions.assertThat;

class FallbackFixFactoryTest {
    private final FallbackFixFactory factory = new FallbackFixFactory(new ObjectMapper());

    @Test
    void derivesFixFromDomainWhenPageIsBare() {
        CrawledPage page = page("https://www.acme.io/").title("").metaDescription("").h1().build();

        AiFix fix = factory.fallbackFor(page);

        assertThat(fix.pageUrl()).isEqualTo("https://www.acme.io/");
        assertThat(fix.optimizedTitle()).isEqualTo("acme.io - Homepage");
        assertThat(fix.optimizedMetaDescription())
            .isEqualTo("Visit acme.io for more information about our products and services.");
        assertThat(fix.improvedH1()).isEqualTo("Welcome to acme.io");
        assertThat(fix.jsonLdSchema().get("@context").asText()).isEqualTo("https://schema.org");
        assertThat(fix.jsonLdSchema().get("@type").asText()).isEqualTo("WebPage");
        assertThat(fix.jsonLdSchema().get("url").asText()).isEqualTo("https://www.acme.io/");
        assertThat(fix.suggestedInternalLinkingText()).startsWith("Learn more about acme.io.");
    }

    @Test
    void keepsExistingValuesAndTruncatesLongOnes() {
        String longTitle = "t".repeat(80);
        CrawledPage page = page("https://acme.io/about").title(longTitle).h1("About Acme").build();

        AiFix fix = factory.fallbackFor(page);

        assertThat(fix.optimizedTitle()).hasSize(60).endsWith("...");
        assertThat(fix.optimizedMetaDescription()).isEqualTo(page.metaDescription());
        assertThat(fix.improvedH1()).isEqualTo("About Acme");
        assertThat(fix.jsonLdSchema().get("name").asText()).isEqualTo(longTitle);
    }

    @Test
    void truncateLeavesValuesAtTheLimitAlone() {
        assertThat(FallbackFixFactory.truncate("x".repeat(60), 60)).hasSize(60).doesNotEndWith("...");
        assertThat(FallbackFixFactory.truncate("x".repeat(161), 160)).isEqualTo("x".repeat(157) + "...");
    }

    @Test
    void unparsableUrlFallsBackToGenericName() {
        assertThat(FallbackFixFactory.displayDomain("not a url")).isEqualTo("website");
    }
}
