package com.devseo.audit.crawl.render;

import java.time.Duration;

public record RenderOptions(Duration navigationTimeout, Duration settleDelay, String userAgent) {
}
