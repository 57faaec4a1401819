package com.devseo.audit.crawl.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Declaration order is urgency order: {@code CRITICAL} ranks before {@code WARNING} before {@code INFO}.
 */
public enum IssueSeverity {
    CRITICAL,
    WARNING,
    INFO;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssueSeverity fromKey(String key) {
        if (key == null) {
            return null;
        }
        return IssueSeverity.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
