package com.devseo.audit.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum IssueType {
    MISSING_META_DESCRIPTION,
    MISSING_H1,
    MULTIPLE_H1,
    THIN_CONTENT,
    MISSING_ALT_TAGS,
    NO_SCHEMA,
    DUPLICATE_TITLES,
    ORPHAN_PAGE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Display form of the key, e.g. {@code missing_h1} becomes {@code Missing H1}.
     */
    public String displayTitle() {
        return Arrays.stream(key().split("_"))
            .map(word -> word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1))
            .collect(Collectors.joining(" "));
    }

    @JsonCreator
    public static IssueType fromKey(String key) {
        if (key == null) {
            return null;
        }
        return IssueType.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
