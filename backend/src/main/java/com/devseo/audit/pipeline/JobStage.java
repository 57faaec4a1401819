package com.devseo.audit.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStage {
    QUEUED,
    CRAWLING,
    ANALYZING,
    FIXING,
    SAVING,
    DONE,
    ERROR;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
