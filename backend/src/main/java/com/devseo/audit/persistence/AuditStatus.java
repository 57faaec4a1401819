package com.devseo.audit.persistence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AuditStatus fromKey(String key) {
        if (key == null || key.isBlank()) {
            return PENDING;
        }
        return AuditStatus.valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
