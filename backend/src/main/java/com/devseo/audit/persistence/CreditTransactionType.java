package com.devseo.audit.persistence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CreditTransactionType {
    DEBIT,
    REFUND;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
