package com.devseo.audit.persistence;

import java.time.Instant;

public record CreditTransaction(
    long id,
    String userId,
    int amount,
    String type,
    String description,
    Long auditId,
    Instant createdAt
) {
}
