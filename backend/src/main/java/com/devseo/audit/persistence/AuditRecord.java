package com.devseo.audit.persistence;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record AuditRecord(
    long id,
    String userId,
    String url,
    String domain,
    AuditStatus status,
    Integer overallScore,
    Integer metaScore,
    Integer contentScore,
    Integer performanceScore,
    Integer technicalScore,
    int pagesCrawled,
    int issuesFound,
    int fixesGenerated,
    JsonNode results,
    String summary,
    Instant createdAt,
    Instant completedAt
) {
}
