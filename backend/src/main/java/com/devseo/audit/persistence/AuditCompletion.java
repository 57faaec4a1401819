package com.devseo.audit.persistence;

import com.fasterxml.jackson.databind.JsonNode;

public record AuditCompletion(
    int overallScore,
    int metaScore,
    int contentScore,
    int performanceScore,
    int technicalScore,
    int pagesCrawled,
    int issuesFound,
    int fixesGenerated,
    String summary,
    JsonNode results
) {
}
