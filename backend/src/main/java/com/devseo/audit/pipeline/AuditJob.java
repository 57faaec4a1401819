package com.devseo.audit.pipeline;

public record AuditJob(long auditId, String userId, String url, String domain) {
}
