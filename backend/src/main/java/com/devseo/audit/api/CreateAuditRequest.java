package com.devseo.audit.api;

public record CreateAuditRequest(String url) {
}
