package com.devseo.audit.pipeline;

public class AuditNotFoundException extends RuntimeException {
    public AuditNotFoundException(long auditId) {
        super("Audit not found: " + auditId);
    }
}
