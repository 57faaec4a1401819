package com.devseo.audit.pipeline;

public class AuditInterruptedException extends RuntimeException {
    public AuditInterruptedException(String message) {
        super(message);
    }
}
