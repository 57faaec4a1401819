package com.devseo.audit.pipeline;

public class InvalidAuditUrlException extends RuntimeException {
    public InvalidAuditUrlException(String message) {
        super(message);
    }
}
