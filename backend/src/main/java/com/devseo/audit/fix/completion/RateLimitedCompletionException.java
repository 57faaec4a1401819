package com.devseo.audit.fix.completion;

public class RateLimitedCompletionException extends TextCompletionException {
    public RateLimitedCompletionException(String message) {
        super(message);
    }

    public RateLimitedCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
