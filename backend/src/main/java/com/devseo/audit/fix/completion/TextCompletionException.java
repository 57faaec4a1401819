package com.devseo.audit.fix.completion;

public class TextCompletionException extends RuntimeException {
    public TextCompletionException(String message) {
        super(message);
    }

    public TextCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
