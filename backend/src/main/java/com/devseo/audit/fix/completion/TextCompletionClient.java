package com.devseo.audit.fix.completion;

/**
 * Single-prompt text completion backend.
 */
public interface TextCompletionClient {

    /**
     * False when no backend is configured; callers then skip completion entirely.
     */
    boolean isAvailable();

    /**
     * Returns the raw completion text.
     *
     * @throws RateLimitedCompletionException when the backend rejects the call for rate limiting
     * @throws TextCompletionException for any other failure
     */
    String complete(String prompt, CompletionRequest request);
}
