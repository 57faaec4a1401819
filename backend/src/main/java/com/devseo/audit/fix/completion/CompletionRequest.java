package com.devseo.audit.fix.completion;

/**
 * @param maxTokens upper bound on generated tokens
 * @param forceJson ask the backend for a strict JSON object response
 */
public record CompletionRequest(long maxTokens, boolean forceJson) {
}
