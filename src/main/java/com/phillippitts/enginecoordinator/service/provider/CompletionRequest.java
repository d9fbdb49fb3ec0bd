package com.phillippitts.enginecoordinator.service.provider;

import java.util.Objects;

/**
 * Provider-neutral completion request.
 *
 * @param prompt    user prompt
 * @param context   optional system context (recall hits, instructions); null when absent
 * @param maxTokens generation cap; 0 lets the provider decide
 */
public record CompletionRequest(String prompt, String context, int maxTokens) {

    private static final CompletionRequest PROBE = new CompletionRequest("ping", null, 1);

    public CompletionRequest {
        Objects.requireNonNull(prompt, "prompt");
        if (maxTokens < 0) {
            throw new IllegalArgumentException("maxTokens must be >= 0, got: " + maxTokens);
        }
    }

    public static CompletionRequest of(String prompt) {
        return new CompletionRequest(prompt, null, 0);
    }

    /** Minimal request used by recovery probes. */
    public static CompletionRequest probe() {
        return PROBE;
    }

    public CompletionRequest withContext(String newContext) {
        return new CompletionRequest(prompt, newContext, maxTokens);
    }

    public boolean hasContext() {
        return context != null && !context.isBlank();
    }

    /** Characters sent to the provider, for token estimation. */
    int inputLength() {
        return prompt.length() + (context == null ? 0 : context.length());
    }
}
