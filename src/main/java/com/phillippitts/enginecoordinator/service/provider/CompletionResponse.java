package com.phillippitts.enginecoordinator.service.provider;

import java.util.Objects;

/**
 * Provider answer.
 *
 * @param text      generated text
 * @param tokensIn  prompt tokens reported by the backend; 0 when unknown
 * @param tokensOut completion tokens reported by the backend; 0 when unknown
 */
public record CompletionResponse(String text, int tokensIn, int tokensOut) {

    /** Rough characters-per-token ratio used when a backend reports no usage. */
    static final int CHARS_PER_TOKEN = 4;

    public CompletionResponse {
        Objects.requireNonNull(text, "text");
        if (tokensIn < 0 || tokensOut < 0) {
            throw new IllegalArgumentException("token counts must be >= 0");
        }
    }

    /**
     * Fills missing token counts with a length-based estimate so billed providers never record
     * a zero cost for a real call.
     */
    CompletionResponse withUsageFallback(CompletionRequest request) {
        int in = tokensIn > 0 ? tokensIn : estimateTokens(request.inputLength());
        int out = tokensOut > 0 ? tokensOut : estimateTokens(text.length());
        return in == tokensIn && out == tokensOut ? this : new CompletionResponse(text, in, out);
    }

    static int estimateTokens(int chars) {
        return Math.max(1, (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }
}
