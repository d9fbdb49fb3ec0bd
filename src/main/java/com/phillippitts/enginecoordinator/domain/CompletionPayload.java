package com.phillippitts.enginecoordinator.domain;

import java.util.Objects;

/**
 * Single completion routed through the provider chain.
 *
 * @param prompt    prompt text (must not be blank)
 * @param maxTokens upper bound on generated tokens; 0 lets the provider decide
 */
public record CompletionPayload(String prompt, int maxTokens) implements TaskPayload {

    public CompletionPayload {
        Objects.requireNonNull(prompt, "prompt");
        if (prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        if (maxTokens < 0) {
            throw new IllegalArgumentException("maxTokens must be >= 0, got: " + maxTokens);
        }
    }

    @Override
    public TaskKind kind() {
        return TaskKind.COMPLETION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCompletion(this);
    }
}
