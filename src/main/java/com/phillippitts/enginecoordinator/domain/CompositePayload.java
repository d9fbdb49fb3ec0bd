package com.phillippitts.enginecoordinator.domain;

import java.util.List;
import java.util.Objects;

/**
 * Recall-enriched completion, optionally accompanied by creative candidates and pool sub-prompts.
 *
 * @param prompt         main prompt; also used as the recall key
 * @param topK           recall hits folded into the completion context
 * @param creativeCount  creative candidates to generate alongside; 0 disables the creative engine
 * @param subPrompts     extra prompts run on the worker pool; empty disables the pool engine
 */
public record CompositePayload(String prompt, int topK, int creativeCount, List<String> subPrompts)
        implements TaskPayload {

    public CompositePayload {
        Objects.requireNonNull(prompt, "prompt");
        if (prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got: " + topK);
        }
        if (creativeCount < 0) {
            throw new IllegalArgumentException("creativeCount must be >= 0, got: " + creativeCount);
        }
        subPrompts = subPrompts == null ? List.of() : List.copyOf(subPrompts);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.COMPOSITE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitComposite(this);
    }
}
