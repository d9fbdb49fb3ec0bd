package com.phillippitts.enginecoordinator.domain;

import java.util.Objects;

/**
 * Multi-candidate generation request.
 *
 * @param prompt problem statement
 * @param count  number of candidates wanted
 */
public record CreativePayload(String prompt, int count) implements TaskPayload {

    public CreativePayload {
        Objects.requireNonNull(prompt, "prompt");
        if (prompt.isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, got: " + count);
        }
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CREATIVE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCreative(this);
    }
}
