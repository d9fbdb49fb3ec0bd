package com.phillippitts.enginecoordinator.domain;

import java.util.List;

/**
 * Independent prompts fanned out across the worker pool, one pool task per prompt.
 *
 * @param prompts non-empty list of prompts
 */
public record ParallelPayload(List<String> prompts) implements TaskPayload {

    public ParallelPayload {
        if (prompts == null || prompts.isEmpty()) {
            throw new IllegalArgumentException("parallel task requires at least one prompt");
        }
        prompts = List.copyOf(prompts);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.PARALLEL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitParallel(this);
    }
}
