package com.phillippitts.enginecoordinator.domain;

/**
 * Kind-specific task payload. One record per {@link TaskKind}, each carrying only the fields that
 * kind needs.
 *
 * <p>Consumers dispatch through {@link #accept(Visitor)} so every kind is handled explicitly; adding
 * a kind breaks compilation of every visitor until it is handled.
 */
public interface TaskPayload {

    TaskKind kind();

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive handler over payload kinds.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitCompletion(CompletionPayload payload);

        R visitRecall(RecallPayload payload);

        R visitParallel(ParallelPayload payload);

        R visitCreative(CreativePayload payload);

        R visitComposite(CompositePayload payload);
    }
}
