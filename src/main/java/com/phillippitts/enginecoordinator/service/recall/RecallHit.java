package com.phillippitts.enginecoordinator.service.recall;

import java.util.Comparator;
import java.util.Objects;

/**
 * One retrieved memory.
 *
 * @param id       memory id
 * @param score    similarity to the query
 * @param payload  memory content
 * @param sequence insertion order of the memory
 */
public record RecallHit(String id, double score, String payload, long sequence) {

    /** Descending score, then most recently inserted first. */
    public static final Comparator<RecallHit> RANKING = Comparator
            .comparingDouble(RecallHit::score).reversed()
            .thenComparing(Comparator.comparingLong(RecallHit::sequence).reversed());

    public RecallHit {
        Objects.requireNonNull(id, "id");
        payload = payload == null ? "" : payload;
    }
}
