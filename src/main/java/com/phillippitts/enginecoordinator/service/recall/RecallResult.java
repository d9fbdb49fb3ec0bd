package com.phillippitts.enginecoordinator.service.recall;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered hits plus timing.
 *
 * @param hits               ranked hits, at most topK
 * @param retrievalLatencyMs time spent in the query
 * @param degraded           true when the backend did not finish within the budget or failed
 */
public record RecallResult(List<RecallHit> hits, long retrievalLatencyMs, boolean degraded) {

    public RecallResult {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    /**
     * Hit payloads as a bullet list, used as completion context.
     */
    public String asContext() {
        return hits.stream().map(h -> "- " + h.payload()).collect(Collectors.joining("\n"));
    }
}
