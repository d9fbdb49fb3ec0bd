package com.phillippitts.enginecoordinator.service.creative;

import java.util.List;

/**
 * Outcome of one generation.
 *
 * @param candidates  ranked candidates, at most {@code requested}
 * @param requested   number of candidates asked for
 * @param partial     true when fewer than requested were produced in time
 * @param latencyMs   wall time of the generation
 * @param cost        summed cost of every draft received, including ones dropped as duplicates
 * @param providerIds distinct providers that served the received drafts, in draft order
 */
public record CreativeResult(List<CreativeCandidate> candidates,
                             int requested,
                             boolean partial,
                             long latencyMs,
                             double cost,
                             List<String> providerIds) {

    public CreativeResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        providerIds = providerIds == null ? List.of() : List.copyOf(providerIds);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    /** Provider of the first received draft, or null when no provider was involved. */
    public String primaryProvider() {
        return providerIds.isEmpty() ? null : providerIds.get(0);
    }
}
