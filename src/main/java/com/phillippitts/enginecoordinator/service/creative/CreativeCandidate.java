package com.phillippitts.enginecoordinator.service.creative;

/**
 * Scored creative candidate.
 *
 * @param combinedRank weighted sum of novelty and feasibility; results are sorted by it, descending
 */
public record CreativeCandidate(
        String id,
        String content,
        double noveltyScore,
        double feasibilityScore,
        double combinedRank
) {}
