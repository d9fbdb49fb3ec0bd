package com.phillippitts.enginecoordinator.service.creative;

/**
 * Raw scores of one candidate, each in [0, 1].
 */
public record CandidateScore(double novelty, double feasibility) {

    public CandidateScore {
        if (novelty < 0 || novelty > 1 || feasibility < 0 || feasibility > 1) {
            throw new IllegalArgumentException("Scores must lie in [0, 1]: novelty=" + novelty
                    + ", feasibility=" + feasibility);
        }
    }
}
