package com.phillippitts.enginecoordinator.service.creative;

import java.util.List;

/**
 * Scores creative drafts and judges whether two drafts are near-duplicates.
 */
public interface CandidateScorer {

    /**
     * @param prompt    creative prompt
     * @param candidate draft being scored
     * @param peers     the other drafts of the same generation
     */
    CandidateScore score(String prompt, String candidate, List<String> peers);

    /** Similarity in [0, 1]; 1 means identical. */
    double similarity(String a, String b);
}
