package com.phillippitts.enginecoordinator.service.creative;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class HeuristicCandidateScorerTest {

    private final HeuristicCandidateScorer scorer = new HeuristicCandidateScorer();

    @Test
    void restatingThePromptIsNotNovel() {
        CandidateScore s = scorer.score("reduce office energy use", "reduce office energy use", List.of());

        assertThat(s.novelty()).isZero();
    }

    @Test
    void candidateCoveringThePromptIsFeasible() {
        CandidateScore onTopic = scorer.score("reduce office energy use",
                "Reduce office energy use with motion sensors on every light", List.of());
        CandidateScore offTopic = scorer.score("reduce office energy use",
                "Paint the walls a calming shade of blue", List.of());

        assertThat(onTopic.feasibility()).isGreaterThan(offTopic.feasibility());
        assertThat(onTopic.feasibility()).isCloseTo(1.0, offset(1e-9));
    }

    @Test
    void candidateSimilarToPeersIsLessNovel() {
        String candidate = "motion sensors switch lights off in empty rooms";
        CandidateScore crowded = scorer.score("save energy", candidate,
                List.of("motion sensors switch lights off in empty rooms quickly"));
        CandidateScore alone = scorer.score("save energy", candidate,
                List.of("negotiate a green electricity tariff"));

        assertThat(crowded.novelty()).isLessThan(alone.novelty());
    }

    @Test
    void lengthFactorPenalisesVeryShortAndVeryLongAnswers() {
        assertThat(HeuristicCandidateScorer.lengthFactor(1)).isCloseTo(0.2, offset(1e-9));
        assertThat(HeuristicCandidateScorer.lengthFactor(50)).isEqualTo(1.0);
        assertThat(HeuristicCandidateScorer.lengthFactor(400)).isCloseTo(0.5, offset(1e-9));
    }

    @Test
    void similarityIsSymmetricJaccard() {
        double ab = scorer.similarity("solar panels roof", "roof solar tiles");
        double ba = scorer.similarity("roof solar tiles", "solar panels roof");

        assertThat(ab).isEqualTo(ba).isCloseTo(0.5, offset(1e-9));
        assertThat(scorer.similarity("same words here", "here same words")).isEqualTo(1.0);
    }
}
