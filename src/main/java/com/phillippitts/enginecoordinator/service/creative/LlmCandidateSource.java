package com.phillippitts.enginecoordinator.service.creative;

import com.phillippitts.enginecoordinator.service.provider.CompletionRequest;
import com.phillippitts.enginecoordinator.service.provider.LlmRouter;
import com.phillippitts.enginecoordinator.service.provider.RoutedCompletion;

import java.time.Duration;
import java.util.Objects;

/**
 * Drafts candidates through the {@link LlmRouter}, rotating an ideation strategy per draft so
 * that concurrent drafts diverge.
 */
public class LlmCandidateSource implements CandidateSource {

    enum Strategy {
        ANALOGY("Answer by drawing an analogy from an unrelated field."),
        INVERSION("Answer by inverting the problem: what would make it worse, then reverse it."),
        COMBINATION("Answer by combining two existing ideas into something new."),
        CONSTRAINT_RELAXATION("Answer by dropping one assumed constraint."),
        FIRST_PRINCIPLES("Answer by reasoning from first principles.");

        private final String instruction;

        Strategy(String instruction) {
            this.instruction = instruction;
        }

        static Strategy forIndex(int index) {
            Strategy[] all = values();
            return all[Math.floorMod(index, all.length)];
        }
    }

    private final LlmRouter router;

    public LlmCandidateSource(LlmRouter router) {
        this.router = Objects.requireNonNull(router, "router");
    }

    @Override
    public Draft draft(String prompt, int index, Duration timeout) {
        Strategy strategy = Strategy.forIndex(index);
        CompletionRequest request = CompletionRequest.of(prompt)
                .withContext("You are generating idea " + (index + 1) + ". " + strategy.instruction);
        RoutedCompletion routed = router.routeCompletion(request, timeout);
        return new Draft(routed.text(), routed.providerId(), routed.cost());
    }
}
