package com.phillippitts.enginecoordinator.service.creative;

/**
 * One draft from a {@link CandidateSource}, with what producing it cost.
 *
 * @param text       draft text
 * @param providerId provider that served the draft; null for sources that call no provider
 * @param cost       cost charged for the draft
 */
public record Draft(String text, String providerId, double cost) {

    /** A draft that cost nothing and came from no provider. */
    public static Draft of(String text) {
        return new Draft(text, null, 0.0);
    }
}
