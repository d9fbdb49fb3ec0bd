package com.phillippitts.enginecoordinator.domain;

import java.util.Objects;

/**
 * One provider call made while routing a completion.
 *
 * @param providerId provider that was tried or skipped
 * @param error      failure description; null for the successful attempt
 * @param latencyMs  time spent on the attempt
 */
public record ProviderAttempt(String providerId, String error, long latencyMs) {

    public ProviderAttempt {
        Objects.requireNonNull(providerId, "providerId");
    }

    public boolean succeeded() {
        return error == null;
    }
}
