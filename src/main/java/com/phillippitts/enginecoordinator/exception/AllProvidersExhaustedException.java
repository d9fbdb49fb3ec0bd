package com.phillippitts.enginecoordinator.exception;

import com.phillippitts.enginecoordinator.domain.ProviderAttempt;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every provider in the chain failed or was skipped. Carries the per-attempt errors in the order
 * they were tried.
 */
public class AllProvidersExhaustedException extends CoordinatorException {

    private final List<ProviderAttempt> attempts;

    public AllProvidersExhaustedException(List<ProviderAttempt> attempts) {
        super(describe(attempts));
        this.attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public List<ProviderAttempt> getAttempts() {
        return attempts;
    }

    private static String describe(List<ProviderAttempt> attempts) {
        if (attempts == null || attempts.isEmpty()) {
            return "No providers available";
        }
        return "All providers exhausted: " + attempts.stream()
                .map(a -> a.providerId() + "=" + a.error())
                .collect(Collectors.joining("; "));
    }
}
