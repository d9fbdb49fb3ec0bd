package com.phillippitts.enginecoordinator.service.provider;

import com.phillippitts.enginecoordinator.domain.ProviderAttempt;

import java.util.List;
import java.util.Objects;

/**
 * Successful routing outcome.
 *
 * @param providerId provider that served the request
 * @param kind       kind of that provider
 * @param response   provider response with (possibly estimated) token usage
 * @param cost       cost charged for the call
 * @param latencyMs  latency of the successful call
 * @param attempts   every attempt in order, the successful one last
 */
public record RoutedCompletion(
        String providerId,
        ProviderKind kind,
        CompletionResponse response,
        double cost,
        long latencyMs,
        List<ProviderAttempt> attempts
) {

    public RoutedCompletion {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(response, "response");
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public String text() {
        return response.text();
    }

    /** True when a higher-priority provider was tried or skipped first. */
    public boolean fellBack() {
        return attempts.size() > 1;
    }
}
