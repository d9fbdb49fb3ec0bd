package com.phillippitts.enginecoordinator.service.provider;

import com.phillippitts.enginecoordinator.exception.ProviderUnavailableException;

import java.time.Duration;

/**
 * Capability every local or cloud backend implements. The registry only ever holds this
 * interface, so providers are interchangeable.
 */
public interface ModelProvider {

    /** Stable provider id; matches the id of the descriptor it is registered under. */
    String id();

    /**
     * Runs one completion.
     *
     * @param request completion request
     * @param timeout upper bound the implementation should honor for the whole call
     * @return generated text and token usage
     * @throws ProviderUnavailableException on timeout, transport or backend error
     */
    CompletionResponse complete(CompletionRequest request, Duration timeout);

    /**
     * Recovery probe used while the provider is unhealthy. Returns normally when the backend
     * answers; the default issues a one-token completion.
     */
    default void probe(Duration timeout) {
        complete(CompletionRequest.probe(), timeout);
    }
}
