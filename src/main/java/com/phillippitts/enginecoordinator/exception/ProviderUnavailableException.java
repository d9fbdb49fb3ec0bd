package com.phillippitts.enginecoordinator.exception;

/**
 * A single model provider failed to answer: timeout, transport error, HTTP error or malformed body.
 *
 * <p>Recoverable: the router records the failure and falls through to the next provider. Build
 * detailed instances with {@link ProviderUnavailableExceptionBuilder}.
 */
public class ProviderUnavailableException extends CoordinatorException {

    private final String providerId;

    public ProviderUnavailableException(String message, String providerId) {
        super(message);
        this.providerId = providerId;
    }

    public ProviderUnavailableException(String message, String providerId, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
