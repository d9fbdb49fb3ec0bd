package com.phillippitts.enginecoordinator.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ProviderUnavailableException} with contextual details.
 *
 * <pre>
 * throw ProviderUnavailableExceptionBuilder.create("Completion request failed")
 *         .provider("cloud-openai")
 *         .httpStatus(502)
 *         .durationMs(830)
 *         .metadata("endpoint", endpoint)
 *         .build();
 * </pre>
 *
 * <p>Resulting message format:
 * {@code {message} (httpStatus={code}, durationMs={ms}, {key}={value}, ...)}
 */
public final class ProviderUnavailableExceptionBuilder {

    private final String message;
    private String providerId;
    private Throwable cause;
    private Integer httpStatus;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderUnavailableExceptionBuilder(String message) {
        this.message = message;
    }

    public static ProviderUnavailableExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderUnavailableExceptionBuilder(message);
    }

    public ProviderUnavailableExceptionBuilder provider(String providerId) {
        this.providerId = providerId;
        return this;
    }

    public ProviderUnavailableExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ProviderUnavailableExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public ProviderUnavailableExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata pair; null keys or values are ignored.
     */
    public ProviderUnavailableExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ProviderUnavailableException build() {
        String detailed = buildDetailedMessage();
        String provider = providerId != null ? providerId : "unknown";
        return cause != null
                ? new ProviderUnavailableException(detailed, provider, cause)
                : new ProviderUnavailableException(detailed, provider);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (httpStatus != null) {
            details.put("httpStatus", String.valueOf(httpStatus));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
