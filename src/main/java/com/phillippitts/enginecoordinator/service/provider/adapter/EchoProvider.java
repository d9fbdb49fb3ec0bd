package com.phillippitts.enginecoordinator.service.provider.adapter;

import com.phillippitts.enginecoordinator.exception.ProviderUnavailableExceptionBuilder;
import com.phillippitts.enginecoordinator.service.provider.CompletionRequest;
import com.phillippitts.enginecoordinator.service.provider.CompletionResponse;
import com.phillippitts.enginecoordinator.service.provider.ModelProvider;

import java.time.Duration;
import java.util.Objects;

/**
 * Offline provider that echoes the prompt back after an optional simulated latency.
 * Lets the service start and route end to end without any model backend.
 */
public final class EchoProvider implements ModelProvider {

    private final String id;
    private final Duration latency;

    public EchoProvider(String id) {
        this(id, Duration.ZERO);
    }

    public EchoProvider(String id, Duration latency) {
        this.id = Objects.requireNonNull(id, "id");
        this.latency = latency == null ? Duration.ZERO : latency;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public CompletionResponse complete(CompletionRequest request, Duration timeout) {
        if (!latency.isZero()) {
            boolean exceeds = latency.compareTo(timeout) > 0;
            try {
                Thread.sleep((exceeds ? timeout : latency).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw ProviderUnavailableExceptionBuilder.create("Echo call interrupted")
                        .provider(id).cause(e).build();
            }
            if (exceeds) {
                throw ProviderUnavailableExceptionBuilder.create("Echo call timed out")
                        .provider(id).durationMs(timeout.toMillis()).build();
            }
        }
        String text = "[" + id + "] " + request.prompt();
        return new CompletionResponse(text, 0, 0);
    }
}
