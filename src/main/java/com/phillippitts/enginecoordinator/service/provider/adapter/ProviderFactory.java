package com.phillippitts.enginecoordinator.service.provider.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.enginecoordinator.config.properties.ProviderProperties;
import com.phillippitts.enginecoordinator.service.provider.ModelProvider;
import com.phillippitts.enginecoordinator.service.provider.ProviderDescriptor;
import okhttp3.OkHttpClient;

import java.util.Objects;

/**
 * Turns configured provider entries into registry descriptors backed by concrete adapters.
 * All HTTP adapters share one {@link OkHttpClient} connection pool.
 */
public final class ProviderFactory {

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;

    public ProviderFactory(OkHttpClient httpClient, ObjectMapper mapper) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ProviderDescriptor describe(ProviderProperties.Provider entry) {
        return new ProviderDescriptor(entry.getId(), entry.getKind(), entry.getEndpoint(),
                entry.getPriority(), entry.getCostPerKToken(), entry.getTimeout(), create(entry));
    }

    /**
     * @throws IllegalArgumentException if an HTTP provider has no endpoint or model
     */
    public ModelProvider create(ProviderProperties.Provider entry) {
        return switch (entry.getType()) {
            case ECHO -> new EchoProvider(entry.getId(), entry.getEchoLatency());
            case OPENAI_COMPATIBLE -> {
                if (isBlank(entry.getEndpoint()) || isBlank(entry.getModel())) {
                    throw new IllegalArgumentException(
                            "Provider " + entry.getId() + " requires endpoint and model");
                }
                yield new OpenAiCompatibleProvider(entry.getId(), entry.getEndpoint(), entry.getModel(),
                        entry.getApiKey(), httpClient, mapper);
            }
        };
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
