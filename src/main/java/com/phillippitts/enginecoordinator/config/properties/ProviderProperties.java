package com.phillippitts.enginecoordinator.config.properties;

import com.phillippitts.enginecoordinator.service.provider.ProviderKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered provider catalogue, bound from {@code coordinator.providers[n].*}.
 *
 * <pre>
 * coordinator.providers[0].id=local
 * coordinator.providers[0].kind=LOCAL
 * coordinator.providers[0].type=OPENAI_COMPATIBLE
 * coordinator.providers[0].endpoint=http://localhost:11434/v1
 * coordinator.providers[0].model=llama3
 * coordinator.providers[0].priority=0
 * coordinator.providers[0].timeout=5s
 * </pre>
 */
@ConfigurationProperties(prefix = "coordinator")
@Validated
public class ProviderProperties {

    /** Protocol an adapter speaks. */
    public enum AdapterType { ECHO, OPENAI_COMPATIBLE }

    @Valid
    private List<Provider> providers = new ArrayList<>();

    public List<Provider> getProviders() {
        return providers;
    }

    public void setProviders(List<Provider> providers) {
        this.providers = providers;
    }

    /**
     * One provider entry.
     */
    public static class Provider {
        @NotBlank(message = "Provider id must not be blank")
        private String id;

        @NotNull
        private ProviderKind kind = ProviderKind.LOCAL;

        @NotNull
        private AdapterType type = AdapterType.OPENAI_COMPATIBLE;

        private String endpoint = "";

        private String model = "";

        /** API key; prefer supplying it through an environment placeholder. */
        private String apiKey = "";

        @Min(value = 0, message = "Priority must be >= 0")
        private int priority;

        @DecimalMin(value = "0.0", message = "Cost per 1k tokens must be >= 0")
        private double costPerKToken;

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /** Simulated latency for ECHO providers. */
        private Duration echoLatency = Duration.ZERO;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public ProviderKind getKind() {
            return kind;
        }

        public void setKind(ProviderKind kind) {
            this.kind = kind;
        }

        public AdapterType getType() {
            return type;
        }

        public void setType(AdapterType type) {
            this.type = type;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public double getCostPerKToken() {
            return costPerKToken;
        }

        public void setCostPerKToken(double costPerKToken) {
            this.costPerKToken = costPerKToken;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getEchoLatency() {
            return echoLatency;
        }

        public void setEchoLatency(Duration echoLatency) {
            this.echoLatency = echoLatency;
        }
    }
}
