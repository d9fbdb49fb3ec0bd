package com.phillippitts.enginecoordinator.service.provider;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Catalogue entry for one provider: static routing attributes plus mutable health state.
 *
 * <p><b>Ownership:</b> instances are owned by {@link ProviderRegistry}. Health fields are written
 * only by {@link HealthMonitor}, always while holding this descriptor's lock, which makes every
 * transition atomic per provider. Readers see volatile values that may lag by one update.
 */
public final class ProviderDescriptor {

    private final String id;
    private final ProviderKind kind;
    private final String endpoint;
    private final int priority;
    private final double costPerKToken;
    private final Duration perCallTimeout;
    private final ModelProvider provider;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile long registrationSequence = -1;

    private volatile HealthState healthState = HealthState.HEALTHY;
    private volatile int consecutiveFailures;
    private volatile int consecutiveProbeSuccesses;
    private volatile Instant lastProbeAt;
    private volatile Instant nextProbeAt;

    public ProviderDescriptor(String id,
                              ProviderKind kind,
                              String endpoint,
                              int priority,
                              double costPerKToken,
                              Duration perCallTimeout,
                              ModelProvider provider) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.endpoint = endpoint == null ? "" : endpoint;
        this.provider = Objects.requireNonNull(provider, "provider");
        this.perCallTimeout = Objects.requireNonNull(perCallTimeout, "perCallTimeout");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (!id.equals(provider.id())) {
            throw new IllegalArgumentException(
                    "Provider id mismatch: descriptor=" + id + ", provider=" + provider.id());
        }
        if (priority < 0) {
            throw new IllegalArgumentException("priority must be >= 0, got: " + priority);
        }
        if (costPerKToken < 0.0) {
            throw new IllegalArgumentException("costPerKToken must be >= 0, got: " + costPerKToken);
        }
        if (perCallTimeout.isZero() || perCallTimeout.isNegative()) {
            throw new IllegalArgumentException("perCallTimeout must be positive, got: " + perCallTimeout);
        }
        this.priority = priority;
        this.costPerKToken = costPerKToken;
    }

    public String id() {
        return id;
    }

    public ProviderKind kind() {
        return kind;
    }

    public String endpoint() {
        return endpoint;
    }

    public int priority() {
        return priority;
    }

    public double costPerKToken() {
        return costPerKToken;
    }

    public Duration perCallTimeout() {
        return perCallTimeout;
    }

    public ModelProvider provider() {
        return provider;
    }

    public HealthState healthState() {
        return healthState;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    public Instant lastProbeAt() {
        return lastProbeAt;
    }

    /**
     * Cost of a call with the given usage. Local providers are always free.
     */
    public double costFor(int tokensIn, int tokensOut) {
        if (kind == ProviderKind.LOCAL) {
            return 0.0;
        }
        return (tokensIn + tokensOut) / 1000.0 * costPerKToken;
    }

    public ProviderStatus snapshot() {
        return new ProviderStatus(id, kind, endpoint, priority, costPerKToken,
                healthState, consecutiveFailures, lastProbeAt);
    }

    @Override
    public String toString() {
        return "ProviderDescriptor[" + id + ", " + kind + ", priority=" + priority + ", " + healthState + "]";
    }

    // --- registry and health monitor access ---

    long registrationSequence() {
        return registrationSequence;
    }

    void assignRegistrationSequence(long sequence) {
        if (registrationSequence >= 0) {
            throw new IllegalStateException("Provider already registered: " + id);
        }
        this.registrationSequence = sequence;
    }

    ReentrantLock lock() {
        return lock;
    }

    void setHealthState(HealthState state) {
        this.healthState = state;
    }

    void setConsecutiveFailures(int failures) {
        this.consecutiveFailures = failures;
    }

    int consecutiveProbeSuccesses() {
        return consecutiveProbeSuccesses;
    }

    void setConsecutiveProbeSuccesses(int successes) {
        this.consecutiveProbeSuccesses = successes;
    }

    void setLastProbeAt(Instant at) {
        this.lastProbeAt = at;
    }

    Instant nextProbeAt() {
        return nextProbeAt;
    }

    void setNextProbeAt(Instant at) {
        this.nextProbeAt = at;
    }
}
