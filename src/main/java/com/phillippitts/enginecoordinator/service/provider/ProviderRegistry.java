package com.phillippitts.enginecoordinator.service.provider;

import com.phillippitts.enginecoordinator.service.cost.UsageLedger;
import com.phillippitts.enginecoordinator.service.cost.UsageRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ordered catalogue of providers.
 *
 * <p>Resolution order is a total order: ascending priority, then the configured {@link TieBreak}.
 * Registration is rare and rebuilds an immutable ordered snapshot, so {@link #listByPriority()}
 * never locks on the request path.
 */
public class ProviderRegistry {

    private static final Logger LOG = LogManager.getLogger(ProviderRegistry.class);

    /** Rule applied between providers that share a priority. */
    public enum TieBreak { REGISTRATION_ORDER, LOWEST_COST }

    private final Map<String, ProviderDescriptor> byId = new ConcurrentHashMap<>();
    private final Comparator<ProviderDescriptor> order;
    private final UsageLedger ledger;
    private final Object registrationLock = new Object();

    private long nextSequence;
    private volatile List<ProviderDescriptor> ordered = List.of();

    public ProviderRegistry(UsageLedger ledger, TieBreak tieBreak) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.order = comparatorFor(Objects.requireNonNull(tieBreak, "tieBreak"));
    }

    /**
     * Adds a provider to the catalogue.
     *
     * @throws IllegalArgumentException if a provider with the same id is already registered
     */
    public void register(ProviderDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        synchronized (registrationLock) {
            if (byId.containsKey(descriptor.id())) {
                throw new IllegalArgumentException("Provider already registered: " + descriptor.id());
            }
            descriptor.assignRegistrationSequence(nextSequence++);
            byId.put(descriptor.id(), descriptor);
            List<ProviderDescriptor> rebuilt = new ArrayList<>(byId.values());
            rebuilt.sort(order);
            ordered = List.copyOf(rebuilt);
        }
        LOG.info("Registered provider id={}, kind={}, priority={}, costPerKToken={}, timeout={}ms",
                descriptor.id(), descriptor.kind(), descriptor.priority(),
                descriptor.costPerKToken(), descriptor.perCallTimeout().toMillis());
    }

    /** Providers in resolution order, including unhealthy ones. */
    public List<ProviderDescriptor> listByPriority() {
        return ordered;
    }

    public Optional<ProviderDescriptor> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Looks up a registered provider.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public ProviderDescriptor get(String id) {
        ProviderDescriptor d = byId.get(id);
        if (d == null) {
            throw new IllegalArgumentException("Unknown provider: " + id);
        }
        return d;
    }

    /** Appends a usage record to the cost ledger. */
    public void recordUsage(UsageRecord record) {
        ledger.append(record);
    }

    public UsageLedger ledger() {
        return ledger;
    }

    public List<ProviderStatus> statuses() {
        return ordered.stream().map(ProviderDescriptor::snapshot).toList();
    }

    public int size() {
        return byId.size();
    }

    private static Comparator<ProviderDescriptor> comparatorFor(TieBreak tieBreak) {
        Comparator<ProviderDescriptor> byPriority = Comparator.comparingInt(ProviderDescriptor::priority);
        Comparator<ProviderDescriptor> bySequence = Comparator.comparingLong(ProviderDescriptor::registrationSequence);
        return switch (tieBreak) {
            case REGISTRATION_ORDER -> byPriority.thenComparing(bySequence);
            case LOWEST_COST -> byPriority
                    .thenComparingDouble(ProviderDescriptor::costPerKToken)
                    .thenComparing(bySequence);
        };
    }
}
