package com.phillippitts.enginecoordinator.service.cost;

import com.phillippitts.enginecoordinator.service.provider.ProviderKind;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only audit and cost ledger of provider calls.
 *
 * <p>Writes are serialized per provider: each provider has its own lock and record list, so
 * concurrent calls to different providers never contend and no append is ever observed half done.
 * Cloud spend is also accumulated per UTC day for the daily budget guard.
 */
public class UsageLedger {

    private final ConcurrentMap<String, ProviderEntries> byProvider = new ConcurrentHashMap<>();
    private final ConcurrentMap<LocalDate, DoubleAdder> cloudSpendByDay = new ConcurrentHashMap<>();

    /**
     * Appends a record. Records are never modified or removed afterwards.
     */
    public void append(UsageRecord record) {
        Objects.requireNonNull(record, "record");
        ProviderEntries entries = byProvider.computeIfAbsent(record.providerId(), id -> new ProviderEntries());
        entries.lock.lock();
        try {
            entries.records.add(record);
            if (record.kind() == ProviderKind.CLOUD && record.cost() > 0.0) {
                LocalDate day = LocalDate.ofInstant(record.timestamp(), ZoneOffset.UTC);
                cloudSpendByDay.computeIfAbsent(day, d -> new DoubleAdder()).add(record.cost());
            }
        } finally {
            entries.lock.unlock();
        }
    }

    /** Records of one provider, in append order. */
    public List<UsageRecord> records(String providerId) {
        ProviderEntries entries = byProvider.get(providerId);
        if (entries == null) {
            return List.of();
        }
        entries.lock.lock();
        try {
            return List.copyOf(entries.records);
        } finally {
            entries.lock.unlock();
        }
    }

    /** All records across providers, ordered by timestamp. */
    public List<UsageRecord> allRecords() {
        List<UsageRecord> all = new ArrayList<>();
        for (String providerId : byProvider.keySet()) {
            all.addAll(records(providerId));
        }
        all.sort(Comparator.comparing(UsageRecord::timestamp));
        return all;
    }

    public double totalCost() {
        return allRecords().stream().mapToDouble(UsageRecord::cost).sum();
    }

    /** Cloud spend recorded for the given UTC day. */
    public double cloudSpendOn(LocalDate day) {
        DoubleAdder adder = cloudSpendByDay.get(day);
        return adder == null ? 0.0 : adder.sum();
    }

    /**
     * Summarizes the ledger.
     *
     * @param today                 UTC day the budget applies to
     * @param dailyCloudBudget      daily cloud budget, 0 for unlimited
     * @param baselineCostPerKToken premium price local tokens are compared against
     */
    public CostSummary summary(LocalDate today, double dailyCloudBudget, double baselineCostPerKToken) {
        List<UsageRecord> all = allRecords();
        double total = 0.0;
        long local = 0;
        long cloud = 0;
        long failed = 0;
        long localTokens = 0;
        for (UsageRecord r : all) {
            total += r.cost();
            if (!r.success()) {
                failed++;
            } else if (r.kind() == ProviderKind.LOCAL) {
                local++;
                localTokens += r.totalTokens();
            } else {
                cloud++;
            }
        }
        long served = local + cloud;
        double localRatio = served == 0 ? 0.0 : (double) local / served;
        double spentToday = cloudSpendOn(today);
        double remaining = dailyCloudBudget > 0.0 ? Math.max(0.0, dailyCloudBudget - spentToday) : 0.0;
        double savings = localTokens / 1000.0 * baselineCostPerKToken;
        return new CostSummary(total, local, cloud, failed, localRatio, spentToday,
                dailyCloudBudget, remaining, savings);
    }

    private static final class ProviderEntries {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<UsageRecord> records = new ArrayList<>();
    }
}
