package com.phillippitts.enginecoordinator.service.cost;

import com.phillippitts.enginecoordinator.service.provider.ProviderKind;

import java.time.Instant;
import java.util.Objects;

/**
 * One provider call as written to the cost ledger. Immutable once appended.
 *
 * @param providerId provider that served (or failed) the call
 * @param kind       provider kind, kept so the ledger can split local from cloud spend
 * @param tokensIn   prompt tokens
 * @param tokensOut  completion tokens
 * @param cost       charged cost; always 0 for local providers and failed calls
 * @param latencyMs  call latency
 * @param success    whether the call produced a response
 * @param timestamp  completion time of the call
 */
public record UsageRecord(
        String providerId,
        ProviderKind kind,
        int tokensIn,
        int tokensOut,
        double cost,
        long latencyMs,
        boolean success,
        Instant timestamp
) {

    public UsageRecord {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        if (tokensIn < 0 || tokensOut < 0) {
            throw new IllegalArgumentException("token counts must be >= 0");
        }
        if (cost < 0.0) {
            throw new IllegalArgumentException("cost must be >= 0, got: " + cost);
        }
    }

    public static UsageRecord success(String providerId, ProviderKind kind, int tokensIn, int tokensOut,
                                      double cost, long latencyMs, Instant at) {
        return new UsageRecord(providerId, kind, tokensIn, tokensOut, cost, latencyMs, true, at);
    }

    public static UsageRecord failure(String providerId, ProviderKind kind, long latencyMs, Instant at) {
        return new UsageRecord(providerId, kind, 0, 0, 0.0, latencyMs, false, at);
    }

    public int totalTokens() {
        return tokensIn + tokensOut;
    }
}
