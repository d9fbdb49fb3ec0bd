package com.phillippitts.enginecoordinator.service.recall;

import java.time.Duration;
import java.util.Arrays;

/**
 * Retrieval request. Exactly one of {@code key} and {@code vector} is used; the vector wins when
 * both are present.
 *
 * @param key           text query, embedded by the backend
 * @param vector        pre-computed query embedding
 * @param topK          maximum number of hits
 * @param latencyBudget time the caller is willing to wait; null for the store default
 */
public record RecallQuery(String key, float[] vector, int topK, Duration latencyBudget) {

    public RecallQuery {
        boolean hasKey = key != null && !key.isBlank();
        if (!hasKey && (vector == null || vector.length == 0)) {
            throw new IllegalArgumentException("Recall query needs a key or a vector");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        if (latencyBudget != null && (latencyBudget.isNegative() || latencyBudget.isZero())) {
            throw new IllegalArgumentException("latencyBudget must be positive: " + latencyBudget);
        }
    }

    public static RecallQuery byKey(String key, int topK, Duration latencyBudget) {
        return new RecallQuery(key, null, topK, latencyBudget);
    }

    RecallQuery withBudget(Duration budget) {
        return new RecallQuery(key, vector, topK, budget);
    }

    /** Cache key; the budget is not part of it. */
    String cacheKey() {
        if (vector != null && vector.length > 0) {
            return "v:" + Arrays.toString(vector) + ":" + topK;
        }
        return "k:" + key.trim() + ":" + topK;
    }
}
