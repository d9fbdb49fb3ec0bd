package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.domain.EngineError;

import java.util.List;

/**
 * What one engine call produced.
 *
 * @param value      engine output; null when the engine produced nothing usable
 * @param degraded   output is partial or flagged
 * @param providerId provider that served an LLM call, else null
 * @param cost       cost incurred by the call
 * @param issues     non-fatal problems, or the reason there is no value
 */
public record EngineValue(Object value, boolean degraded, String providerId, double cost, List<EngineError> issues) {

    public EngineValue {
        issues = issues == null ? List.of() : List.copyOf(issues);
        if (value == null && issues.isEmpty()) {
            throw new IllegalArgumentException("An engine value without output must carry an issue");
        }
    }

    public static EngineValue of(Object value) {
        return new EngineValue(value, false, null, 0.0, List.of());
    }

    /** No usable output. */
    public static EngineValue absent(EngineError reason) {
        return new EngineValue(null, false, null, 0.0, List.of(reason));
    }

    public boolean hasValue() {
        return value != null;
    }
}
