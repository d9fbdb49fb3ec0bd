package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.domain.EngineType;

import java.time.Duration;
import java.util.Objects;

/**
 * One engine invocation of a dispatch plan.
 *
 * @param engine         engine being called
 * @param mandatory      the task fails when this call produces no value
 * @param defaultTimeout engine's own budget, clipped by the remaining global budget
 * @param dependsOn      engine whose output this call waits for; null when independent
 * @param invocation     call body
 */
public record EngineCall(
        EngineType engine,
        boolean mandatory,
        Duration defaultTimeout,
        EngineType dependsOn,
        EngineInvocation invocation
) {

    public EngineCall {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(invocation, "invocation");
        if (engine == dependsOn) {
            throw new IllegalArgumentException("Engine call cannot depend on itself: " + engine);
        }
    }

    static EngineCall mandatory(EngineType engine, Duration timeout, EngineInvocation invocation) {
        return new EngineCall(engine, true, timeout, null, invocation);
    }

    static EngineCall optional(EngineType engine, Duration timeout, EngineInvocation invocation) {
        return new EngineCall(engine, false, timeout, null, invocation);
    }
}
