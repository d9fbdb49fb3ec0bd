package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.domain.EngineType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Engine calls for one task, in submission order. Each engine appears at most once and a call
 * may only depend on an earlier one.
 */
public record DispatchPlan(List<EngineCall> calls) {

    public DispatchPlan {
        if (calls == null || calls.isEmpty()) {
            throw new IllegalArgumentException("A dispatch plan needs at least one call");
        }
        calls = List.copyOf(calls);
        Set<EngineType> seen = EnumSet.noneOf(EngineType.class);
        for (EngineCall call : calls) {
            if (call.dependsOn() != null && !seen.contains(call.dependsOn())) {
                throw new IllegalArgumentException(call.engine() + " depends on " + call.dependsOn()
                        + ", which is not planned before it");
            }
            if (!seen.add(call.engine())) {
                throw new IllegalArgumentException("Engine planned twice: " + call.engine());
            }
        }
    }

    public boolean hasMandatory() {
        return calls.stream().anyMatch(EngineCall::mandatory);
    }
}
