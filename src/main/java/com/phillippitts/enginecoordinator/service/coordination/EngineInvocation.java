package com.phillippitts.enginecoordinator.service.coordination;

import java.time.Duration;

/**
 * Body of an engine call.
 */
@FunctionalInterface
public interface EngineInvocation {

    /**
     * @param budget     time carved for this call
     * @param dependency output of the call this one depends on; null when there is none or it failed
     */
    EngineValue invoke(Duration budget, EngineValue dependency) throws Exception;
}
