package com.phillippitts.enginecoordinator.service.creative;

import java.time.Duration;

/**
 * Produces one draft candidate for a prompt.
 */
@FunctionalInterface
public interface CandidateSource {

    /**
     * @param prompt  creative prompt
     * @param index   zero-based draft number, lets sources vary their approach
     * @param timeout time available for this draft
     * @return draft text with the provider and cost behind it
     */
    Draft draft(String prompt, int index, Duration timeout) throws Exception;
}
