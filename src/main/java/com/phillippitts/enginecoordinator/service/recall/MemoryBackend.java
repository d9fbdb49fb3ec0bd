package com.phillippitts.enginecoordinator.service.recall;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Storage behind the {@link RecallStore}.
 *
 * <p>{@link #search} streams candidate hits into the sink as it finds them, in any order, so
 * that a caller whose budget runs out can keep what was found so far. Implementations must
 * honour thread interruption.
 */
public interface MemoryBackend {

    void search(RecallQuery query, Consumer<RecallHit> sink) throws InterruptedException;

    /**
     * Stores a memory and returns the stored entry. Re-inserting an id replaces the old entry.
     */
    MemoryEntry insert(String id, String content, Map<String, String> metadata);

    int size();
}
