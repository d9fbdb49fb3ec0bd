package com.phillippitts.enginecoordinator.service.recall;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Stored memory.
 *
 * @param id       caller-supplied identifier
 * @param content  text returned as the hit payload
 * @param metadata free-form attributes
 * @param vector   embedding of the content
 * @param sequence insertion order assigned by the backend; higher is more recent
 * @param storedAt insertion time
 */
public record MemoryEntry(
        String id,
        String content,
        Map<String, String> metadata,
        float[] vector,
        long sequence,
        Instant storedAt
) {

    public MemoryEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(vector, "vector");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        storedAt = storedAt == null ? Instant.now() : storedAt;
    }
}
