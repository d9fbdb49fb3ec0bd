package com.phillippitts.enginecoordinator.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One inbound unit of work. Lives from request arrival until its {@link CoordinationResult} is
 * emitted.
 *
 * @param id           unique task id
 * @param payload      kind-specific payload
 * @param deadline     caller budget measured from {@code createdAt}; null means the coordinator default
 * @param createdAt    arrival time
 * @param priorityHint caller hint, higher is more urgent; informational only
 */
public record Task(
        String id,
        TaskPayload payload,
        Duration deadline,
        Instant createdAt,
        int priorityHint
) {

    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be positive, got: " + deadline);
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Creates a task with a random id, created now.
     */
    public static Task of(TaskPayload payload, Duration deadline) {
        return new Task(UUID.randomUUID().toString(), payload, deadline, Instant.now(), 0);
    }

    public TaskKind kind() {
        return payload.kind();
    }
}
