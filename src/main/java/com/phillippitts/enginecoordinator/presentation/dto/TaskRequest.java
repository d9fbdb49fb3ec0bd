package com.phillippitts.enginecoordinator.presentation.dto;

import com.phillippitts.enginecoordinator.domain.CompletionPayload;
import com.phillippitts.enginecoordinator.domain.CompositePayload;
import com.phillippitts.enginecoordinator.domain.CreativePayload;
import com.phillippitts.enginecoordinator.domain.ParallelPayload;
import com.phillippitts.enginecoordinator.domain.RecallPayload;
import com.phillippitts.enginecoordinator.domain.Task;
import com.phillippitts.enginecoordinator.domain.TaskKind;
import com.phillippitts.enginecoordinator.domain.TaskPayload;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Wire form of an inbound task. Only the fields the chosen kind needs are read.
 *
 * @param taskKind     completion, recall, parallel, creative or composite
 * @param prompt       prompt for completion, creative and composite tasks
 * @param query        recall key; falls back to {@code prompt} when absent
 * @param topK         recall hits; null for the configured default
 * @param count        creative candidates; for composite tasks, 0 disables the creative engine
 * @param prompts      parallel prompts, or composite sub-prompts
 * @param deadlineMs   caller budget in milliseconds; null for the coordinator default
 * @param priorityHint informational priority hint
 * @param maxTokens    completion token cap; null lets the provider decide
 */
public record TaskRequest(
        @NotBlank(message = "taskKind is required") String taskKind,
        String prompt,
        String query,
        @Min(value = 1, message = "topK must be >= 1") Integer topK,
        @PositiveOrZero(message = "count must be >= 0") Integer count,
        List<String> prompts,
        @Min(value = 1, message = "deadlineMs must be >= 1") Long deadlineMs,
        Integer priorityHint,
        @PositiveOrZero(message = "maxTokens must be >= 0") Integer maxTokens
) {

    /**
     * Builds the domain task.
     *
     * @param defaultTopK       used when {@code topK} is absent
     * @param defaultCreative   used when a creative task gives no {@code count}
     * @throws IllegalArgumentException if the kind is unknown or a required field is missing
     */
    public Task toTask(int defaultTopK, int defaultCreative) {
        TaskKind kind = TaskKind.fromWire(taskKind);
        int k = topK == null ? defaultTopK : topK;
        TaskPayload payload = switch (kind) {
            case COMPLETION -> new CompletionPayload(required(prompt, "prompt"), maxTokens == null ? 0 : maxTokens);
            case RECALL -> new RecallPayload(query != null && !query.isBlank() ? query : prompt, null, k);
            case PARALLEL -> new ParallelPayload(prompts);
            case CREATIVE -> new CreativePayload(required(prompt, "prompt"), count == null ? defaultCreative : count);
            case COMPOSITE -> new CompositePayload(required(prompt, "prompt"), k,
                    count == null ? 0 : count, prompts);
        };
        Duration deadline = deadlineMs == null ? null : Duration.ofMillis(deadlineMs);
        return new Task(UUID.randomUUID().toString(), payload, deadline, Instant.now(),
                priorityHint == null ? 0 : priorityHint);
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
