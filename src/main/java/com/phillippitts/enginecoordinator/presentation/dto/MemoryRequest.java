package com.phillippitts.enginecoordinator.presentation.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Memory to store in the recall backend.
 *
 * @param id       entry id; generated when absent
 * @param content  text to embed and store
 * @param metadata optional string metadata
 */
public record MemoryRequest(
        String id,
        @NotBlank(message = "content is required") String content,
        Map<String, String> metadata
) {}
