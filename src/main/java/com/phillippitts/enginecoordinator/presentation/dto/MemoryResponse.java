package com.phillippitts.enginecoordinator.presentation.dto;

import java.time.Instant;

/**
 * Acknowledgement of a stored memory.
 */
public record MemoryResponse(String id, int storedEntries, Instant storedAt) {}
