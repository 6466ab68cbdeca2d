package com.flplatform.common.sync;

import java.time.Instant;

/**
 * One difference between a local and a global model.
 *
 * @param localValue  the local side, rendered as text
 * @param globalValue the global side, rendered as text
 */
public record ModelConflict(
    ConflictType type,
    ConflictSeverity severity,
    String localValue,
    String globalValue,
    String description,
    Instant detectedAt
) {}
