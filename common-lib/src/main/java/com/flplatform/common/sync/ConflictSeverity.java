package com.flplatform.common.sync;

/** Ordered from least to most severe. */
public enum ConflictSeverity {
    MEDIUM,
    HIGH,
    CRITICAL
}
