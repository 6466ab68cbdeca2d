package com.flplatform.common.sync;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of the synchronizer's current model.
 *
 * <pre>
 *   PENDING ──receive──▶ ACTIVE ──beginDistribution──▶ DISTRIBUTING
 *                          ▲                                │
 *                          └──── all nodes caught up ◀──────┘
 *   any state with a model ──deprecate──▶ DEPRECATED ──receive──▶ ACTIVE
 * </pre>
 */
public enum SyncStatus {
    PENDING,
    DISTRIBUTING,
    ACTIVE,
    DEPRECATED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
