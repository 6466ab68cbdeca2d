package com.flplatform.common.sync;

import com.flplatform.common.exception.AggregationException;

import java.util.Locale;

/**
 * How {@link ModelSynchronizer#resolveConflicts} settles a conflict.
 * {@link #MERGE} is recognised but unsupported and always fails.
 */
public enum ResolutionStrategy {
    PREFER_GLOBAL,
    PREFER_LOCAL,
    MERGE;

    public static ResolutionStrategy fromName(String name) {
        if (name == null) {
            return PREFER_GLOBAL;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AggregationException("ResolutionStrategy", "Unknown resolution strategy: " + name, e);
        }
    }
}
