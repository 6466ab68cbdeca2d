package com.flplatform.common.sync;

import com.flplatform.common.model.GlobalModel;

/**
 * Outcome of {@link ModelSynchronizer#resolveConflicts}.
 *
 * @param resolvedModel     the model the synchronizer holds afterwards
 * @param conflictsResolved number of conflicts settled
 */
public record ConflictResolution(
    ResolutionStrategy strategy,
    GlobalModel resolvedModel,
    int conflictsResolved
) {}
