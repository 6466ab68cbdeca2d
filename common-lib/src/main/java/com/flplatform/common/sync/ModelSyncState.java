package com.flplatform.common.sync;

import com.flplatform.common.model.GlobalModel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of {@link ModelSynchronizer} state. Holding it never observes later
 * changes.
 *
 * @param currentModel  {@code null} before the first adopted model
 * @param lastSyncTime  {@code null} before the first adopted model
 */
public record ModelSyncState(
    String nodeId,
    int modelVersion,
    GlobalModel currentModel,
    Map<String, Integer> nodeVersions,
    SyncStatus syncStatus,
    Instant lastSyncTime,
    List<ModelConflict> conflictLog
) {

    public ModelSyncState {
        nodeVersions = Map.copyOf(nodeVersions);
        conflictLog = List.copyOf(conflictLog);
    }
}
