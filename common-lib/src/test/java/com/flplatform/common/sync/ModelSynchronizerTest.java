package com.flplatform.common.sync;

import com.flplatform.common.exception.AggregationException;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ModelSynchronizerTest {

    private ModelSynchronizer sync;

    @BeforeEach
    void setUp() {
        sync = new ModelSynchronizer("node-1", 3);
    }

    private static GlobalModel model(int version, GlobalModel previous) {
        return new GlobalModel(version, version, ModelWeights.flat(version, version * 2.0), 2, 20L,
            "fedavg", 0.5, 0.6, null, GlobalModel.chainHash(previous), null);
    }

    /** Chain of models v1..vN, each linked to its predecessor. */
    private static List<GlobalModel> chain(int n) {
        List<GlobalModel> models = new ArrayList<>();
        GlobalModel previous = null;
        for (int v = 1; v <= n; v++) {
            previous = model(v, previous);
            models.add(previous);
        }
        return models;
    }

    // ── receive ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("receiveGlobalModel()")
    class ReceiveTests {

        @Test
        @DisplayName("starts PENDING at version 0, first valid model becomes ACTIVE")
        void firstModel() {
            assertEquals(SyncStatus.PENDING, sync.getSyncStatus());
            assertEquals(0, sync.getModelVersion());

            assertTrue(sync.receiveGlobalModel(model(1, null), "coordinator"));

            assertEquals(SyncStatus.ACTIVE, sync.getSyncStatus());
            assertEquals(1, sync.getModelVersion());
            assertNotNull(sync.getState().lastSyncTime());
        }

        @Test
        @DisplayName("stale or equal version is rejected and state is unchanged")
        void stale() {
            List<GlobalModel> models = chain(2);
            sync.receiveGlobalModel(models.get(1), "coordinator");

            assertFalse(sync.receiveGlobalModel(models.get(0), "peer"));
            assertFalse(sync.receiveGlobalModel(model(2, null), "peer"));
            assertSame(models.get(1), sync.getCurrentModel());
        }

        @Test
        @DisplayName("tampered hash, missing weights, negative version or null are rejected")
        void integrity() {
            GlobalModel good = model(1, null);
            GlobalModel tampered = new GlobalModel(1, 1, good.weights(), 2, 20L, "fedavg",
                0.0, 0.0, "deadbeef", "", null);
            GlobalModel noWeights = new GlobalModel(1, 1, null, 0, 0L, "fedavg", 0.0, 0.0, "x", "", null);
            GlobalModel negative = new GlobalModel(-1, 1, good.weights(), 0, 0L, "fedavg", 0.0, 0.0, null, "", null);

            assertFalse(sync.receiveGlobalModel(tampered, "peer"));
            assertFalse(sync.receiveGlobalModel(noWeights, "peer"));
            assertFalse(sync.receiveGlobalModel(negative, "peer"));
            assertFalse(sync.receiveGlobalModel(null, "peer"));
            assertNull(sync.getCurrentModel());
            assertEquals(SyncStatus.PENDING, sync.getSyncStatus());
        }
    }

    // ── history and rollback ─────────────────────────────────────────────────

    @Nested
    @DisplayName("history and rollback()")
    class RollbackTests {

        @Test
        @DisplayName("history keeps the most recent replaced models only")
        void historyCap() {
            chain(6).forEach(m -> sync.receiveGlobalModel(m, "coordinator"));

            assertEquals(6, sync.getModelVersion());
            assertEquals(List.of(3, 4, 5), sync.getHistoryVersions());
        }

        @Test
        @DisplayName("rollback restores an exact retained version and drops the newer lineage")
        void rollback() {
            chain(4).forEach(m -> sync.receiveGlobalModel(m, "coordinator"));

            assertTrue(sync.rollback(2));

            assertEquals(2, sync.getModelVersion());
            assertEquals(SyncStatus.ACTIVE, sync.getSyncStatus());
            assertEquals(List.of(1), sync.getHistoryVersions());
            assertTrue(sync.verifyHistoryChain().valid());
        }

        @Test
        @DisplayName("rounds after a rollback extend the restored lineage")
        void roundsAfterRollback() {
            ModelSynchronizer wide = new ModelSynchronizer("node-1", 10);
            List<GlobalModel> original = chain(4);
            original.forEach(m -> wide.receiveGlobalModel(m, "coordinator"));
            assertTrue(wide.rollback(2));

            GlobalModel v3 = new GlobalModel(3, 5, ModelWeights.flat(30.0, 30.0), 2, 20L, "fedavg",
                0.0, 0.0, null, original.get(1).weightsHash(), null);
            GlobalModel v4 = new GlobalModel(4, 6, ModelWeights.flat(40.0, 40.0), 2, 20L, "fedavg",
                0.0, 0.0, null, v3.weightsHash(), null);
            assertTrue(wide.receiveGlobalModel(v3, "coordinator"));
            assertTrue(wide.receiveGlobalModel(v4, "coordinator"));

            assertEquals(List.of(1, 2, 3), wide.getHistoryVersions());
            ChainVerification verification = wide.verifyHistoryChain();
            assertTrue(verification.valid(), () -> verification.failures().toString());
            assertEquals(4, verification.checkedModels());

            assertTrue(wide.rollback(3));
            assertSame(v3, wide.getCurrentModel());
            assertArrayEquals(new double[]{30.0, 30.0}, wide.getCurrentModel().weights().toFlatVector(), 0.0);
        }

        @Test
        @DisplayName("rollback to an evicted or unknown version fails without change")
        void rollbackMissing() {
            chain(6).forEach(m -> sync.receiveGlobalModel(m, "coordinator"));

            assertFalse(sync.rollback(1));
            assertFalse(sync.rollback(6));
            assertEquals(6, sync.getModelVersion());
        }
    }

    // ── conflicts ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("checkForConflicts() and resolveConflicts()")
    class ConflictTests {

        @Test
        @DisplayName("identical models produce no conflicts")
        void none() {
            GlobalModel m = model(1, null);
            assertTrue(sync.checkForConflicts(m, m).isEmpty());
            assertTrue(sync.checkForConflicts(null, m).isEmpty());
        }

        @Test
        @DisplayName("version mismatch is MEDIUM, round mismatch HIGH")
        void versionAndRound() {
            List<ModelConflict> conflicts = sync.checkForConflicts(model(1, null), model(2, null));

            assertEquals(2, conflicts.size());
            assertEquals(ConflictType.VERSION_MISMATCH, conflicts.get(0).type());
            assertEquals(ConflictSeverity.MEDIUM, conflicts.get(0).severity());
            assertEquals(ConflictType.ROUND_MISMATCH, conflicts.get(1).type());
            assertEquals(ConflictSeverity.HIGH, conflicts.get(1).severity());
            assertEquals(2, sync.getConflictLog().size());
        }

        @Test
        @DisplayName("different weights under the same version are CRITICAL")
        void hashMismatch() {
            GlobalModel local = model(3, null);
            GlobalModel global = new GlobalModel(3, 3, ModelWeights.flat(9.0, 9.0), 2, 20L, "fedavg",
                0.0, 0.0, null, "", null);

            List<ModelConflict> conflicts = sync.checkForConflicts(local, global);

            assertEquals(1, conflicts.size());
            assertEquals(ConflictType.WEIGHT_HASH_MISMATCH, conflicts.get(0).type());
            assertEquals(ConflictSeverity.CRITICAL, conflicts.get(0).severity());
        }

        @Test
        @DisplayName("PREFER_GLOBAL adopts the global model even at a lower version")
        void preferGlobal() {
            List<GlobalModel> models = chain(3);
            sync.receiveGlobalModel(models.get(2), "self");
            List<ModelConflict> conflicts = sync.checkForConflicts(models.get(2), models.get(1));

            ConflictResolution resolution = sync.resolveConflicts(conflicts, ResolutionStrategy.PREFER_GLOBAL,
                models.get(2), models.get(1));

            assertEquals(conflicts.size(), resolution.conflictsResolved());
            assertSame(models.get(1), resolution.resolvedModel());
            assertEquals(2, sync.getModelVersion());
            assertTrue(sync.getHistoryVersions().isEmpty());
        }

        @Test
        @DisplayName("PREFER_LOCAL keeps the current model")
        void preferLocal() {
            List<GlobalModel> models = chain(2);
            sync.receiveGlobalModel(models.get(0), "self");
            List<ModelConflict> conflicts = sync.checkForConflicts(models.get(0), models.get(1));

            ConflictResolution resolution = sync.resolveConflicts(conflicts, ResolutionStrategy.PREFER_LOCAL,
                models.get(0), models.get(1));

            assertSame(models.get(0), resolution.resolvedModel());
            assertEquals(1, sync.getModelVersion());
        }

        @Test
        @DisplayName("MERGE is unsupported, and strategy names parse case-insensitively")
        void merge() {
            List<GlobalModel> models = chain(2);
            List<ModelConflict> conflicts = sync.checkForConflicts(models.get(0), models.get(1));

            assertThrows(AggregationException.class, () -> sync.resolveConflicts(conflicts,
                ResolutionStrategy.MERGE, models.get(0), models.get(1)));
            assertEquals(ResolutionStrategy.PREFER_LOCAL, ResolutionStrategy.fromName("Prefer_Local"));
            assertEquals(ResolutionStrategy.PREFER_GLOBAL, ResolutionStrategy.fromName(null));
            assertThrows(AggregationException.class, () -> ResolutionStrategy.fromName("vote"));
        }

        @Test
        @DisplayName("PREFER_GLOBAL with a tampered global model throws")
        void preferTamperedGlobal() {
            GlobalModel local = model(1, null);
            GlobalModel tampered = new GlobalModel(2, 2, ModelWeights.flat(1.0), 1, 1L, "fedavg",
                0.0, 0.0, "bad", "", null);
            List<ModelConflict> conflicts = sync.checkForConflicts(local, tampered);

            assertThrows(AggregationException.class, () -> sync.resolveConflicts(conflicts,
                ResolutionStrategy.PREFER_GLOBAL, local, tampered));
        }
    }

    // ── node tracking ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("node tracking and status")
    class NodeTests {

        @Test
        @DisplayName("outdated nodes are those behind the current version")
        void outdated() {
            chain(3).forEach(m -> sync.receiveGlobalModel(m, "coordinator"));
            sync.recordNodeVersion("a", 3);
            sync.recordNodeVersion("b", 1);
            sync.recordNodeVersion("c", 2);

            assertEquals(List.of("b", "c"), sync.getOutdatedNodes());
        }

        @Test
        @DisplayName("DISTRIBUTING returns to ACTIVE once every tracked node caught up")
        void distribution() {
            assertFalse(sync.beginDistribution());
            chain(2).forEach(m -> sync.receiveGlobalModel(m, "coordinator"));
            sync.recordNodeVersion("a", 1);

            assertTrue(sync.beginDistribution());
            assertEquals(SyncStatus.DISTRIBUTING, sync.getSyncStatus());

            sync.recordNodeVersion("a", 2);
            assertEquals(SyncStatus.ACTIVE, sync.getSyncStatus());
        }

        @Test
        @DisplayName("deprecate marks the model DEPRECATED, a newer model reactivates")
        void deprecate() {
            assertFalse(sync.deprecate());
            List<GlobalModel> models = chain(2);
            sync.receiveGlobalModel(models.get(0), "coordinator");

            assertTrue(sync.deprecate());
            assertEquals(SyncStatus.DEPRECATED, sync.getSyncStatus());
            assertEquals("deprecated", SyncStatus.DEPRECATED.wireName());

            sync.receiveGlobalModel(models.get(1), "coordinator");
            assertEquals(SyncStatus.ACTIVE, sync.getSyncStatus());
        }

        @Test
        @DisplayName("state snapshot does not observe later changes")
        void snapshot() {
            sync.receiveGlobalModel(model(1, null), "coordinator");
            sync.recordNodeVersion("a", 1);
            ModelSyncState state = sync.getState();

            sync.recordNodeVersion("b", 0);

            assertEquals("node-1", state.nodeId());
            assertEquals(1, state.modelVersion());
            assertEquals(1, state.nodeVersions().size());
        }
    }

    // ── chain verification ───────────────────────────────────────────────────

    @Nested
    @DisplayName("verifyHistoryChain()")
    class ChainTests {

        @Test
        @DisplayName("a properly linked chain verifies")
        void valid() {
            chain(3).forEach(m -> sync.receiveGlobalModel(m, "coordinator"));

            ChainVerification verification = sync.verifyHistoryChain();

            assertTrue(verification.valid());
            assertEquals(3, verification.checkedModels());
        }

        @Test
        @DisplayName("a model not linked to its predecessor is reported")
        void brokenLink() {
            GlobalModel v1 = model(1, null);
            sync.receiveGlobalModel(v1, "coordinator");
            sync.receiveGlobalModel(model(2, null), "coordinator");

            ChainVerification verification = sync.verifyHistoryChain();

            assertFalse(verification.valid());
            assertEquals(1, verification.failures().size());
            assertTrue(verification.failures().get(0).startsWith("version 2"));
        }
    }

    @Test
    @DisplayName("concurrent receives end on the highest version with no lost history")
    void concurrentReceive() throws Exception {
        ModelSynchronizer wide = new ModelSynchronizer("node-1", 100);
        List<GlobalModel> models = chain(50);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (GlobalModel m : models) {
                pool.submit(() -> {
                    start.await();
                    return wide.receiveGlobalModel(m, "peer");
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(50, wide.getModelVersion());
        List<Integer> history = wide.getHistoryVersions();
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i) > history.get(i - 1), "history must be strictly increasing");
        }
    }
}
