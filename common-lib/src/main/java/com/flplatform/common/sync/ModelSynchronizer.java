package com.flplatform.common.sync;

import com.flplatform.common.exception.AggregationException;
import com.flplatform.common.model.GlobalModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-writer holder of a node's current {@link GlobalModel}.
 *
 * <p>Every mutation ({@link #receiveGlobalModel}, {@link #resolveConflicts}, {@link #rollback},
 * node-version tracking and status transitions) runs under one per-instance lock. Models
 * are immutable records, so readers always get a snapshot.
 *
 * <p>Replaced models are kept in a bounded history (oldest evicted first) which backs
 * {@link #rollback(int)} and {@link #verifyHistoryChain()}.
 */
public class ModelSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(ModelSynchronizer.class);

    private static final String COMPONENT = "ModelSynchronizer";

    public static final int DEFAULT_HISTORY_LIMIT = 10;

    private final String nodeId;
    private final int historyLimit;
    private final ReentrantLock lock = new ReentrantLock();

    private GlobalModel currentModel;
    private SyncStatus status = SyncStatus.PENDING;
    private Instant lastSyncTime;
    private final Deque<GlobalModel> history = new ArrayDeque<>();
    private final Map<String, Integer> nodeVersions = new LinkedHashMap<>();
    private final List<ModelConflict> conflictLog = new ArrayList<>();

    public ModelSynchronizer(String nodeId) {
        this(nodeId, DEFAULT_HISTORY_LIMIT);
    }

    public ModelSynchronizer(String nodeId, int historyLimit) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be at least 1, got " + historyLimit);
        }
        this.historyLimit = historyLimit;
    }

    // ── ingestion ────────────────────────────────────────────────────────────

    /**
     * Validates and adopts {@code model} if it is newer than the current one.
     *
     * @param source who sent it, for logging only
     * @return {@code false} on integrity failure or stale version; state is then unchanged
     */
    public boolean receiveGlobalModel(GlobalModel model, String source) {
        String integrityError = validate(model);
        if (integrityError != null) {
            log.warn("[ModelSynchronizer] MODEL_REJECTED node={} source={} reason={}",
                nodeId, source, integrityError);
            return false;
        }

        lock.lock();
        try {
            if (currentModel != null && model.version() <= currentModel.version()) {
                log.info("[ModelSynchronizer] MODEL_REJECTED node={} source={} reason=stale version={} current={}",
                    nodeId, source, model.version(), currentModel.version());
                return false;
            }
            adopt(model);
            log.info("[ModelSynchronizer] MODEL_ADOPTED node={} source={} version={} round={} hash={}",
                nodeId, source, model.version(), model.roundNumber(), model.weightsHash());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private static String validate(GlobalModel model) {
        if (model == null) {
            return "model is null";
        }
        if (model.weights() == null) {
            return "weights are missing";
        }
        if (model.version() < 0) {
            return "negative version " + model.version();
        }
        if (!model.hasConsistentHash()) {
            return "weights hash mismatch for version " + model.version();
        }
        return null;
    }

    /**
     * Caller holds the lock. History only ever holds ancestors of the current model:
     * retained versions at or above {@code model}'s (an abandoned lineage after a rollback
     * or a lower-version adoption) are discarded, and so is a replaced model that is not
     * older than {@code model}.
     */
    private void adopt(GlobalModel model) {
        List<Integer> discarded = new ArrayList<>();
        for (Iterator<GlobalModel> it = history.iterator(); it.hasNext(); ) {
            GlobalModel retained = it.next();
            if (retained.version() >= model.version()) {
                discarded.add(retained.version());
                it.remove();
            }
        }
        if (currentModel != null) {
            if (currentModel.version() < model.version()) {
                pushHistory(currentModel);
            } else {
                discarded.add(currentModel.version());
            }
        }
        if (!discarded.isEmpty()) {
            log.info("[ModelSynchronizer] LINEAGE_DISCARDED node={} versions={} adopted={}",
                nodeId, discarded, model.version());
        }
        currentModel = model;
        status = SyncStatus.ACTIVE;
        lastSyncTime = Instant.now();
    }

    private void pushHistory(GlobalModel model) {
        history.addLast(model);
        while (history.size() > historyLimit) {
            GlobalModel evicted = history.removeFirst();
            log.debug("[ModelSynchronizer] HISTORY_EVICTED node={} version={}", nodeId, evicted.version());
        }
    }

    // ── conflicts ────────────────────────────────────────────────────────────

    /**
     * Compares two views of the model. Version differences are {@code MEDIUM}, a hash
     * difference at the same version is {@code CRITICAL}, a round difference is {@code HIGH}.
     * Detected conflicts are appended to the conflict log.
     */
    public List<ModelConflict> checkForConflicts(GlobalModel local, GlobalModel global) {
        if (local == null || global == null) {
            return List.of();
        }
        Instant now = Instant.now();
        List<ModelConflict> conflicts = new ArrayList<>();

        if (local.version() != global.version()) {
            conflicts.add(new ModelConflict(ConflictType.VERSION_MISMATCH, ConflictSeverity.MEDIUM,
                String.valueOf(local.version()), String.valueOf(global.version()),
                "Local version " + local.version() + " differs from global version " + global.version(), now));
        } else if (!Objects.equals(local.weightsHash(), global.weightsHash())) {
            conflicts.add(new ModelConflict(ConflictType.WEIGHT_HASH_MISMATCH, ConflictSeverity.CRITICAL,
                local.weightsHash(), global.weightsHash(),
                "Different weights published under version " + local.version(), now));
        }
        if (local.roundNumber() != global.roundNumber()) {
            conflicts.add(new ModelConflict(ConflictType.ROUND_MISMATCH, ConflictSeverity.HIGH,
                String.valueOf(local.roundNumber()), String.valueOf(global.roundNumber()),
                "Local round " + local.roundNumber() + " differs from global round " + global.roundNumber(), now));
        }

        if (!conflicts.isEmpty()) {
            lock.lock();
            try {
                conflictLog.addAll(conflicts);
            } finally {
                lock.unlock();
            }
            log.warn("[ModelSynchronizer] CONFLICTS_DETECTED node={} count={} types={}",
                nodeId, conflicts.size(), conflicts.stream().map(ModelConflict::type).toList());
        }
        return conflicts;
    }

    /**
     * Settles {@code conflicts} between {@code local} and {@code global}.
     * <ul>
     *   <li>{@code PREFER_GLOBAL} adopts {@code global}, bypassing the version check</li>
     *   <li>{@code PREFER_LOCAL} keeps the current model</li>
     *   <li>{@code MERGE} throws {@link AggregationException}; it is not implemented</li>
     * </ul>
     */
    public ConflictResolution resolveConflicts(List<ModelConflict> conflicts, ResolutionStrategy strategy,
                                               GlobalModel local, GlobalModel global) {
        Objects.requireNonNull(strategy, "strategy");
        lock.lock();
        try {
            if (conflicts == null || conflicts.isEmpty()) {
                return new ConflictResolution(strategy, currentModel, 0);
            }
            switch (strategy) {
                case PREFER_GLOBAL -> {
                    String integrityError = validate(global);
                    if (integrityError != null) {
                        throw new AggregationException(COMPONENT, "cannot prefer global model: " + integrityError);
                    }
                    if (currentModel != global) {
                        adopt(global);
                    }
                }
                case PREFER_LOCAL -> {
                    if (currentModel == null && local != null) {
                        adopt(local);
                    }
                }
                case MERGE -> throw new AggregationException(COMPONENT,
                    "merge conflict resolution is not supported; use prefer_global or prefer_local");
            }
            log.info("[ModelSynchronizer] CONFLICTS_RESOLVED node={} strategy={} count={} version={}",
                nodeId, strategy, conflicts.size(), currentModel == null ? 0 : currentModel.version());
            return new ConflictResolution(strategy, currentModel, conflicts.size());
        } finally {
            lock.unlock();
        }
    }

    // ── rollback ─────────────────────────────────────────────────────────────

    /**
     * Restores the retained model with exactly {@code targetVersion}. The replaced current
     * model and every retained version above the target are discarded, so the next adopted
     * model extends the restored lineage.
     *
     * @return {@code false} if that version is not retained
     */
    public boolean rollback(int targetVersion) {
        lock.lock();
        try {
            GlobalModel target = null;
            for (Iterator<GlobalModel> it = history.iterator(); it.hasNext(); ) {
                GlobalModel candidate = it.next();
                if (candidate.version() == targetVersion) {
                    target = candidate;
                    it.remove();
                    break;
                }
            }
            if (target == null) {
                log.warn("[ModelSynchronizer] ROLLBACK_FAILED node={} targetVersion={} retained={}",
                    nodeId, targetVersion, historyVersionsLocked());
                return false;
            }
            int from = currentModel == null ? 0 : currentModel.version();
            adopt(target);
            log.info("[ModelSynchronizer] ROLLBACK node={} from={} to={}", nodeId, from, targetVersion);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ── node tracking and status ─────────────────────────────────────────────

    /**
     * Records the model version a node reports. While distributing, the status returns to
     * {@code ACTIVE} once no tracked node is behind.
     */
    public void recordNodeVersion(String node, int version) {
        lock.lock();
        try {
            nodeVersions.put(node, version);
            if (status == SyncStatus.DISTRIBUTING && outdatedNodesLocked().isEmpty()) {
                status = SyncStatus.ACTIVE;
                log.info("[ModelSynchronizer] DISTRIBUTION_COMPLETE node={} version={}",
                    nodeId, currentModel.version());
            }
        } finally {
            lock.unlock();
        }
    }

    /** Tracked nodes whose last reported version is below the current one. */
    public List<String> getOutdatedNodes() {
        lock.lock();
        try {
            return outdatedNodesLocked();
        } finally {
            lock.unlock();
        }
    }

    private List<String> outdatedNodesLocked() {
        int current = currentModel == null ? 0 : currentModel.version();
        return nodeVersions.entrySet().stream()
            .filter(e -> e.getValue() < current)
            .map(Map.Entry::getKey)
            .toList();
    }

    /** @return {@code false} when there is no model to distribute */
    public boolean beginDistribution() {
        lock.lock();
        try {
            if (currentModel == null) {
                return false;
            }
            status = SyncStatus.DISTRIBUTING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** @return {@code false} when there is no model to deprecate */
    public boolean deprecate() {
        lock.lock();
        try {
            if (currentModel == null) {
                return false;
            }
            status = SyncStatus.DEPRECATED;
            log.info("[ModelSynchronizer] MODEL_DEPRECATED node={} version={}", nodeId, currentModel.version());
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ── chain verification ───────────────────────────────────────────────────

    /**
     * Recomputes every retained model's hash and checks that each model's
     * {@code previousHash} matches the hash of the next-lower retained version when it
     * directly precedes it.
     */
    public ChainVerification verifyHistoryChain() {
        List<GlobalModel> models;
        lock.lock();
        try {
            models = new ArrayList<>(history);
            if (currentModel != null) models.add(currentModel);
        } finally {
            lock.unlock();
        }
        models.sort(Comparator.comparingInt(GlobalModel::version));

        List<String> failures = new ArrayList<>();
        GlobalModel previous = null;
        for (GlobalModel model : models) {
            if (!model.hasConsistentHash()) {
                failures.add("version " + model.version() + ": weights hash does not match weights");
            }
            if (previous != null && model.version() == previous.version() + 1
                    && !model.previousHash().equals(previous.weightsHash())) {
                failures.add("version " + model.version() + ": previous hash does not link to version "
                    + previous.version());
            }
            previous = model;
        }
        if (!failures.isEmpty()) {
            log.warn("[ModelSynchronizer] CHAIN_BROKEN node={} failures={}", nodeId, failures);
        }
        return new ChainVerification(models.size(), failures);
    }

    // ── reads ────────────────────────────────────────────────────────────────

    public String getNodeId() {
        return nodeId;
    }

    public GlobalModel getCurrentModel() {
        lock.lock();
        try {
            return currentModel;
        } finally {
            lock.unlock();
        }
    }

    /** 0 before the first adopted model. */
    public int getModelVersion() {
        lock.lock();
        try {
            return currentModel == null ? 0 : currentModel.version();
        } finally {
            lock.unlock();
        }
    }

    public SyncStatus getSyncStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    /** Retained versions, oldest first. */
    public List<Integer> getHistoryVersions() {
        lock.lock();
        try {
            return historyVersionsLocked();
        } finally {
            lock.unlock();
        }
    }

    private List<Integer> historyVersionsLocked() {
        return history.stream().map(GlobalModel::version).toList();
    }

    public List<ModelConflict> getConflictLog() {
        lock.lock();
        try {
            return List.copyOf(conflictLog);
        } finally {
            lock.unlock();
        }
    }

    public ModelSyncState getState() {
        lock.lock();
        try {
            return new ModelSyncState(nodeId, currentModel == null ? 0 : currentModel.version(),
                currentModel, nodeVersions, status, lastSyncTime, conflictLog);
        } finally {
            lock.unlock();
        }
    }
}
