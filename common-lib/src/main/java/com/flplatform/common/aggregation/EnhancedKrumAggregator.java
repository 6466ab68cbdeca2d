package com.flplatform.common.aggregation;

import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.stats.DistanceBackend;
import com.flplatform.common.stats.DistanceBackends;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Krum with an injected distance backend, adaptive f and running statistics.
 *
 * <p>Adaptive f is derived per call from the configured f and the mean trust of the
 * round's participants:
 * <ul>
 *   <li>mean trust &gt; 0.8 → {@code max(1, f − 1)}</li>
 *   <li>mean trust &lt; 0.5 → {@code min(f + 1, (n − 3) / 2)}</li>
 * </ul>
 * and is always capped so that {@code k = n − f − 2} stays positive. The configured f is
 * never mutated.
 *
 * <p>If the backend throws, the pairwise loop is used instead for that call.
 */
public class EnhancedKrumAggregator extends KrumAggregator {

    private static final Logger log = LoggerFactory.getLogger(EnhancedKrumAggregator.class);

    public static final String NAME = "enhanced_krum";

    static final double HIGH_TRUST = 0.8;
    static final double LOW_TRUST  = 0.5;

    private final boolean adaptiveF;
    private final TrustScoreProvider trustScores;
    private final DistanceBackend distanceBackend;

    private final Object statsLock = new Object();
    private long byzantineDetected;
    private long totalRounds;
    private double avgAggregationTime;

    public EnhancedKrumAggregator(int f, boolean multiKrum, int m) {
        this(f, multiKrum, m, false, TrustScoreProvider.FULL_TRUST, DistanceBackends.detect());
    }

    public EnhancedKrumAggregator(int f, boolean multiKrum, int m, boolean adaptiveF,
                                  TrustScoreProvider trustScores, DistanceBackend distanceBackend) {
        super(NAME, f, multiKrum, m);
        this.adaptiveF = adaptiveF;
        this.trustScores = Objects.requireNonNullElse(trustScores, TrustScoreProvider.FULL_TRUST);
        this.distanceBackend = Objects.requireNonNullElse(distanceBackend, DistanceBackends.PAIRWISE);
    }

    public boolean isAdaptiveF() {
        return adaptiveF;
    }

    @Override
    public AggregationResult aggregate(List<ModelUpdate> updates, GlobalModel previousModel) {
        AggregationResult result = super.aggregate(updates, previousModel);
        if (result.success()) {
            recordRound(result.suspectedByzantine().size(), result.aggregationTimeSeconds());
        }
        return result;
    }

    @Override
    protected int effectiveF(List<ModelUpdate> updates) {
        int n = updates.size();
        int f = getF();
        if (adaptiveF) {
            double avgTrust = updates.stream()
                .mapToDouble(u -> trustScores.trustOf(u.nodeId()))
                .average()
                .orElse(TrustScoreProvider.DEFAULT_TRUST);
            if (avgTrust > HIGH_TRUST) {
                f = Math.max(1, f - 1);
            } else if (avgTrust < LOW_TRUST) {
                f = Math.min(f + 1, (n - 3) / 2);
            }
            log.debug("[EnhancedKrumAggregator] ADAPTIVE_F avgTrust={} configured={} effective={}",
                avgTrust, getF(), f);
        }
        return Math.max(0, Math.min(f, (n - 3) / 2));
    }

    @Override
    protected Distances distanceMatrix(List<double[]> vectors) {
        try {
            return new Distances(distanceBackend.distances(vectors), distanceBackend.name());
        } catch (RuntimeException e) {
            log.warn("[EnhancedKrumAggregator] DISTANCE_BACKEND_FAILED backend={} reason={} fallback={}",
                distanceBackend.name(), e.getMessage(), DistanceBackends.PAIRWISE.name());
            return super.distanceMatrix(vectors);
        }
    }

    @Override
    protected String methodLabel(int effectiveF) {
        return NAME + "_f" + effectiveF;
    }

    private void recordRound(int suspected, double seconds) {
        synchronized (statsLock) {
            byzantineDetected += suspected;
            totalRounds++;
            avgAggregationTime += (seconds - avgAggregationTime) / totalRounds;
        }
    }

    public KrumStats getStats() {
        synchronized (statsLock) {
            return new KrumStats(byzantineDetected, totalRounds, avgAggregationTime);
        }
    }

    /** Snapshot of the running counters. */
    public record KrumStats(long byzantineDetected, long totalRounds, double avgAggregationTime) {}
}
