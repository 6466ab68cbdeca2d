package com.flplatform.common.aggregation;

import com.flplatform.common.model.AggregationDiagnostics;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.stats.OutlierDetector;
import com.flplatform.common.stats.OutlierMethod;
import com.flplatform.common.stats.RobustStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Trimmed mean with variance-driven β and outlier pre-filtering.
 *
 * <p>β for a round is derived from the configured β and the mean cross-update coordinate
 * variance: above {@value #HIGH_VARIANCE} it rises to {@code min(0.3, β·1.5)}, below
 * {@value #LOW_VARIANCE} it drops to {@code max(0.05, β·0.5)}.
 *
 * <p>Outlier updates (per {@link OutlierMethod}) are excluded coordinate by coordinate.
 * If fewer than two values would remain for a coordinate, all values are used. Trimming is
 * applied only when more than {@code 2·trim} values are left.
 */
public class AdaptiveTrimmedMeanAggregator extends TrimmedMeanAggregator {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveTrimmedMeanAggregator.class);

    public static final String NAME = "adaptive_trimmed_mean";

    static final double HIGH_VARIANCE = 1.0;
    static final double LOW_VARIANCE  = 0.1;
    static final double MAX_ADAPTED_BETA = 0.3;
    static final double MIN_ADAPTED_BETA = 0.05;

    private final boolean adaptiveBeta;
    private final OutlierMethod outlierMethod;

    private final Object statsLock = new Object();
    private long totalRounds;
    private double avgTrimmed;
    private long outliersDetected;

    public AdaptiveTrimmedMeanAggregator(double beta) {
        this(beta, true, OutlierMethod.IQR);
    }

    public AdaptiveTrimmedMeanAggregator(double beta, boolean adaptiveBeta, OutlierMethod outlierMethod) {
        super(NAME, beta);
        this.adaptiveBeta = adaptiveBeta;
        this.outlierMethod = Objects.requireNonNullElse(outlierMethod, OutlierMethod.IQR);
    }

    public OutlierMethod getOutlierMethod() {
        return outlierMethod;
    }

    double effectiveBeta(double variance) {
        double beta = getBeta();
        if (adaptiveBeta) {
            if (variance > HIGH_VARIANCE) {
                beta = Math.min(MAX_ADAPTED_BETA, beta * 1.5);
            } else if (variance < LOW_VARIANCE) {
                beta = Math.max(MIN_ADAPTED_BETA, beta * 0.5);
            }
        }
        return clampBeta(beta);
    }

    @Override
    protected AggregationResult combine(List<ModelUpdate> updates, List<double[]> vectors,
                                        GlobalModel previousModel, long startNanos) {
        int n = updates.size();
        double variance = RobustStatistics.meanCoordinateVariance(vectors, 0);
        double beta = effectiveBeta(variance);
        int trim = trimCount(n, beta);

        SortedSet<Integer> outliers = OutlierDetector.detect(vectors, outlierMethod);
        int dim = vectors.get(0).length;
        double[] result = new double[dim];

        for (int d = 0; d < dim; d++) {
            double[] kept = keptValues(vectors, d, outliers);
            Arrays.sort(kept);
            if (trim > 0 && kept.length > 2 * trim) {
                result[d] = RobustStatistics.mean(kept, trim, kept.length - trim);
            } else {
                result[d] = RobustStatistics.mean(kept);
            }
        }

        int accepted = n - 2 * trim;
        String method = String.format(Locale.ROOT, "%s_b%.2f", NAME, beta);
        GlobalModel model = buildGlobalModel(updates, previousModel, result,
            accepted, rawSampleTotal(updates), method);

        List<String> outlierIds = outliers.stream().map(i -> updates.get(i).nodeId()).toList();
        if (!outlierIds.isEmpty()) {
            log.info("[AdaptiveTrimmedMeanAggregator] OUTLIERS_FILTERED method={} nodes={}",
                outlierMethod, outlierIds);
        }
        recordRound(2 * trim, outliers.size());

        AggregationDiagnostics diagnostics = AggregationDiagnostics.empty()
            .withTrimming(beta, trim)
            .withOutliers(outlierIds)
            .withVariance(variance);
        return AggregationResult.success(model, n, accepted, 2 * trim, List.of(),
            elapsedSeconds(startNanos), diagnostics);
    }

    private static double[] keptValues(List<double[]> vectors, int d, SortedSet<Integer> outliers) {
        List<Double> kept = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            if (!outliers.contains(i)) kept.add(vectors.get(i)[d]);
        }
        if (kept.size() < 2) {
            return RobustStatistics.column(vectors, d);
        }
        return kept.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private void recordRound(int trimmed, int outliers) {
        synchronized (statsLock) {
            totalRounds++;
            avgTrimmed += (trimmed - avgTrimmed) / totalRounds;
            outliersDetected += outliers;
        }
    }

    public TrimStats getStats() {
        synchronized (statsLock) {
            return new TrimStats(totalRounds, avgTrimmed, outliersDetected);
        }
    }

    public record TrimStats(long totalRounds, double avgTrimmed, long outliersDetected) {}
}
