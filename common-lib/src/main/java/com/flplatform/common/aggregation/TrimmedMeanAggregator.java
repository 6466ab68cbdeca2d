package com.flplatform.common.aggregation;

import com.flplatform.common.model.AggregationDiagnostics;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.stats.RobustStatistics;

import java.util.List;

/**
 * Coordinate-wise trimmed mean.
 *
 * <p>For each coordinate the values are sorted and {@code floor(n·β)} are dropped from each
 * end before averaging. β is clamped to {@code [0.0, 0.49]} whatever the constructor receives.
 * Requires at least 3 updates.
 */
public class TrimmedMeanAggregator extends AbstractAggregator {

    public static final String NAME = "trimmed_mean";
    public static final double MAX_BETA = 0.49;
    public static final double DEFAULT_BETA = 0.1;

    static final int MIN_UPDATES = 3;

    private final double beta;

    public TrimmedMeanAggregator() {
        this(DEFAULT_BETA);
    }

    public TrimmedMeanAggregator(double beta) {
        this(NAME, beta);
    }

    protected TrimmedMeanAggregator(String name, double beta) {
        super(name);
        this.beta = clampBeta(beta);
    }

    public double getBeta() {
        return beta;
    }

    public static double clampBeta(double beta) {
        return Math.max(0.0, Math.min(MAX_BETA, beta));
    }

    static int trimCount(int n, double beta) {
        return (int) Math.floor(n * beta);
    }

    @Override
    protected String checkQuorum(int n) {
        return n < MIN_UPDATES ? "Trimmed mean requires at least " + MIN_UPDATES + " updates" : null;
    }

    @Override
    protected AggregationResult combine(List<ModelUpdate> updates, List<double[]> vectors,
                                        GlobalModel previousModel, long startNanos) {
        int n = updates.size();
        int trim = trimCount(n, beta);
        double[] trimmed = RobustStatistics.coordinateTrimmedMean(vectors, trim);

        GlobalModel model = buildGlobalModel(updates, previousModel, trimmed,
            n - 2 * trim, rawSampleTotal(updates), NAME + "_b" + beta);
        return AggregationResult.success(model, n, n - 2 * trim, 2 * trim, List.of(),
            elapsedSeconds(startNanos), AggregationDiagnostics.empty().withTrimming(beta, trim));
    }
}
