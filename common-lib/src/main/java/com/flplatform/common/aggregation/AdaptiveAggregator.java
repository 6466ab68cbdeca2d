package com.flplatform.common.aggregation;

import com.flplatform.common.model.AggregationDiagnostics;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.stats.RobustStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Meta-strategy choosing one of FedAvg, Krum(f=1) or TrimmedMean(β=0.1) per round.
 *
 * <p>Selection, in order:
 * <ol>
 *   <li>n ≥ 3 and mean coordinate variance over the first {@code sampleDims} coordinates
 *       exceeds {@code varianceThreshold} → {@code trimmed_mean}</li>
 *   <li>n ≥ 5 → {@code krum}</li>
 *   <li>otherwise → {@code fedavg}</li>
 * </ol>
 * Every selection is appended to a history used by {@link #getStrategyUsage()}.
 */
public class AdaptiveAggregator implements Aggregator {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveAggregator.class);

    public static final String NAME = "adaptive";
    public static final double DEFAULT_VARIANCE_THRESHOLD = 1.0;
    public static final int DEFAULT_SAMPLE_DIMS = 100;

    static final int MIN_TRIMMED_MEAN = 3;
    static final int MIN_KRUM = 5;

    private final Aggregator fedAvg;
    private final Aggregator krum;
    private final Aggregator trimmedMean;
    private final double varianceThreshold;
    private final int sampleDims;

    private final List<StrategySelection> history = new ArrayList<>();

    public AdaptiveAggregator() {
        this(DEFAULT_VARIANCE_THRESHOLD, DEFAULT_SAMPLE_DIMS);
    }

    public AdaptiveAggregator(double varianceThreshold, int sampleDims) {
        this(new FedAvgAggregator(), new KrumAggregator(1),
            new TrimmedMeanAggregator(TrimmedMeanAggregator.DEFAULT_BETA), varianceThreshold, sampleDims);
    }

    AdaptiveAggregator(Aggregator fedAvg, Aggregator krum, Aggregator trimmedMean,
                       double varianceThreshold, int sampleDims) {
        this.fedAvg = Objects.requireNonNull(fedAvg);
        this.krum = Objects.requireNonNull(krum);
        this.trimmedMean = Objects.requireNonNull(trimmedMean);
        this.varianceThreshold = varianceThreshold;
        this.sampleDims = sampleDims;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AggregationResult aggregate(List<ModelUpdate> updates, GlobalModel previousModel) {
        List<ModelUpdate> input = updates == null ? List.of() : updates;
        double variance = RobustStatistics.meanCoordinateVariance(
            input.stream().map(u -> u.weights().toFlatVector()).toList(), sampleDims);

        Aggregator chosen = select(input.size(), variance);
        synchronized (history) {
            history.add(new StrategySelection(chosen.name(), input.size(), variance, Instant.now()));
        }
        log.info("[AdaptiveAggregator] STRATEGY_SELECTED strategy={} updates={} variance={}",
            chosen.name(), input.size(), variance);

        AggregationResult result = chosen.aggregate(input, previousModel);
        AggregationDiagnostics diagnostics = result.diagnostics() == null
            ? AggregationDiagnostics.empty() : result.diagnostics();
        return result.withDiagnostics(diagnostics.withStrategy(chosen.name(), variance));
    }

    Aggregator select(int n, double variance) {
        if (n >= MIN_TRIMMED_MEAN && variance > varianceThreshold) {
            return trimmedMean;
        }
        if (n >= MIN_KRUM) {
            return krum;
        }
        return fedAvg;
    }

    public List<StrategySelection> getSelectionHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /** Count and fraction of rounds per strategy name, in first-use order. */
    public Map<String, StrategyUsage> getStrategyUsage() {
        List<StrategySelection> snapshot = getSelectionHistory();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (StrategySelection selection : snapshot) {
            counts.merge(selection.strategy(), 1, Integer::sum);
        }
        Map<String, StrategyUsage> usage = new LinkedHashMap<>();
        counts.forEach((strategy, count) ->
            usage.put(strategy, new StrategyUsage(count, (double) count / snapshot.size())));
        return usage;
    }

    public record StrategySelection(String strategy, int updates, double variance, Instant selectedAt) {}

    public record StrategyUsage(int count, double fraction) {}
}
