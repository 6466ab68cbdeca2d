package com.flplatform.common.aggregation;

import com.flplatform.common.model.AggregationDiagnostics;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.stats.RobustStatistics;

import java.util.List;

/**
 * Federated averaging: sample-weighted mean of all update vectors.
 *
 * <p>Each update is weighted by {@code max(1, numSamples)}. All updates are accepted.
 */
public class FedAvgAggregator extends AbstractAggregator {

    public static final String NAME = "fedavg";

    public FedAvgAggregator() {
        super(NAME);
    }

    @Override
    protected String checkQuorum(int n) {
        return n == 0 ? "No updates to aggregate" : null;
    }

    @Override
    protected AggregationResult combine(List<ModelUpdate> updates, List<double[]> vectors,
                                        GlobalModel previousModel, long startNanos) {
        double[] weights = sampleWeights(updates);
        double[] averaged = RobustStatistics.weightedAverage(vectors, weights);

        long totalSamples = updates.stream().mapToLong(ModelUpdate::effectiveSamples).sum();
        GlobalModel model = buildGlobalModel(updates, previousModel, averaged,
            updates.size(), totalSamples, NAME);

        List<String> nodeIds = updates.stream().map(ModelUpdate::nodeId).toList();
        return AggregationResult.success(model, updates.size(), updates.size(), List.of(),
            elapsedSeconds(startNanos), AggregationDiagnostics.empty().withSelectedNodeIds(nodeIds));
    }
}
