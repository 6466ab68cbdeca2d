package com.flplatform.common.aggregation;

import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.stats.RobustStatistics;

import java.util.List;

/**
 * Coordinate-wise median. Even counts average the two middle values.
 * Every update counts as accepted; sample counts are ignored.
 */
public class MedianAggregator extends AbstractAggregator {

    public static final String NAME = "median";

    public MedianAggregator() {
        super(NAME);
    }

    @Override
    protected String checkQuorum(int n) {
        return n == 0 ? "No updates to aggregate" : null;
    }

    @Override
    protected AggregationResult combine(List<ModelUpdate> updates, List<double[]> vectors,
                                        GlobalModel previousModel, long startNanos) {
        double[] median = RobustStatistics.coordinateMedian(vectors);
        GlobalModel model = buildGlobalModel(updates, previousModel, median,
            updates.size(), rawSampleTotal(updates), NAME);
        return AggregationResult.success(model, updates.size(), updates.size(), List.of(),
            elapsedSeconds(startNanos), null);
    }
}
