package com.flplatform.common.aggregation;

import com.flplatform.common.codec.ParameterCodec;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.model.ModelWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared skeleton for the vector-based strategies.
 *
 * <ol>
 *   <li>{@link #checkQuorum(int)} — strategy-specific minimum participant count</li>
 *   <li>flatten every update and verify all vectors share one dimension</li>
 *   <li>{@link #combine(List, List, GlobalModel, long)} — the strategy itself</li>
 * </ol>
 *
 * <p>Any {@link RuntimeException} raised while combining is logged and turned into a
 * failed result; {@code aggregate()} never propagates it.
 */
public abstract class AbstractAggregator implements Aggregator {

    private static final Logger log = LoggerFactory.getLogger(AbstractAggregator.class);

    private final String name;

    protected AbstractAggregator(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public AggregationResult aggregate(List<ModelUpdate> updates, GlobalModel previousModel) {
        long start = System.nanoTime();
        List<ModelUpdate> input = updates == null ? List.of() : List.copyOf(updates);

        String quorumError = checkQuorum(input.size());
        if (quorumError != null) {
            log.warn("[{}] QUORUM_NOT_MET received={} reason={}", name, input.size(), quorumError);
            return AggregationResult.failure(quorumError, input.size(), elapsedSeconds(start));
        }

        try {
            List<double[]> vectors = flatten(input);
            return combine(input, vectors, previousModel, start);
        } catch (RuntimeException e) {
            log.error("[{}] AGGREGATION_FAILED received={} reason={}", name, input.size(), e.getMessage());
            return AggregationResult.failure(e.getMessage(), input.size(), elapsedSeconds(start));
        }
    }

    /**
     * @return {@code null} when {@code n} updates are enough, otherwise the failure message
     */
    protected abstract String checkQuorum(int n);

    /**
     * Strategy body. Vectors are index-aligned with {@code updates} and share one dimension.
     */
    protected abstract AggregationResult combine(List<ModelUpdate> updates,
                                                 List<double[]> vectors,
                                                 GlobalModel previousModel,
                                                 long startNanos);

    /** Assembles the successor model: version, chain hash, round, averaged losses. */
    protected GlobalModel buildGlobalModel(List<ModelUpdate> updates,
                                           GlobalModel previousModel,
                                           double[] vector,
                                           int contributors,
                                           long totalSamples,
                                           String method) {
        ModelWeights weights = ParameterCodec.reconstructLike(vector, updates.get(0).weights());
        int roundNumber = updates.stream().mapToInt(ModelUpdate::roundNumber).max().orElse(0);
        int n = updates.size();
        double trainingLoss   = updates.stream().mapToDouble(ModelUpdate::trainingLoss).sum() / n;
        double validationLoss = updates.stream().mapToDouble(ModelUpdate::validationLoss).sum() / n;

        return new GlobalModel(
            GlobalModel.nextVersion(previousModel),
            roundNumber,
            weights,
            contributors,
            totalSamples,
            method,
            trainingLoss,
            validationLoss,
            null,
            GlobalModel.chainHash(previousModel),
            null
        );
    }

    protected static long rawSampleTotal(List<ModelUpdate> updates) {
        return updates.stream().mapToLong(ModelUpdate::numSamples).sum();
    }

    protected static double[] sampleWeights(List<ModelUpdate> updates) {
        double[] weights = new double[updates.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = updates.get(i).effectiveSamples();
        }
        return weights;
    }

    protected static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static List<double[]> flatten(List<ModelUpdate> updates) {
        List<double[]> vectors = new ArrayList<>(updates.size());
        int expected = -1;
        for (ModelUpdate update : updates) {
            double[] vector = update.weights().toFlatVector();
            if (expected < 0) {
                expected = vector.length;
            } else if (vector.length != expected) {
                throw new IllegalArgumentException("Dimension mismatch: update from " + update.nodeId()
                    + " has " + vector.length + " parameters, expected " + expected);
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
