package com.flplatform.common;

import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.model.ModelWeights;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

/** Deterministic update sets shared by the aggregation tests. */
public final class Fixtures {

    private Fixtures() {}

    public static ModelUpdate update(String nodeId, int samples, double... values) {
        return ModelUpdate.of(nodeId, 1, ModelWeights.flat(values), samples);
    }

    /** {@code n} honest updates near {@code [i, i]}, i = 0..n-1, jittered by at most 0.01. */
    public static List<ModelUpdate> honestNearIndex(int n) {
        Random random = new Random(7L);
        List<ModelUpdate> updates = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            updates.add(update("honest-" + i, 100,
                i + random.nextDouble() * 0.01, i + random.nextDouble() * 0.01));
        }
        return updates;
    }

    /** {@code n} honest updates tightly clustered around {@code center} in {@code dim} dimensions. */
    public static List<ModelUpdate> tightCluster(int n, int dim, double center, long seed) {
        Random random = new Random(seed);
        List<ModelUpdate> updates = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double[] values = new double[dim];
            for (int d = 0; d < dim; d++) {
                values[d] = center + random.nextGaussian() * 0.01;
            }
            updates.add(update("honest-" + i, 100, values));
        }
        return updates;
    }

    public static List<ModelUpdate> withOutliers(List<ModelUpdate> honest, int count, int dim, double value) {
        List<ModelUpdate> all = new ArrayList<>(honest);
        for (int i = 0; i < count; i++) {
            double[] values = new double[dim];
            Arrays.fill(values, value);
            all.add(update("byzantine-" + i, 100, values));
        }
        return all;
    }

    /** Two-layer weights: {@code dense} with weights and biases, {@code output} with weights only. */
    public static ModelWeights layered(double scale) {
        return ModelWeights.of(
            Map.of("dense", List.of(1.0 * scale, 2.0 * scale, 3.0 * scale),
                   "output", List.of(4.0 * scale)),
            Map.of("dense", List.of(0.5 * scale)));
    }
}
