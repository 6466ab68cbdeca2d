package com.flplatform.common.codec;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per-layer size table captured at flatten time. Reconstruction requires the exact table
 * that produced the flat vector; see {@link ParameterCodec#reconstruct(double[], LayerShapes)}.
 *
 * <p>A layer may carry weights, biases, or both. The flat layout iterates the union of
 * layer names in lexicographic order, weights before biases per layer.
 */
public record LayerShapes(
    @JsonProperty("weight_sizes") SortedMap<String, Integer> weightSizes,
    @JsonProperty("bias_sizes")   SortedMap<String, Integer> biasSizes
) {

    public LayerShapes {
        weightSizes = Collections.unmodifiableSortedMap(
            new TreeMap<>(weightSizes == null ? Map.of() : weightSizes));
        biasSizes = Collections.unmodifiableSortedMap(
            new TreeMap<>(biasSizes == null ? Map.of() : biasSizes));
    }

    /** Layer names in flatten order. */
    public SortedSet<String> layerNames() {
        SortedSet<String> names = new TreeSet<>(weightSizes.keySet());
        names.addAll(biasSizes.keySet());
        return names;
    }

    /** Total number of scalars described by this table. */
    public int totalSize() {
        int total = 0;
        for (int size : weightSizes.values()) total += size;
        for (int size : biasSizes.values())   total += size;
        return total;
    }

    public boolean isEmpty() {
        return weightSizes.isEmpty() && biasSizes.isEmpty();
    }
}
