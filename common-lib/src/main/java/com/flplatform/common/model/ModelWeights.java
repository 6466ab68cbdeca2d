package com.flplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flplatform.common.codec.LayerShapes;
import com.flplatform.common.codec.ParameterCodec;
import com.flplatform.common.codec.WireFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Opaque model parameters: layer name → weight vector, layer name → bias vector, plus
 * free-form metadata. The aggregation core never interprets model semantics.
 *
 * <p>Immutable: all maps and vectors are defensively copied. Layer maps are kept in
 * lexicographic order, which is also the flatten order.
 */
public record ModelWeights(
    @JsonProperty("layer_weights") Map<String, List<Double>> layerWeights,
    @JsonProperty("layer_biases")  Map<String, List<Double>> layerBiases,
    @JsonProperty("metadata")      Map<String, Object> metadata
) {

    /** Layer name used when weights arrive as a single unstructured vector. */
    public static final String FLAT_LAYER = "flat";

    public ModelWeights {
        layerWeights = copyLayers(layerWeights);
        layerBiases  = copyLayers(layerBiases);
        metadata     = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ModelWeights of(Map<String, List<Double>> layerWeights,
                                  Map<String, List<Double>> layerBiases) {
        return new ModelWeights(layerWeights, layerBiases, Map.of());
    }

    /** Single-layer weights under {@value #FLAT_LAYER}. */
    public static ModelWeights flat(double... values) {
        List<Double> vector = new ArrayList<>(values.length);
        for (double v : values) vector.add(v);
        return new ModelWeights(Map.of(FLAT_LAYER, vector), Map.of(), Map.of());
    }

    public double[] toFlatVector() {
        return ParameterCodec.flatten(this);
    }

    public LayerShapes shapes() {
        return ParameterCodec.shapes(this);
    }

    public String computeHash() {
        return ParameterCodec.hash(this);
    }

    public int dimension() {
        return shapes().totalSize();
    }

    public Map<String, Object> toDict() {
        return WireFormat.toDict(this);
    }

    public static ModelWeights fromDict(Map<String, ?> dict) {
        return WireFormat.fromDict(dict, ModelWeights.class);
    }

    private static Map<String, List<Double>> copyLayers(Map<String, List<Double>> layers) {
        if (layers == null || layers.isEmpty()) {
            return Map.of();
        }
        Map<String, List<Double>> copy = new TreeMap<>();
        layers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
