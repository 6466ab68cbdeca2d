package com.flplatform.common.codec;

import com.flplatform.common.exception.AggregationException;
import com.flplatform.common.model.ModelWeights;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Canonical flat-vector codec for {@link ModelWeights}.
 *
 * <h3>Layout</h3>
 * <pre>
 *   for layer in sorted(union(weight layers, bias layers)):
 *       emit weights[layer]   (if present)
 *       emit biases[layer]    (if present)
 * </pre>
 *
 * <h3>Hash</h3>
 * SHA-256 over the flat vector encoded as consecutive 8-byte little-endian IEEE-754
 * doubles, rendered as 64 lowercase hex characters. Order-sensitive; layer names are
 * not part of the digest.
 *
 * <p>Stateless and thread-safe.
 */
public final class ParameterCodec {

    private static final String COMPONENT = "ParameterCodec";

    private ParameterCodec() {}

    public static double[] flatten(ModelWeights weights) {
        LayerShapes shapes = shapes(weights);
        double[] flat = new double[shapes.totalSize()];
        int idx = 0;
        for (String layer : shapes.layerNames()) {
            List<Double> w = weights.layerWeights().get(layer);
            if (w != null) {
                for (Double v : w) flat[idx++] = v;
            }
            List<Double> b = weights.layerBiases().get(layer);
            if (b != null) {
                for (Double v : b) flat[idx++] = v;
            }
        }
        return flat;
    }

    public static LayerShapes shapes(ModelWeights weights) {
        SortedMap<String, Integer> weightSizes = new TreeMap<>();
        weights.layerWeights().forEach((name, values) -> weightSizes.put(name, values.size()));
        SortedMap<String, Integer> biasSizes = new TreeMap<>();
        weights.layerBiases().forEach((name, values) -> biasSizes.put(name, values.size()));
        return new LayerShapes(weightSizes, biasSizes);
    }

    /**
     * Rebuilds weights from a flat vector using the exact shape table that produced it.
     *
     * @throws AggregationException when {@code flat.length} differs from the table's total size
     */
    public static ModelWeights reconstruct(double[] flat, LayerShapes shapes) {
        return reconstruct(flat, shapes, Map.of());
    }

    public static ModelWeights reconstruct(double[] flat, LayerShapes shapes, Map<String, Object> metadata) {
        int expected = shapes.totalSize();
        if (flat.length != expected) {
            throw new AggregationException(COMPONENT,
                "dimension mismatch: shape table describes " + expected
                    + " parameters but vector has " + flat.length);
        }
        Map<String, List<Double>> layerWeights = new LinkedHashMap<>();
        Map<String, List<Double>> layerBiases  = new LinkedHashMap<>();
        int idx = 0;
        for (String layer : shapes.layerNames()) {
            Integer wSize = shapes.weightSizes().get(layer);
            if (wSize != null) {
                layerWeights.put(layer, slice(flat, idx, wSize));
                idx += wSize;
            }
            Integer bSize = shapes.biasSizes().get(layer);
            if (bSize != null) {
                layerBiases.put(layer, slice(flat, idx, bSize));
                idx += bSize;
            }
        }
        return new ModelWeights(layerWeights, layerBiases, metadata);
    }

    /**
     * Rebuilds a vector into the layer layout of {@code template}. A template without any
     * layers yields a single {@value ModelWeights#FLAT_LAYER} layer.
     */
    public static ModelWeights reconstructLike(double[] flat, ModelWeights template) {
        LayerShapes shapes = shapes(template);
        if (shapes.isEmpty()) {
            return ModelWeights.flat(flat);
        }
        return reconstruct(flat, shapes);
    }

    public static String hash(ModelWeights weights) {
        return hash(flatten(weights));
    }

    public static String hash(double[] flat) {
        ByteBuffer buffer = ByteBuffer.allocate(flat.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (double v : flat) {
            buffer.putDouble(v);
        }
        return HexFormat.of().formatHex(sha256(buffer.array()));
    }

    public static byte[] sha256(byte[] data) {
        return sha256Digest().digest(data);
    }

    private static MessageDigest sha256Digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static List<Double> slice(double[] flat, int from, int size) {
        List<Double> values = new ArrayList<>(size);
        for (int i = from; i < from + size; i++) {
            values.add(flat[i]);
        }
        return values;
    }
}
