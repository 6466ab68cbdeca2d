package com.flplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flplatform.common.codec.WireFormat;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One node's local update for one round. Immutable once built: clipped or noised
 * variants are new values produced by {@link #withClippedWeights} and
 * {@link #withNoisedWeights}, never in-place mutation.
 *
 * <p>{@code numSamples} is the averaging weight; every divisor use goes through
 * {@link #effectiveSamples()}, which floors at 1.
 */
public record ModelUpdate(
    @JsonProperty("node_id")           String nodeId,
    @JsonProperty("round_number")      int roundNumber,
    @JsonProperty("weights")           ModelWeights weights,
    @JsonProperty("num_samples")       int numSamples,
    @JsonProperty("training_loss")     double trainingLoss,
    @JsonProperty("validation_loss")   double validationLoss,
    @JsonProperty("gradient_norm")     double gradientNorm,
    @JsonProperty("gradient_variance") double gradientVariance,
    @JsonProperty("noise_scale")       double noiseScale,
    @JsonProperty("clip_norm")         double clipNorm,
    @JsonProperty("timestamp")         Instant timestamp
) {

    public ModelUpdate {
        Objects.requireNonNull(nodeId, "nodeId");
        weights   = weights == null ? ModelWeights.of(Map.of(), Map.of()) : weights;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ModelUpdate of(String nodeId, int roundNumber, ModelWeights weights, int numSamples) {
        return new ModelUpdate(nodeId, roundNumber, weights, numSamples,
            0.0, 0.0, 0.0, 0.0, 0.0, 0.0, null);
    }

    public static ModelUpdate of(String nodeId, int roundNumber, ModelWeights weights,
                                 int numSamples, double trainingLoss, double validationLoss) {
        return new ModelUpdate(nodeId, roundNumber, weights, numSamples,
            trainingLoss, validationLoss, 0.0, 0.0, 0.0, 0.0, null);
    }

    /** Averaging weight with the divisor floor applied: {@code max(1, numSamples)}. */
    public int effectiveSamples() {
        return Math.max(1, numSamples);
    }

    public ModelUpdate withClippedWeights(ModelWeights clipped, double clipNorm) {
        return new ModelUpdate(nodeId, roundNumber, clipped, numSamples, trainingLoss, validationLoss,
            gradientNorm, gradientVariance, noiseScale, clipNorm, timestamp);
    }

    public ModelUpdate withNoisedWeights(ModelWeights noised, double noiseScale) {
        return new ModelUpdate(nodeId, roundNumber, noised, numSamples, trainingLoss, validationLoss,
            gradientNorm, gradientVariance, noiseScale, clipNorm, timestamp);
    }

    public Map<String, Object> toDict() {
        return WireFormat.toDict(this);
    }

    public static ModelUpdate fromDict(Map<String, ?> dict) {
        return WireFormat.fromDict(dict, ModelUpdate.class);
    }
}
