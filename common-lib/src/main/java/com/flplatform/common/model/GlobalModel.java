package com.flplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flplatform.common.codec.WireFormat;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Authoritative model produced by one successful aggregation event. Immutable.
 *
 * <p>{@code weightsHash} is computed from the weights when absent; {@code previousHash}
 * carries the prior model's {@code weightsHash}, forming a tamper-evident chain.
 * A supplied hash is kept verbatim so that receivers can detect mismatches.
 */
public record GlobalModel(
    @JsonProperty("version")             int version,
    @JsonProperty("round_number")        int roundNumber,
    @JsonProperty("weights")             ModelWeights weights,
    @JsonProperty("num_contributors")    int numContributors,
    @JsonProperty("total_samples")       long totalSamples,
    @JsonProperty("aggregation_method")  String aggregationMethod,
    @JsonProperty("avg_training_loss")   double avgTrainingLoss,
    @JsonProperty("avg_validation_loss") double avgValidationLoss,
    @JsonProperty("weights_hash")        String weightsHash,
    @JsonProperty("previous_hash")       String previousHash,
    @JsonProperty("created_at")          Instant createdAt
) {

    public GlobalModel {
        if (weights != null && (weightsHash == null || weightsHash.isBlank())) {
            weightsHash = weights.computeHash();
        }
        aggregationMethod = aggregationMethod == null ? "" : aggregationMethod;
        previousHash      = previousHash == null ? "" : previousHash;
        createdAt         = createdAt == null ? Instant.now() : createdAt;
    }

    /** Minimal model, e.g. an initial model distributed before round one. */
    public static GlobalModel initial(int version, int roundNumber, ModelWeights weights) {
        Objects.requireNonNull(weights, "weights");
        return new GlobalModel(version, roundNumber, weights, 0, 0L, "initial",
            0.0, 0.0, null, "", null);
    }

    /** Version a successor of {@code previous} must carry: {@code previous.version + 1}, or 1. */
    public static int nextVersion(GlobalModel previous) {
        return previous == null ? 1 : previous.version() + 1;
    }

    /** Hash a successor of {@code previous} must link to, or the empty string. */
    public static String chainHash(GlobalModel previous) {
        return previous == null ? "" : previous.weightsHash();
    }

    /** True when the stored hash matches a fresh hash of the weights. */
    public boolean hasConsistentHash() {
        return weights != null && weights.computeHash().equals(weightsHash);
    }

    public Map<String, Object> toDict() {
        return WireFormat.toDict(this);
    }

    public static GlobalModel fromDict(Map<String, ?> dict) {
        return WireFormat.fromDict(dict, GlobalModel.class);
    }
}
