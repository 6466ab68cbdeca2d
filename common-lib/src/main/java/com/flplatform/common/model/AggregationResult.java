package com.flplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flplatform.common.codec.WireFormat;

import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one {@code aggregate()} call.
 *
 * <p>On success it carries the new {@link GlobalModel} and the received / accepted /
 * rejected counts; robust strategies add {@code suspectedByzantine}. On failure it carries
 * only {@code errorMessage}, never a partial model. {@code aggregationTimeSeconds} is
 * always populated. Privacy fields are non-null only for privacy-aware strategies.
 */
public record AggregationResult(
    @JsonProperty("success")                  boolean success,
    @JsonProperty("global_model")             GlobalModel globalModel,
    @JsonProperty("updates_received")         int updatesReceived,
    @JsonProperty("updates_accepted")         int updatesAccepted,
    @JsonProperty("updates_rejected")         int updatesRejected,
    @JsonProperty("suspected_byzantine")      List<String> suspectedByzantine,
    @JsonProperty("error_message")            String errorMessage,
    @JsonProperty("aggregation_time_seconds") double aggregationTimeSeconds,
    @JsonProperty("privacy_epsilon_spent")    Double privacyEpsilonSpent,
    @JsonProperty("privacy_budget_remaining") Double privacyBudgetRemaining,
    @JsonProperty("diagnostics")              AggregationDiagnostics diagnostics
) {

    public AggregationResult {
        suspectedByzantine = suspectedByzantine == null ? List.of() : List.copyOf(suspectedByzantine);
        if (!success) {
            globalModel = null;
        }
    }

    public static AggregationResult success(GlobalModel model, int received, int accepted,
                                            List<String> suspected, double seconds,
                                            AggregationDiagnostics diagnostics) {
        return new AggregationResult(true, model, received, accepted, received - accepted,
            suspected, null, seconds, null, null, diagnostics);
    }

    public static AggregationResult success(GlobalModel model, int received, int accepted,
                                            int rejected, List<String> suspected, double seconds,
                                            AggregationDiagnostics diagnostics) {
        return new AggregationResult(true, model, received, accepted, rejected,
            suspected, null, seconds, null, null, diagnostics);
    }

    public static AggregationResult failure(String errorMessage, double seconds) {
        return new AggregationResult(false, null, 0, 0, 0, List.of(), errorMessage, seconds,
            null, null, null);
    }

    public static AggregationResult failure(String errorMessage, int received, double seconds) {
        return new AggregationResult(false, null, received, 0, 0, List.of(), errorMessage, seconds,
            null, null, null);
    }

    /** Copy carrying privacy accounting for this round. */
    public AggregationResult withPrivacy(double epsilonSpent, double budgetRemaining) {
        return new AggregationResult(success, globalModel, updatesReceived, updatesAccepted,
            updatesRejected, suspectedByzantine, errorMessage, aggregationTimeSeconds,
            epsilonSpent, budgetRemaining, diagnostics);
    }

    /** Copy with elapsed time replaced, used by wrappers that add work around a delegate. */
    public AggregationResult withAggregationTime(double seconds) {
        return new AggregationResult(success, globalModel, updatesReceived, updatesAccepted,
            updatesRejected, suspectedByzantine, errorMessage, seconds,
            privacyEpsilonSpent, privacyBudgetRemaining, diagnostics);
    }

    public AggregationResult withDiagnostics(AggregationDiagnostics newDiagnostics) {
        return new AggregationResult(success, globalModel, updatesReceived, updatesAccepted,
            updatesRejected, suspectedByzantine, errorMessage, aggregationTimeSeconds,
            privacyEpsilonSpent, privacyBudgetRemaining, newDiagnostics);
    }

    public Map<String, Object> toDict() {
        return WireFormat.toDict(this);
    }

    public static AggregationResult fromDict(Map<String, ?> dict) {
        return WireFormat.fromDict(dict, AggregationResult.class);
    }
}
