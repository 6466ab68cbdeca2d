package com.flplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Fixed-schema, strategy-populated details of one aggregation. Every field is optional;
 * a strategy fills only what it computed.
 *
 * <ul>
 *   <li>{@code selectedNodeIds}        — contributors whose vectors form the output</li>
 *   <li>{@code krumScores}             — node id → Krum score (sum of k nearest distances)</li>
 *   <li>{@code effectiveF}             — f actually used after adaptation</li>
 *   <li>{@code effectiveBeta}          — β actually used after adaptation</li>
 *   <li>{@code trimCount}              — values dropped from each end per coordinate</li>
 *   <li>{@code outlierNodeIds}         — updates removed by outlier pre-filtering</li>
 *   <li>{@code selectedStrategy}       — strategy chosen by the adaptive selector</li>
 *   <li>{@code meanCoordinateVariance} — variance statistic used for adaptation</li>
 *   <li>{@code distanceBackend}        — backend that produced the distance matrix</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregationDiagnostics(
    @JsonProperty("selected_node_ids")        List<String> selectedNodeIds,
    @JsonProperty("krum_scores")              Map<String, Double> krumScores,
    @JsonProperty("effective_f")              Integer effectiveF,
    @JsonProperty("effective_beta")           Double effectiveBeta,
    @JsonProperty("trim_count")               Integer trimCount,
    @JsonProperty("outlier_node_ids")         List<String> outlierNodeIds,
    @JsonProperty("selected_strategy")        String selectedStrategy,
    @JsonProperty("mean_coordinate_variance") Double meanCoordinateVariance,
    @JsonProperty("distance_backend")         String distanceBackend
) {

    public static AggregationDiagnostics empty() {
        return new AggregationDiagnostics(null, null, null, null, null, null, null, null, null);
    }

    public AggregationDiagnostics withSelectedNodeIds(List<String> ids) {
        return new AggregationDiagnostics(List.copyOf(ids), krumScores, effectiveF, effectiveBeta,
            trimCount, outlierNodeIds, selectedStrategy, meanCoordinateVariance, distanceBackend);
    }

    public AggregationDiagnostics withKrum(Map<String, Double> scores, int f, String backend) {
        return new AggregationDiagnostics(selectedNodeIds, Map.copyOf(scores), f, effectiveBeta,
            trimCount, outlierNodeIds, selectedStrategy, meanCoordinateVariance, backend);
    }

    public AggregationDiagnostics withTrimming(double beta, int trim) {
        return new AggregationDiagnostics(selectedNodeIds, krumScores, effectiveF, beta,
            trim, outlierNodeIds, selectedStrategy, meanCoordinateVariance, distanceBackend);
    }

    public AggregationDiagnostics withOutliers(List<String> ids) {
        return new AggregationDiagnostics(selectedNodeIds, krumScores, effectiveF, effectiveBeta,
            trimCount, List.copyOf(ids), selectedStrategy, meanCoordinateVariance, distanceBackend);
    }

    public AggregationDiagnostics withStrategy(String strategy, double variance) {
        return new AggregationDiagnostics(selectedNodeIds, krumScores, effectiveF, effectiveBeta,
            trimCount, outlierNodeIds, strategy, variance, distanceBackend);
    }

    public AggregationDiagnostics withVariance(double variance) {
        return new AggregationDiagnostics(selectedNodeIds, krumScores, effectiveF, effectiveBeta,
            trimCount, outlierNodeIds, selectedStrategy, variance, distanceBackend);
    }
}
