package com.flplatform.common.aggregation;

import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;

import java.util.List;

/**
 * Strategy contract for combining one round's finalized updates into a new global model.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Deterministic</b> — identical ordered input yields identical weights; ties in
 *       scoring are broken by original list index</li>
 *   <li><b>Non-throwing</b> — input errors (empty list, quorum not met, dimension mismatch)
 *       come back as {@code success=false} with a descriptive message</li>
 *   <li><b>Re-entrant</b> — safe to call concurrently for different rounds; the only shared
 *       mutable state allowed is an explicitly locked running-stats accumulator</li>
 * </ul>
 *
 * <p>Implementations: {@link FedAvgAggregator}, {@link KrumAggregator},
 * {@link TrimmedMeanAggregator}, {@link MedianAggregator}, {@link EnhancedKrumAggregator},
 * {@link AdaptiveTrimmedMeanAggregator}, {@link AdaptiveAggregator},
 * {@link SecureFedAvgAggregator}, {@link SecureKrumAggregator}.
 * Construct by name through {@link AggregatorFactory}.
 */
public interface Aggregator {

    /** Registry name of this strategy, e.g. {@code "krum"}. */
    String name();

    /**
     * Aggregate the updates into a successor of {@code previousModel}.
     *
     * @param updates       ordered, finalized updates for one round
     * @param previousModel prior global model, or {@code null} for the first aggregation;
     *                      drives the new version number and {@code previousHash}
     * @return an {@link AggregationResult}, never {@code null}
     */
    AggregationResult aggregate(List<ModelUpdate> updates, GlobalModel previousModel);

    default AggregationResult aggregate(List<ModelUpdate> updates) {
        return aggregate(updates, null);
    }
}
