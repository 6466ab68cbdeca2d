package com.flplatform.aggregation.logger;

import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.trace.RoundContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lifecycle logging for one aggregation round. Pure side effects, no decisions.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #UPDATES_RECEIVED}      — finalized updates handed to the aggregator</li>
 *   <li>{@link #AGGREGATION_COMPLETED} — aggregator returned a new global model</li>
 *   <li>{@link #AGGREGATION_FAILED}    — aggregator returned a failure result</li>
 *   <li>{@link #MODEL_ADOPTED}         — synchronizer accepted the new model</li>
 *   <li>{@link #MODEL_REJECTED}        — synchronizer refused it</li>
 * </ol>
 *
 * <p>Every call bridges the round id into MDC for the duration of the log statement only.
 */
@Component
public class AggregationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AggregationFlowLogger.class);

    public static final String UPDATES_RECEIVED      = "UPDATES_RECEIVED";
    public static final String AGGREGATION_COMPLETED = "AGGREGATION_COMPLETED";
    public static final String AGGREGATION_FAILED    = "AGGREGATION_FAILED";
    public static final String MODEL_ADOPTED         = "MODEL_ADOPTED";
    public static final String MODEL_REJECTED        = "MODEL_REJECTED";

    public void updatesReceived(String roundId, String method, int updates) {
        RoundContextUtil.withMdc(roundId, () ->
            log.info("[AggregationFlow] stage={} method={} updates={} roundId={}",
                UPDATES_RECEIVED, method, updates, roundId)
        );
    }

    /** Logs {@code AGGREGATION_COMPLETED} or {@code AGGREGATION_FAILED} depending on the result. */
    public void aggregationFinished(String roundId, AggregationResult result) {
        if (result.success()) {
            GlobalModel model = result.globalModel();
            RoundContextUtil.withMdc(roundId, () ->
                log.info("[AggregationFlow] stage={} version={} method={} accepted={} rejected={} "
                         + "suspected={} epsilonSpent={} seconds={} roundId={}",
                    AGGREGATION_COMPLETED, model.version(), model.aggregationMethod(),
                    result.updatesAccepted(), result.updatesRejected(), result.suspectedByzantine(),
                    result.privacyEpsilonSpent() != null ? result.privacyEpsilonSpent() : "N/A",
                    result.aggregationTimeSeconds(), roundId)
            );
        } else {
            RoundContextUtil.withMdc(roundId, () ->
                log.warn("[AggregationFlow] stage={} received={} error={} roundId={}",
                    AGGREGATION_FAILED, result.updatesReceived(), result.errorMessage(), roundId)
            );
        }
    }

    public void modelSynchronized(String roundId, GlobalModel model, boolean adopted) {
        String stage = adopted ? MODEL_ADOPTED : MODEL_REJECTED;
        RoundContextUtil.withMdc(roundId, () ->
            log.info("[AggregationFlow] stage={} version={} hash={} previousHash={} roundId={}",
                stage, model.version(), model.weightsHash(), model.previousHash(), roundId)
        );
    }
}
