package com.flplatform.aggregation.service;

import com.flplatform.aggregation.logger.AggregationFlowLogger;
import com.flplatform.common.aggregation.AbstractSecureAggregator;
import com.flplatform.common.aggregation.Aggregator;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.protocol.FLMessages;
import com.flplatform.common.protocol.SignedMessage;
import com.flplatform.common.protocol.SigningKeys;
import com.flplatform.common.sync.ModelSynchronizer;
import com.flplatform.common.trace.RoundContextUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs the configured {@link Aggregator} for one finalized round and hands a successful
 * result to the {@link ModelSynchronizer}. The synchronizer's current model is the
 * previous model of the next round.
 */
@Service
public class RoundAggregationService {

    private static final Logger log = LoggerFactory.getLogger(RoundAggregationService.class);

    private final Aggregator aggregator;
    private final ModelSynchronizer synchronizer;
    private final AggregationFlowLogger flowLogger;
    private final ObjectMapper objectMapper;

    public RoundAggregationService(Aggregator aggregator,
                                   ModelSynchronizer synchronizer,
                                   AggregationFlowLogger flowLogger,
                                   ObjectMapper objectMapper) {
        this.aggregator   = aggregator;
        this.synchronizer = synchronizer;
        this.flowLogger   = flowLogger;
        this.objectMapper = objectMapper;
    }

    public AggregationResult aggregateRound(int roundNumber, List<ModelUpdate> updates) {
        String roundId = RoundContextUtil.roundId(synchronizer.getNodeId(), roundNumber);
        List<ModelUpdate> input = updates == null ? List.of() : updates;
        flowLogger.updatesReceived(roundId, aggregator.name(), input.size());

        AggregationResult result = aggregator.aggregate(input, synchronizer.getCurrentModel());
        flowLogger.aggregationFinished(roundId, result);
        if (!result.success()) {
            return result;
        }

        GlobalModel model = result.globalModel();
        boolean adopted = synchronizer.receiveGlobalModel(model, synchronizer.getNodeId());
        flowLogger.modelSynchronized(roundId, model, adopted);
        return result;
    }

    /** Adopts a model produced elsewhere, e.g. an initial model or a peer coordinator's. */
    public boolean acceptExternalModel(GlobalModel model, String source) {
        return synchronizer.receiveGlobalModel(model, source);
    }

    /** False once a privacy-aware aggregator has exhausted its ε budget. */
    public boolean canContinueTraining() {
        if (aggregator instanceof AbstractSecureAggregator secure && secure.isDpEnabled()) {
            return secure.getDifferentialPrivacy().canContinueTraining();
        }
        return true;
    }

    /** Signed {@code global_model} announcement of the current model, if there is one. */
    public Optional<SignedMessage> announceCurrentModel(SigningKeys keys) {
        GlobalModel current = synchronizer.getCurrentModel();
        if (current == null) {
            return Optional.empty();
        }
        return Optional.of(FLMessages.globalModel(synchronizer.getNodeId(), current).sign(keys));
    }

    /** JSON rendering of a result for operators and audit logs. */
    public String describe(AggregationResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("[RoundAggregationService] Unable to render result: {}", e.getMessage());
            return String.valueOf(result);
        }
    }

    public ModelSynchronizer getSynchronizer() {
        return synchronizer;
    }

    public Aggregator getAggregator() {
        return aggregator;
    }
}
