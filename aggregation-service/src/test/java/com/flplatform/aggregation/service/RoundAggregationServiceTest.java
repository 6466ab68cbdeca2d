package com.flplatform.aggregation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flplatform.aggregation.logger.AggregationFlowLogger;
import com.flplatform.common.aggregation.Aggregator;
import com.flplatform.common.aggregation.FedAvgAggregator;
import com.flplatform.common.aggregation.KrumAggregator;
import com.flplatform.common.aggregation.SecureFedAvgAggregator;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.model.ModelWeights;
import com.flplatform.common.privacy.DPConfig;
import com.flplatform.common.protocol.FLMessageType;
import com.flplatform.common.protocol.SignatureBackends;
import com.flplatform.common.protocol.SignedMessage;
import com.flplatform.common.protocol.SigningKeys;
import com.flplatform.common.sync.ModelSynchronizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RoundAggregationServiceTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private RoundAggregationService service(Aggregator aggregator) {
        return new RoundAggregationService(aggregator, new ModelSynchronizer("coordinator-1"),
            new AggregationFlowLogger(), mapper);
    }

    private static ModelUpdate update(String node, int round, double... values) {
        return ModelUpdate.of(node, round, ModelWeights.flat(values), 100);
    }

    @Nested
    @DisplayName("aggregateRound()")
    class RoundTests {

        @Test
        @DisplayName("successful round is adopted and chained to the previous model")
        void chainsRounds() {
            RoundAggregationService service = service(new FedAvgAggregator());

            AggregationResult first = service.aggregateRound(1,
                List.of(update("a", 1, 1.0, 1.0), update("b", 1, 3.0, 3.0)));
            AggregationResult second = service.aggregateRound(2,
                List.of(update("a", 2, 2.0, 2.0), update("b", 2, 4.0, 4.0)));

            assertTrue(first.success());
            assertTrue(second.success());
            assertEquals(1, first.globalModel().version());
            assertEquals(2, second.globalModel().version());
            assertEquals(first.globalModel().weightsHash(), second.globalModel().previousHash());
            assertSame(second.globalModel(), service.getSynchronizer().getCurrentModel());
            assertTrue(service.getSynchronizer().verifyHistoryChain().valid());
        }

        @Test
        @DisplayName("failed round leaves the synchronizer untouched")
        void failureNotAdopted() {
            RoundAggregationService service = service(new KrumAggregator(1));

            AggregationResult result = service.aggregateRound(1, List.of(update("a", 1, 1.0)));

            assertFalse(result.success());
            assertNull(service.getSynchronizer().getCurrentModel());
        }

        @Test
        @DisplayName("null update list is treated as empty")
        void nullUpdates() {
            AggregationResult result = service(new FedAvgAggregator()).aggregateRound(1, null);
            assertFalse(result.success());
            assertEquals("No updates to aggregate", result.errorMessage());
        }

        @Test
        @DisplayName("an external initial model becomes the previous model of round one")
        void externalInitialModel() {
            RoundAggregationService service = service(new FedAvgAggregator());
            GlobalModel initial = GlobalModel.initial(5, 0, ModelWeights.flat(0.0, 0.0));
            assertTrue(service.acceptExternalModel(initial, "bootstrap"));

            AggregationResult result = service.aggregateRound(1, List.of(update("a", 1, 1.0, 1.0)));

            assertEquals(6, result.globalModel().version());
            assertEquals(initial.weightsHash(), result.globalModel().previousHash());
        }
    }

    @Nested
    @DisplayName("privacy, announcements and rendering")
    class SupportTests {

        @Test
        @DisplayName("training may continue until the DP budget is spent")
        void canContinue() {
            RoundAggregationService plain = service(new FedAvgAggregator());
            RoundAggregationService secure = service(
                new SecureFedAvgAggregator(new DPConfig(1.0, 1e-5, 1.0, 1.1, 1, 9L), true));

            assertTrue(plain.canContinueTraining());
            assertTrue(secure.canContinueTraining());
            secure.aggregateRound(1, List.of(update("a", 1, 0.1, 0.1)));
            assertFalse(secure.canContinueTraining());
        }

        @Test
        @DisplayName("announcement is a signed global_model message, empty before the first model")
        void announce() {
            RoundAggregationService service = service(new FedAvgAggregator());
            SigningKeys keys = SignatureBackends.ED25519.generateKeys();
            assertEquals(Optional.empty(), service.announceCurrentModel(keys));

            service.aggregateRound(1, List.of(update("a", 1, 1.0)));
            SignedMessage message = service.announceCurrentModel(keys).orElseThrow();

            assertEquals(FLMessageType.GLOBAL_MODEL, message.messageType());
            assertEquals("coordinator-1", message.senderId());
            assertTrue(message.verify(keys.publicKey()));
        }

        @Test
        @DisplayName("describe renders snake_case JSON")
        void describe() {
            RoundAggregationService service = service(new FedAvgAggregator());
            AggregationResult result = service.aggregateRound(1, List.of(update("a", 1, 1.0)));

            String json = service.describe(result);

            assertTrue(json.contains("\"success\":true"));
            assertTrue(json.contains("\"updates_accepted\":1"));
            assertTrue(json.contains("\"aggregation_method\":\"fedavg\""));
        }
    }
}
