package com.flplatform.common.aggregation;

import com.flplatform.common.Fixtures;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.privacy.DPConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flplatform.common.Fixtures.update;
import static org.junit.jupiter.api.Assertions.*;

class SecureAggregatorTest {

    private static final DPConfig CONFIG = new DPConfig(1.0, 1e-5, 1.0, 1.1, 100, 42L);

    private final List<ModelUpdate> updates = List.of(
        update("a", 10, 3.0, 4.0),
        update("b", 10, 0.0, 0.5));

    // ── DP disabled ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("DP disabled")
    class DisabledTests {

        @Test
        @DisplayName("updates are clipped, no noise, budget stays at zero")
        void clipOnly() {
            SecureFedAvgAggregator agg = new SecureFedAvgAggregator(CONFIG, false);

            AggregationResult result = agg.aggregate(updates);

            assertTrue(result.success());
            // [3,4] clipped to [0.6,0.8], averaged with [0,0.5]
            assertArrayEquals(new double[]{0.3, 0.65}, result.globalModel().weights().toFlatVector(), 1e-12);
            assertNull(result.privacyEpsilonSpent());
            assertNull(result.privacyBudgetRemaining());
            assertEquals(0, agg.getDifferentialPrivacy().getBudget().roundsParticipated());
            assertEquals(0.5, agg.getClipper().getClipRate(), 1e-12);
        }

        @Test
        @DisplayName("clip statistics are visible through the privacy engine")
        void sharedClipper() {
            SecureFedAvgAggregator agg = new SecureFedAvgAggregator(CONFIG, true);

            agg.aggregate(updates);

            assertSame(agg.getClipper(), agg.getDifferentialPrivacy().getClipper());
            assertEquals(0.5, agg.getDifferentialPrivacy().getClipper().getClipRate(), 1e-12);
        }
    }

    // ── DP enabled ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("DP enabled")
    class EnabledTests {

        @Test
        @DisplayName("each successful round spends targetEpsilon / maxRounds")
        void spendsPerRound() {
            SecureFedAvgAggregator agg = new SecureFedAvgAggregator(CONFIG, true);

            AggregationResult first = agg.aggregate(updates);
            AggregationResult second = agg.aggregate(updates);

            assertEquals(0.01, first.privacyEpsilonSpent(), 1e-12);
            assertEquals(0.99, first.privacyBudgetRemaining(), 1e-12);
            assertEquals(0.98, second.privacyBudgetRemaining(), 1e-12);
            assertTrue(second.privacyBudgetRemaining() <= first.privacyBudgetRemaining());
        }

        @Test
        @DisplayName("noise is deterministic for a seed and actually perturbs the weights")
        void deterministicNoise() {
            AggregationResult a = new SecureFedAvgAggregator(CONFIG, true).aggregate(updates);
            AggregationResult b = new SecureFedAvgAggregator(CONFIG, true).aggregate(updates);
            AggregationResult clean = new SecureFedAvgAggregator(CONFIG, false).aggregate(updates);

            assertEquals(a.globalModel().weightsHash(), b.globalModel().weightsHash());
            assertNotEquals(clean.globalModel().weightsHash(), a.globalModel().weightsHash());
        }

        @Test
        @DisplayName("budget exhaustion is advisory")
        void exhaustionAdvisory() {
            SecureFedAvgAggregator agg = new SecureFedAvgAggregator(new DPConfig(1.0, 1e-5, 1.0, 1.1, 4, 1L), true);
            for (int i = 0; i < 4; i++) {
                assertTrue(agg.getDifferentialPrivacy().canContinueTraining());
                agg.aggregate(updates);
            }
            assertFalse(agg.getDifferentialPrivacy().canContinueTraining());

            AggregationResult afterExhaustion = agg.aggregate(updates);
            assertTrue(afterExhaustion.success());
            assertEquals(0.0, afterExhaustion.privacyBudgetRemaining(), 0.0);
        }

        @Test
        @DisplayName("failed delegate round spends nothing")
        void failureSpendsNothing() {
            SecureKrumAggregator agg = new SecureKrumAggregator(1, false, 1, CONFIG, true);

            AggregationResult result = agg.aggregate(updates);

            assertFalse(result.success());
            assertTrue(result.errorMessage().contains("at least"));
            assertEquals(0, agg.getDifferentialPrivacy().getBudget().roundsParticipated());
        }

        @Test
        @DisplayName("secure Krum still excludes a far outlier after clipping")
        void secureKrum() {
            List<ModelUpdate> cohort = Fixtures.withOutliers(Fixtures.tightCluster(6, 2, 0.1, 4L), 1, 2, -0.7);
            SecureKrumAggregator agg = new SecureKrumAggregator(1, true, 3,
                new DPConfig(1.0, 1e-5, 1.0, 1.1, 100, 42L), false);

            AggregationResult result = agg.aggregate(cohort);

            assertTrue(result.success());
            assertEquals(List.of("byzantine-0"), result.suspectedByzantine());
        }

        @Test
        @DisplayName("empty input → failure")
        void empty() {
            assertFalse(new SecureFedAvgAggregator(CONFIG, true).aggregate(List.of()).success());
        }
    }
}
