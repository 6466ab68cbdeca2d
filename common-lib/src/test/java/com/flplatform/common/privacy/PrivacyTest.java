package com.flplatform.common.privacy;

import com.flplatform.common.stats.RobustStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class PrivacyTest {

    @Nested
    @DisplayName("PrivacyBudget")
    class BudgetTests {

        @Test
        @DisplayName("spend accumulates and remaining floors at zero")
        void accumulates() {
            PrivacyBudget budget = new PrivacyBudget();
            budget.addRound(0.4, 1.1);
            budget.addRound(0.4, 1.1);

            assertEquals(0.8, budget.epsilonSpent(), 1e-12);
            assertEquals(2, budget.roundsParticipated());
            assertEquals(0.2, budget.remaining(1.0), 1e-12);
            assertEquals(0.4, budget.averageEpsilonPerRound(), 1e-12);
            assertFalse(budget.isExhausted(1.0));

            budget.addRound(0.4, 1.1);
            assertEquals(0.0, budget.remaining(1.0), 0.0);
            assertTrue(budget.isExhausted(1.0));
            assertEquals(3, budget.entries().get(2).round());
        }

        @Test
        @DisplayName("empty ledger averages to zero")
        void emptyAverage() {
            assertEquals(0.0, new PrivacyBudget().averageEpsilonPerRound(), 0.0);
        }

        @Test
        @DisplayName("negative or non-finite ε is rejected and nothing is recorded")
        void rejectsNegative() {
            PrivacyBudget budget = new PrivacyBudget();
            assertThrows(IllegalArgumentException.class, () -> budget.addRound(-0.1, 1.0));
            assertThrows(IllegalArgumentException.class, () -> budget.addRound(Double.NaN, 1.0));
            assertEquals(0, budget.roundsParticipated());
            assertEquals(0.0, budget.epsilonSpent(), 0.0);
        }
    }

    @Nested
    @DisplayName("GradientClipper")
    class ClipperTests {

        @Test
        @DisplayName("rescales onto the norm ball and leaves short vectors alone")
        void clips() {
            GradientClipper clipper = new GradientClipper(1.0);

            GradientClipper.ClipResult big = clipper.clip(new double[]{3.0, 4.0});
            GradientClipper.ClipResult small = clipper.clip(new double[]{0.3, 0.4});

            assertTrue(big.clipped());
            assertEquals(5.0, big.originalNorm(), 1e-12);
            assertArrayEquals(new double[]{0.6, 0.8}, big.vector(), 1e-12);
            assertFalse(small.clipped());
            assertArrayEquals(new double[]{0.3, 0.4}, small.vector(), 0.0);
            assertEquals(0.5, clipper.getClipRate(), 1e-12);
        }

        @Test
        @DisplayName("clipped norm never exceeds the bound")
        void normBound() {
            GradientClipper clipper = new GradientClipper(0.5);
            double[] clipped = clipper.clip(new double[]{10.0, -7.0, 3.0, 1e6}).vector();
            assertTrue(RobustStatistics.l2Norm(clipped) <= 0.5 + 1e-12);
        }

        @Test
        @DisplayName("non-positive bound is rejected")
        void invalidBound() {
            assertThrows(IllegalArgumentException.class, () -> new GradientClipper(0.0));
        }
    }

    @Nested
    @DisplayName("GaussianNoiseGenerator")
    class NoiseTests {

        @Test
        @DisplayName("same seed gives the same noise")
        void deterministic() {
            double[] base = {1.0, 2.0, 3.0};
            double[] a = new GaussianNoiseGenerator(7L).addNoise(base, 0.5);
            double[] b = new GaussianNoiseGenerator(7L).addNoise(base, 0.5);
            assertArrayEquals(a, b, 0.0);
            assertFalse(Arrays.equals(base, a));
        }

        @Test
        @DisplayName("calibration follows sqrt(2 ln(1.25/δ)) / ε and grows as ε shrinks")
        void calibration() {
            double sigma = GaussianNoiseGenerator.calibrateNoise(1.0, 1.0, 1e-5);
            assertEquals(Math.sqrt(2.0 * Math.log(1.25e5)), sigma, 1e-12);
            assertTrue(GaussianNoiseGenerator.calibrateNoise(1.0, 0.1, 1e-5) > sigma);
            assertThrows(IllegalArgumentException.class, () -> GaussianNoiseGenerator.calibrateNoise(1.0, 0.0, 1e-5));
            assertThrows(IllegalArgumentException.class, () -> GaussianNoiseGenerator.calibrateNoise(1.0, 1.0, 1.0));
        }
    }

    @Nested
    @DisplayName("DifferentialPrivacy")
    class EngineTests {

        @Test
        @DisplayName("σ scales with the multiplier and the sample count floor")
        void sigma() {
            DifferentialPrivacy dp = new DifferentialPrivacy(new DPConfig(1.0, 1e-5, 2.0, 1.5, 10, 1L));
            assertEquals(0.3, dp.noiseSigma(10), 1e-12);
            assertEquals(3.0, dp.noiseSigma(0), 1e-12);
        }

        @Test
        @DisplayName("zero multiplier calibrates from the per-round ε")
        void calibratedSigma() {
            DifferentialPrivacy dp = new DifferentialPrivacy(new DPConfig(1.0, 1e-5, 1.0, 0.0, 10, 1L));
            assertEquals(GaussianNoiseGenerator.calibrateNoise(1.0, 0.1, 1e-5), dp.noiseSigma(1), 1e-12);
        }

        @Test
        @DisplayName("privatize clips before adding noise")
        void privatize() {
            DifferentialPrivacy dp = new DifferentialPrivacy(new DPConfig(1.0, 1e-5, 1.0, 1.0, 10, 3L));
            DifferentialPrivacy.PrivatizedVector out = dp.privatize(new double[]{30.0, 40.0}, 1_000_000);

            assertEquals(50.0, out.originalNorm(), 1e-12);
            assertEquals(1e-6, out.noiseScale(), 1e-18);
            assertEquals(1.0, RobustStatistics.l2Norm(out.vector()), 1e-4);
        }

        @Test
        @DisplayName("recordRound spends ε/maxRounds until training should stop")
        void recordRound() {
            DifferentialPrivacy dp = new DifferentialPrivacy(new DPConfig(1.0, 1e-5, 1.0, 1.1, 2, 1L));

            assertEquals(0.5, dp.recordRound(), 1e-12);
            assertTrue(dp.canContinueTraining());
            dp.recordRound();
            assertFalse(dp.canContinueTraining());
            assertEquals(0.0, dp.remainingBudget(), 0.0);
            assertEquals(1.0, dp.getPrivacySpent().epsilon(), 1e-12);
            assertEquals(1e-5, dp.getPrivacySpent().delta(), 0.0);
        }

        @Test
        @DisplayName("config validation")
        void config() {
            assertThrows(IllegalArgumentException.class, () -> new DPConfig(0.0, 1e-5, 1.0, 1.1, 10, 1L));
            assertThrows(IllegalArgumentException.class, () -> new DPConfig(1.0, 0.0, 1.0, 1.1, 10, 1L));
            assertThrows(IllegalArgumentException.class, () -> new DPConfig(1.0, 1e-5, -1.0, 1.1, 10, 1L));
            assertEquals(0.01, DPConfig.defaults().perRoundEpsilon(), 1e-12);
        }
    }
}
