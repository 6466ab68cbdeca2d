package com.flplatform.common.privacy;

import com.flplatform.common.stats.RobustStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * DP-SGD style engine: clip to {@code maxGradNorm}, add Gaussian noise, account ε per round.
 *
 * <p>σ for an update trained on {@code n} samples is
 * {@code noiseMultiplier · maxGradNorm / max(1, n)}, or, when {@code noiseMultiplier} is 0,
 * the Gaussian-mechanism calibration for the per-round ε at sensitivity
 * {@code maxGradNorm / max(1, n)}.
 *
 * <p>Budget exhaustion is advisory: {@link #canContinueTraining()} turns false, nothing
 * else changes.
 */
public class DifferentialPrivacy {

    private static final Logger log = LoggerFactory.getLogger(DifferentialPrivacy.class);

    private final DPConfig config;
    private final GradientClipper clipper;
    private final GaussianNoiseGenerator noise;
    private final PrivacyBudget budget = new PrivacyBudget();

    public DifferentialPrivacy(DPConfig config) {
        this.config = Objects.requireNonNullElse(config, DPConfig.defaults());
        this.clipper = new GradientClipper(this.config.maxGradNorm());
        this.noise = new GaussianNoiseGenerator(this.config.seed());
    }

    public DPConfig getConfig() {
        return config;
    }

    public PrivacyBudget getBudget() {
        return budget;
    }

    public GradientClipper getClipper() {
        return clipper;
    }

    public double noiseSigma(int numSamples) {
        double sensitivity = config.maxGradNorm() / Math.max(1, numSamples);
        if (config.noiseMultiplier() > 0.0) {
            return config.noiseMultiplier() * sensitivity;
        }
        return GaussianNoiseGenerator.calibrateNoise(sensitivity, config.perRoundEpsilon(), config.targetDelta());
    }

    /** Clip then noise. */
    public PrivatizedVector privatize(double[] vector, int numSamples) {
        GradientClipper.ClipResult clipped = clipper.clip(vector);
        double sigma = noiseSigma(numSamples);
        return new PrivatizedVector(noise.addNoise(clipped.vector(), sigma), clipped.originalNorm(), sigma);
    }

    /** Noise only, for vectors already clipped by the caller. */
    public PrivatizedVector addNoise(double[] vector, int numSamples) {
        double sigma = noiseSigma(numSamples);
        return new PrivatizedVector(noise.addNoise(vector, sigma), RobustStatistics.l2Norm(vector), sigma);
    }

    /** Spends one round's ε ({@code targetEpsilon / maxRounds}) and returns it. */
    public double recordRound() {
        double epsilon = config.perRoundEpsilon();
        PrivacyBudget.Entry entry = budget.addRound(epsilon, config.noiseMultiplier());
        if (budget.isExhausted(config.targetEpsilon())) {
            log.warn("[DifferentialPrivacy] BUDGET_EXHAUSTED round={} spent={} target={}",
                entry.round(), budget.epsilonSpent(), config.targetEpsilon());
        }
        return epsilon;
    }

    public double remainingBudget() {
        return budget.remaining(config.targetEpsilon());
    }

    public boolean canContinueTraining() {
        return !budget.isExhausted(config.targetEpsilon());
    }

    public PrivacySpent getPrivacySpent() {
        return new PrivacySpent(budget.epsilonSpent(), config.targetDelta());
    }

    public record PrivacySpent(double epsilon, double delta) {}

    /**
     * @param vector       privatized values
     * @param originalNorm L2 norm of the input before clipping
     * @param noiseScale   σ that was applied
     */
    public record PrivatizedVector(double[] vector, double originalNorm, double noiseScale) {}
}
