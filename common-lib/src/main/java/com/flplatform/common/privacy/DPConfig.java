package com.flplatform.common.privacy;

/**
 * Differential-privacy parameters shared by the clipper, the noise generator and the
 * budget ledger.
 *
 * @param targetEpsilon   total ε the training run may spend
 * @param targetDelta     δ of the (ε, δ) guarantee, in (0, 1)
 * @param maxGradNorm     L2 clipping bound, also the per-update sensitivity
 * @param noiseMultiplier σ as a multiple of the sensitivity; 0 means calibrate from ε/δ
 * @param maxRounds       rounds the budget is spread over
 * @param seed            noise generator seed
 */
public record DPConfig(
    double targetEpsilon,
    double targetDelta,
    double maxGradNorm,
    double noiseMultiplier,
    int maxRounds,
    long seed
) {

    public static final double DEFAULT_EPSILON          = 1.0;
    public static final double DEFAULT_DELTA            = 1e-5;
    public static final double DEFAULT_MAX_GRAD_NORM    = 1.0;
    public static final double DEFAULT_NOISE_MULTIPLIER = 1.1;
    public static final int    DEFAULT_MAX_ROUNDS       = 100;
    public static final long   DEFAULT_SEED             = 42L;

    public DPConfig {
        if (!(targetEpsilon > 0.0)) {
            throw new IllegalArgumentException("targetEpsilon must be positive, got " + targetEpsilon);
        }
        if (!(targetDelta > 0.0 && targetDelta < 1.0)) {
            throw new IllegalArgumentException("targetDelta must be in (0, 1), got " + targetDelta);
        }
        if (!(maxGradNorm > 0.0)) {
            throw new IllegalArgumentException("maxGradNorm must be positive, got " + maxGradNorm);
        }
        if (noiseMultiplier < 0.0) {
            throw new IllegalArgumentException("noiseMultiplier must be non-negative, got " + noiseMultiplier);
        }
    }

    public static DPConfig defaults() {
        return new DPConfig(DEFAULT_EPSILON, DEFAULT_DELTA, DEFAULT_MAX_GRAD_NORM,
            DEFAULT_NOISE_MULTIPLIER, DEFAULT_MAX_ROUNDS, DEFAULT_SEED);
    }

    /** {@code targetEpsilon / max(1, maxRounds)}. */
    public double perRoundEpsilon() {
        return targetEpsilon / Math.max(1, maxRounds);
    }
}
