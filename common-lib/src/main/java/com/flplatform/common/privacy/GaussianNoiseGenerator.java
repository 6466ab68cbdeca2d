package com.flplatform.common.privacy;

import java.util.Random;

/**
 * Seeded Gaussian noise. Two generators built with the same seed produce the same
 * sequence for the same calls.
 */
public class GaussianNoiseGenerator {

    private final Random random;

    public GaussianNoiseGenerator(long seed) {
        this.random = new Random(seed);
    }

    /**
     * σ of the Gaussian mechanism for an (ε, δ) guarantee:
     * {@code sensitivity · sqrt(2 · ln(1.25 / δ)) / ε}. Smaller ε gives larger σ.
     */
    public static double calibrateNoise(double sensitivity, double epsilon, double delta) {
        if (!(epsilon > 0.0)) {
            throw new IllegalArgumentException("epsilon must be positive, got " + epsilon);
        }
        if (!(delta > 0.0 && delta < 1.0)) {
            throw new IllegalArgumentException("delta must be in (0, 1), got " + delta);
        }
        return sensitivity * Math.sqrt(2.0 * Math.log(1.25 / delta)) / epsilon;
    }

    public synchronized double sample(double sigma) {
        return random.nextGaussian() * sigma;
    }

    /** New vector with independent N(0, σ²) noise added per coordinate. */
    public synchronized double[] addNoise(double[] vector, double sigma) {
        double[] noised = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            noised[i] = vector[i] + random.nextGaussian() * sigma;
        }
        return noised;
    }
}
