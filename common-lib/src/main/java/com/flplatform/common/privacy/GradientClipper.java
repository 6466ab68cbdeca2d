package com.flplatform.common.privacy;

import com.flplatform.common.stats.RobustStatistics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * L2 norm clipping. Vectors above {@code maxNorm} are rescaled onto the norm ball;
 * others are returned as copies. Tracks the fraction of calls that rescaled.
 */
public class GradientClipper {

    private final double maxNorm;
    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong clippedCalls = new AtomicLong();

    public GradientClipper(double maxNorm) {
        if (!(maxNorm > 0.0)) {
            throw new IllegalArgumentException("maxNorm must be positive, got " + maxNorm);
        }
        this.maxNorm = maxNorm;
    }

    public double getMaxNorm() {
        return maxNorm;
    }

    public ClipResult clip(double[] vector) {
        double norm = RobustStatistics.l2Norm(vector);
        totalCalls.incrementAndGet();
        if (norm <= maxNorm) {
            return new ClipResult(vector.clone(), norm, false);
        }
        clippedCalls.incrementAndGet();
        double scale = maxNorm / norm;
        double[] clipped = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            clipped[i] = vector[i] * scale;
        }
        return new ClipResult(clipped, norm, true);
    }

    /** Fraction of {@link #clip} calls that rescaled; 0 before the first call. */
    public double getClipRate() {
        long total = totalCalls.get();
        return total == 0 ? 0.0 : (double) clippedCalls.get() / total;
    }

    /**
     * @param vector       clipped (or copied) values
     * @param originalNorm L2 norm before clipping
     * @param clipped      whether rescaling happened
     */
    public record ClipResult(double[] vector, double originalNorm, boolean clipped) {}
}
