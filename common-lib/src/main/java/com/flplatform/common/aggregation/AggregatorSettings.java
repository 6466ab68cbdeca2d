package com.flplatform.common.aggregation;

import com.flplatform.common.privacy.DPConfig;
import com.flplatform.common.stats.OutlierMethod;

/**
 * Construction parameters for every strategy built by {@link AggregatorFactory}.
 * Each strategy reads only the fields it needs.
 *
 * @param f                  tolerated Byzantine count (Krum family)
 * @param multiKrum          average the best {@code m} instead of picking one
 * @param m                  Multi-Krum selection count
 * @param beta               trim fraction per side (clamped by the strategy)
 * @param adaptiveF          derive f per round from participant trust
 * @param adaptiveBeta       derive β per round from coordinate variance
 * @param outlierMethod      pre-filter for adaptive trimmed mean
 * @param varianceThreshold  adaptive selector switch to trimmed mean
 * @param varianceSampleDims coordinates sampled by the adaptive selector
 * @param dpConfig           privacy parameters for the secure strategies
 * @param enableDp           add noise and spend budget in the secure strategies
 */
public record AggregatorSettings(
    int f,
    boolean multiKrum,
    int m,
    double beta,
    boolean adaptiveF,
    boolean adaptiveBeta,
    OutlierMethod outlierMethod,
    double varianceThreshold,
    int varianceSampleDims,
    DPConfig dpConfig,
    boolean enableDp
) {

    public AggregatorSettings {
        if (f < 0) {
            throw new IllegalArgumentException("f must be non-negative, got " + f);
        }
        if (outlierMethod == null) outlierMethod = OutlierMethod.IQR;
        if (dpConfig == null)      dpConfig = DPConfig.defaults();
    }

    public static AggregatorSettings defaults() {
        return new AggregatorSettings(1, false, 1, TrimmedMeanAggregator.DEFAULT_BETA,
            true, true, OutlierMethod.IQR,
            AdaptiveAggregator.DEFAULT_VARIANCE_THRESHOLD, AdaptiveAggregator.DEFAULT_SAMPLE_DIMS,
            DPConfig.defaults(), true);
    }

    public AggregatorSettings withKrum(int newF, boolean newMultiKrum, int newM) {
        return new AggregatorSettings(newF, newMultiKrum, newM, beta, adaptiveF, adaptiveBeta,
            outlierMethod, varianceThreshold, varianceSampleDims, dpConfig, enableDp);
    }

    public AggregatorSettings withBeta(double newBeta) {
        return new AggregatorSettings(f, multiKrum, m, newBeta, adaptiveF, adaptiveBeta,
            outlierMethod, varianceThreshold, varianceSampleDims, dpConfig, enableDp);
    }

    public AggregatorSettings withAdaptive(boolean newAdaptiveF, boolean newAdaptiveBeta) {
        return new AggregatorSettings(f, multiKrum, m, beta, newAdaptiveF, newAdaptiveBeta,
            outlierMethod, varianceThreshold, varianceSampleDims, dpConfig, enableDp);
    }

    public AggregatorSettings withOutlierMethod(OutlierMethod newMethod) {
        return new AggregatorSettings(f, multiKrum, m, beta, adaptiveF, adaptiveBeta,
            newMethod, varianceThreshold, varianceSampleDims, dpConfig, enableDp);
    }

    public AggregatorSettings withVarianceSelection(double newThreshold, int newSampleDims) {
        return new AggregatorSettings(f, multiKrum, m, beta, adaptiveF, adaptiveBeta,
            outlierMethod, newThreshold, newSampleDims, dpConfig, enableDp);
    }

    public AggregatorSettings withPrivacy(DPConfig newConfig, boolean newEnableDp) {
        return new AggregatorSettings(f, multiKrum, m, beta, adaptiveF, adaptiveBeta,
            outlierMethod, varianceThreshold, varianceSampleDims, newConfig, newEnableDp);
    }
}
