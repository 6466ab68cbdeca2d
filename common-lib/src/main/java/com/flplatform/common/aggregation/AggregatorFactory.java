package com.flplatform.common.aggregation;

import com.flplatform.common.exception.AggregationException;
import com.flplatform.common.stats.DistanceBackends;

import java.util.Locale;
import java.util.Set;

/**
 * Name-keyed construction of aggregation strategies.
 *
 * <p>The three entry points nest: the enhanced and secure factories handle their own names
 * and defer to {@link #getAggregator} for the base ones. An unknown name is a configuration
 * error and throws {@link AggregationException}; there is no silent default.
 */
public final class AggregatorFactory {

    private static final String COMPONENT = "AggregatorFactory";

    public static final Set<String> BASE_METHODS = Set.of(
        FedAvgAggregator.NAME, KrumAggregator.NAME, TrimmedMeanAggregator.NAME, MedianAggregator.NAME);
    public static final Set<String> ENHANCED_METHODS = Set.of(
        EnhancedKrumAggregator.NAME, AdaptiveTrimmedMeanAggregator.NAME, AdaptiveAggregator.NAME);
    public static final Set<String> SECURE_METHODS = Set.of(
        SecureFedAvgAggregator.NAME, SecureKrumAggregator.NAME);

    private AggregatorFactory() {}

    public static Aggregator getAggregator(String method) {
        return getAggregator(method, AggregatorSettings.defaults());
    }

    public static Aggregator getAggregator(String method, AggregatorSettings settings) {
        return switch (normalize(method)) {
            case FedAvgAggregator.NAME      -> new FedAvgAggregator();
            case KrumAggregator.NAME        -> new KrumAggregator(settings.f(), settings.multiKrum(), settings.m());
            case TrimmedMeanAggregator.NAME -> new TrimmedMeanAggregator(settings.beta());
            case MedianAggregator.NAME      -> new MedianAggregator();
            default -> throw unknown(method, BASE_METHODS);
        };
    }

    public static Aggregator getEnhancedAggregator(String method, AggregatorSettings settings) {
        return getEnhancedAggregator(method, settings, TrustScoreProvider.FULL_TRUST);
    }

    public static Aggregator getEnhancedAggregator(String method, AggregatorSettings settings,
                                                   TrustScoreProvider trustScores) {
        String name = normalize(method);
        return switch (name) {
            case EnhancedKrumAggregator.NAME -> new EnhancedKrumAggregator(settings.f(), settings.multiKrum(),
                settings.m(), settings.adaptiveF(), trustScores, DistanceBackends.detect());
            case AdaptiveTrimmedMeanAggregator.NAME -> new AdaptiveTrimmedMeanAggregator(
                settings.beta(), settings.adaptiveBeta(), settings.outlierMethod());
            case AdaptiveAggregator.NAME -> new AdaptiveAggregator(
                settings.varianceThreshold(), settings.varianceSampleDims());
            default -> {
                if (!BASE_METHODS.contains(name)) throw unknown(method, ENHANCED_METHODS);
                yield getAggregator(name, settings);
            }
        };
    }

    public static Aggregator getSecureAggregator(String method, AggregatorSettings settings) {
        String name = normalize(method);
        return switch (name) {
            case SecureFedAvgAggregator.NAME -> new SecureFedAvgAggregator(
                settings.dpConfig(), settings.enableDp());
            case SecureKrumAggregator.NAME -> new SecureKrumAggregator(
                settings.f(), settings.multiKrum(), settings.m(), settings.dpConfig(), settings.enableDp());
            default -> {
                if (!BASE_METHODS.contains(name)) throw unknown(method, SECURE_METHODS);
                yield getAggregator(name, settings);
            }
        };
    }

    /** Resolves any known name through the widest factory that owns it. */
    public static Aggregator create(String method, AggregatorSettings settings) {
        String name = normalize(method);
        if (SECURE_METHODS.contains(name)) {
            return getSecureAggregator(name, settings);
        }
        return getEnhancedAggregator(name, settings);
    }

    private static String normalize(String method) {
        if (method == null || method.isBlank()) {
            throw new AggregationException(COMPONENT, "aggregation method must not be blank");
        }
        return method.trim().toLowerCase(Locale.ROOT);
    }

    private static AggregationException unknown(String method, Set<String> extra) {
        return new AggregationException(COMPONENT,
            "Unknown aggregation method: " + method + " (known: " + BASE_METHODS + " + " + extra + ")");
    }
}
