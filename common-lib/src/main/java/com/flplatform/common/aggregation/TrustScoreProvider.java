package com.flplatform.common.aggregation;

/**
 * Source of per-node trust in {@code [0, 1]} used by adaptive-f Krum.
 * Nodes without a score are treated as fully trusted.
 */
@FunctionalInterface
public interface TrustScoreProvider {

    double DEFAULT_TRUST = 1.0;

    TrustScoreProvider FULL_TRUST = nodeId -> DEFAULT_TRUST;

    double trustOf(String nodeId);
}
