package com.flplatform.common.stats;

import java.util.List;

/**
 * Strategy for computing the pairwise Euclidean distance matrix.
 *
 * <p>Implementations must produce bit-identical matrices for the same ordered input;
 * they may differ only in how the O(n²) pair loop is scheduled. Resolve a backend once
 * through {@link DistanceBackends#detect()} and inject it, rather than branching on
 * capability inside aggregation.
 */
public interface DistanceBackend {

    /** Short identifier reported in aggregation diagnostics. */
    String name();

    double[][] distances(List<double[]> vectors);
}
