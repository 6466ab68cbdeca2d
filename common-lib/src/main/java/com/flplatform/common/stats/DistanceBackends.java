package com.flplatform.common.stats;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Built-in {@link DistanceBackend} implementations and one-time capability detection.
 *
 * <ul>
 *   <li>{@link #PAIRWISE} — the sequential O(n²) loop; always available.</li>
 *   <li>{@link #PARALLEL} — rows of the upper triangle computed on the common fork-join
 *       pool. Each pair uses the same arithmetic as the sequential loop, so results are
 *       identical.</li>
 * </ul>
 */
public final class DistanceBackends {

    /** Below this many vectors the fork-join overhead outweighs the work. */
    static final int PARALLEL_MIN_VECTORS = 16;

    public static final DistanceBackend PAIRWISE = new DistanceBackend() {
        @Override
        public String name() {
            return "pairwise";
        }

        @Override
        public double[][] distances(List<double[]> vectors) {
            return RobustStatistics.pairwiseDistances(vectors);
        }
    };

    public static final DistanceBackend PARALLEL = new DistanceBackend() {
        @Override
        public String name() {
            return "parallel";
        }

        @Override
        public double[][] distances(List<double[]> vectors) {
            int n = vectors.size();
            if (n < PARALLEL_MIN_VECTORS) {
                return RobustStatistics.pairwiseDistances(vectors);
            }
            double[][] distances = new double[n][n];
            // row i writes only [i][j>i] and [j>i][i]; no two rows touch the same cell
            IntStream.range(0, n).parallel().forEach(i -> {
                for (int j = i + 1; j < n; j++) {
                    double dist = RobustStatistics.euclideanDistance(vectors.get(i), vectors.get(j));
                    distances[i][j] = dist;
                    distances[j][i] = dist;
                }
            });
            return distances;
        }
    };

    private DistanceBackends() {}

    /** Picks {@link #PARALLEL} on multi-core hosts, {@link #PAIRWISE} otherwise. */
    public static DistanceBackend detect() {
        return Runtime.getRuntime().availableProcessors() > 1 ? PARALLEL : PAIRWISE;
    }
}
