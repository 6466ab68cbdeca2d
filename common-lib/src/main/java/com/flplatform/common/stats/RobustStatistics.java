package com.flplatform.common.stats;

import java.util.Arrays;
import java.util.List;

/**
 * Numeric primitives shared by the aggregation strategies.
 *
 * <p>All operations work on flat {@code double[]} parameter vectors, are pure and
 * deterministic for identical ordered input: summation always runs in input order, so
 * repeated calls are bit-identical. Callers validate that vectors share one dimension.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class RobustStatistics {

    private RobustStatistics() {}

    public static double euclideanDistance(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Vectors must have same length: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    public static double l2Norm(double[] v) {
        double sum = 0.0;
        for (double x : v) sum += x * x;
        return Math.sqrt(sum);
    }

    /** Symmetric n×n Euclidean distance matrix with a zero diagonal. O(n²·d). */
    public static double[][] pairwiseDistances(List<double[]> vectors) {
        int n = vectors.size();
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double dist = euclideanDistance(vectors.get(i), vectors.get(j));
                distances[i][j] = dist;
                distances[j][i] = dist;
            }
        }
        return distances;
    }

    /**
     * Weighted mean of vectors. Weights are used as given; a non-positive total falls back
     * to a divisor of 1.0.
     */
    public static double[] weightedAverage(List<double[]> vectors, double[] weights) {
        if (vectors.isEmpty()) {
            return new double[0];
        }
        double totalWeight = 0.0;
        for (double w : weights) totalWeight += w;
        if (totalWeight <= 0.0) totalWeight = 1.0;

        int dim = vectors.get(0).length;
        double[] result = new double[dim];
        for (int k = 0; k < vectors.size(); k++) {
            double normWeight = weights[k] / totalWeight;
            double[] vec = vectors.get(k);
            for (int i = 0; i < dim; i++) {
                result[i] += vec[i] * normWeight;
            }
        }
        return result;
    }

    /** Median of an already sorted array; even sizes average the two middle values. */
    public static double medianOfSorted(double[] sorted) {
        int n = sorted.length;
        int mid = n / 2;
        return (n % 2 == 0) ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }

    public static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return medianOfSorted(sorted);
    }

    /** Values of coordinate {@code d} across all vectors, in input order. */
    public static double[] column(List<double[]> vectors, int d) {
        double[] values = new double[vectors.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = vectors.get(i)[d];
        }
        return values;
    }

    public static double[] coordinateMedian(List<double[]> vectors) {
        int dim = vectors.get(0).length;
        double[] result = new double[dim];
        for (int d = 0; d < dim; d++) {
            result[d] = median(column(vectors, d));
        }
        return result;
    }

    /**
     * Coordinate-wise trimmed mean: per coordinate, sort, drop {@code trimCount} values from
     * each end, average the rest.
     */
    public static double[] coordinateTrimmedMean(List<double[]> vectors, int trimCount) {
        int n = vectors.size();
        int dim = vectors.get(0).length;
        double[] result = new double[dim];
        for (int d = 0; d < dim; d++) {
            double[] values = column(vectors, d);
            Arrays.sort(values);
            result[d] = mean(values, trimCount, n - trimCount);
        }
        return result;
    }

    /** Mean of {@code values[from, to)}. */
    public static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /** Population variance (divisor n). */
    public static double variance(double[] values) {
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum / values.length;
    }

    /** Population standard deviation (divisor n). */
    public static double standardDeviation(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Mean over coordinates of the cross-update population variance, using only the first
     * {@code sampleDims} coordinates (all coordinates when {@code sampleDims <= 0}).
     * Returns 0.0 for fewer than two vectors or zero dimensions.
     */
    public static double meanCoordinateVariance(List<double[]> vectors, int sampleDims) {
        if (vectors.size() < 2) {
            return 0.0;
        }
        int dim = Integer.MAX_VALUE;
        for (double[] v : vectors) dim = Math.min(dim, v.length);
        if (sampleDims > 0) dim = Math.min(dim, sampleDims);
        if (dim == 0) {
            return 0.0;
        }
        double total = 0.0;
        for (int d = 0; d < dim; d++) {
            total += variance(column(vectors, d));
        }
        return total / dim;
    }

    /**
     * Percentile of a sorted array with linear interpolation between closest ranks
     * ({@code rank = p/100 · (n − 1)}).
     */
    public static double percentileOfSorted(double[] sorted, double percentile) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
