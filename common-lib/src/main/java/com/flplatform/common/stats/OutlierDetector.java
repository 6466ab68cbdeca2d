package com.flplatform.common.stats;

import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Flags whole updates whose vector is an outlier in at least one coordinate.
 *
 * <p>Fewer than three vectors are never filtered. Returned indices are sorted ascending.
 * Stateless and thread-safe.
 */
public final class OutlierDetector {

    static final double IQR_FACTOR      = 1.5;
    static final double SCORE_THRESHOLD = 3.0;
    static final double EPSILON         = 1e-8;

    private OutlierDetector() {}

    public static SortedSet<Integer> detect(List<double[]> vectors, OutlierMethod method) {
        SortedSet<Integer> outliers = new TreeSet<>();
        int n = vectors.size();
        if (n < 3) {
            return outliers;
        }
        int dim = vectors.get(0).length;
        for (int d = 0; d < dim; d++) {
            double[] column = RobustStatistics.column(vectors, d);
            switch (method) {
                case IQR    -> flagIqr(column, outliers);
                case ZSCORE -> flagZScore(column, outliers);
                case MAD    -> flagMad(column, outliers);
            }
        }
        return outliers;
    }

    private static void flagIqr(double[] column, SortedSet<Integer> outliers) {
        double[] sorted = column.clone();
        Arrays.sort(sorted);
        double q1 = RobustStatistics.percentileOfSorted(sorted, 25.0);
        double q3 = RobustStatistics.percentileOfSorted(sorted, 75.0);
        double iqr = q3 - q1;
        double lower = q1 - IQR_FACTOR * iqr;
        double upper = q3 + IQR_FACTOR * iqr;
        for (int i = 0; i < column.length; i++) {
            if (column[i] < lower || column[i] > upper) {
                outliers.add(i);
            }
        }
    }

    private static void flagZScore(double[] column, SortedSet<Integer> outliers) {
        double mean = RobustStatistics.mean(column);
        double std  = RobustStatistics.standardDeviation(column);
        for (int i = 0; i < column.length; i++) {
            if (Math.abs(column[i] - mean) / (std + EPSILON) > SCORE_THRESHOLD) {
                outliers.add(i);
            }
        }
    }

    private static void flagMad(double[] column, SortedSet<Integer> outliers) {
        double median = RobustStatistics.median(column);
        double[] deviations = new double[column.length];
        for (int i = 0; i < column.length; i++) {
            deviations[i] = Math.abs(column[i] - median);
        }
        double mad = RobustStatistics.median(deviations);
        for (int i = 0; i < column.length; i++) {
            if (deviations[i] / (mad + EPSILON) > SCORE_THRESHOLD) {
                outliers.add(i);
            }
        }
    }
}
