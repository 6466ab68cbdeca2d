package com.flplatform.common.aggregation;

import com.flplatform.common.model.AggregationDiagnostics;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.stats.DistanceBackends;
import com.flplatform.common.stats.RobustStatistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Krum and Multi-Krum Byzantine-robust selection.
 *
 * <p>Each update is scored by the sum of its {@code k = n − f − 2} smallest distances to the
 * other updates. Scores are sorted ascending, ties broken by original index:
 * <ul>
 *   <li>single Krum returns the lowest-scored vector as-is</li>
 *   <li>Multi-Krum returns the sample-weighted mean of the {@code min(m, n − f)} lowest</li>
 * </ul>
 * The {@code f} highest-scored updates are reported as suspected Byzantine.
 * Requires {@code n ≥ 2f + 3}.
 */
public class KrumAggregator extends AbstractAggregator {

    public static final String NAME = "krum";

    private final int f;
    private final boolean multiKrum;
    private final int m;

    public KrumAggregator(int f) {
        this(f, false, 1);
    }

    public KrumAggregator(int f, boolean multiKrum, int m) {
        this(NAME, f, multiKrum, m);
    }

    protected KrumAggregator(String name, int f, boolean multiKrum, int m) {
        super(name);
        if (f < 0) {
            throw new IllegalArgumentException("f must be non-negative, got " + f);
        }
        this.f = f;
        this.multiKrum = multiKrum;
        this.m = Math.max(1, m);
    }

    public int getF()             { return f; }
    public boolean isMultiKrum()  { return multiKrum; }
    public int getM()             { return m; }

    public static int minimumUpdates(int f) {
        return 2 * f + 3;
    }

    @Override
    protected String checkQuorum(int n) {
        int required = minimumUpdates(f);
        return n < required ? "Krum requires at least " + required + " updates, got " + n : null;
    }

    // ── extension points ─────────────────────────────────────────────────────

    /** f used for scoring this round. */
    protected int effectiveF(List<ModelUpdate> updates) {
        return f;
    }

    protected Distances distanceMatrix(List<double[]> vectors) {
        return new Distances(DistanceBackends.PAIRWISE.distances(vectors), DistanceBackends.PAIRWISE.name());
    }

    protected String methodLabel(int effectiveF) {
        return NAME + "_f" + effectiveF;
    }

    // ── algorithm ────────────────────────────────────────────────────────────

    @Override
    protected AggregationResult combine(List<ModelUpdate> updates, List<double[]> vectors,
                                        GlobalModel previousModel, long startNanos) {
        int n = updates.size();
        int usedF = effectiveF(updates);
        Distances distances = distanceMatrix(vectors);
        double[] scores = scores(distances.matrix(), n - usedF - 2);

        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) order.add(i);
        order.sort(Comparator.<Integer>comparingDouble(i -> scores[i]).thenComparingInt(i -> i));

        int selectedCount = multiKrum ? Math.min(m, n - usedF) : 1;
        List<Integer> selected = order.subList(0, selectedCount);

        List<String> suspected = new ArrayList<>(usedF);
        for (int i = 0; i < usedF; i++) {
            suspected.add(updates.get(order.get(n - 1 - i)).nodeId());
        }

        double[] aggregated;
        if (selectedCount == 1) {
            aggregated = vectors.get(selected.get(0)).clone();
        } else {
            List<double[]> chosen = new ArrayList<>(selectedCount);
            double[] weights = new double[selectedCount];
            for (int j = 0; j < selectedCount; j++) {
                chosen.add(vectors.get(selected.get(j)));
                weights[j] = updates.get(selected.get(j)).effectiveSamples();
            }
            aggregated = RobustStatistics.weightedAverage(chosen, weights);
        }

        GlobalModel model = buildGlobalModel(updates, previousModel, aggregated,
            selectedCount, rawSampleTotal(updates), methodLabel(usedF));

        Map<String, Double> scoreByNode = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            scoreByNode.put(updates.get(i).nodeId(), scores[i]);
        }
        AggregationDiagnostics diagnostics = AggregationDiagnostics.empty()
            .withSelectedNodeIds(selected.stream().map(i -> updates.get(i).nodeId()).toList())
            .withKrum(scoreByNode, usedF, distances.backend());

        return AggregationResult.success(model, n, selectedCount, suspected,
            elapsedSeconds(startNanos), diagnostics);
    }

    /** Distance matrix plus the name of the backend that produced it. */
    protected record Distances(double[][] matrix, String backend) {}

    static double[] scores(double[][] distances, int k) {
        int n = distances.length;
        double[] scores = new double[n];
        double[] others = new double[n - 1];
        for (int i = 0; i < n; i++) {
            int idx = 0;
            for (int j = 0; j < n; j++) {
                if (j != i) others[idx++] = distances[i][j];
            }
            Arrays.sort(others);
            double sum = 0.0;
            for (int j = 0; j < k && j < others.length; j++) sum += others[j];
            scores[i] = sum;
        }
        return scores;
    }
}
