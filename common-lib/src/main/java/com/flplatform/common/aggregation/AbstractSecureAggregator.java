package com.flplatform.common.aggregation;

import com.flplatform.common.codec.ParameterCodec;
import com.flplatform.common.model.AggregationResult;
import com.flplatform.common.model.GlobalModel;
import com.flplatform.common.model.ModelUpdate;
import com.flplatform.common.privacy.DPConfig;
import com.flplatform.common.privacy.DifferentialPrivacy;
import com.flplatform.common.privacy.GradientClipper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Privacy wrapper around a base strategy.
 *
 * <ol>
 *   <li>clip every update to {@code maxGradNorm}</li>
 *   <li>add calibrated Gaussian noise (DP enabled only)</li>
 *   <li>delegate to the base strategy</li>
 *   <li>on success, spend {@code targetEpsilon / maxRounds} and attach the privacy fields
 *       (DP enabled only)</li>
 * </ol>
 * With DP disabled the budget stays at zero.
 */
public abstract class AbstractSecureAggregator implements Aggregator {

    private static final Logger log = LoggerFactory.getLogger(AbstractSecureAggregator.class);

    private final String name;
    private final Aggregator delegate;
    private final boolean enableDp;
    private final DifferentialPrivacy dp;
    private final GradientClipper clipper;

    protected AbstractSecureAggregator(String name, Aggregator delegate, DPConfig config, boolean enableDp) {
        this.name = name;
        this.delegate = Objects.requireNonNull(delegate);
        this.enableDp = enableDp;
        this.dp = new DifferentialPrivacy(config);
        this.clipper = dp.getClipper();
    }

    @Override
    public String name() {
        return name;
    }

    public boolean isDpEnabled() {
        return enableDp;
    }

    public DifferentialPrivacy getDifferentialPrivacy() {
        return dp;
    }

    public GradientClipper getClipper() {
        return clipper;
    }

    @Override
    public AggregationResult aggregate(List<ModelUpdate> updates, GlobalModel previousModel) {
        long start = System.nanoTime();
        if (updates == null || updates.isEmpty()) {
            return AggregationResult.failure("No updates to aggregate", AbstractAggregator.elapsedSeconds(start));
        }
        try {
            List<ModelUpdate> prepared = new ArrayList<>(updates.size());
            for (ModelUpdate update : updates) {
                ModelUpdate clipped = clip(update);
                prepared.add(enableDp ? addNoise(clipped) : clipped);
            }

            AggregationResult result = delegate.aggregate(prepared, previousModel);
            if (enableDp && result.success()) {
                double epsilon = dp.recordRound();
                result = result.withPrivacy(epsilon, dp.remainingBudget());
                log.info("[{}] PRIVACY_SPENT epsilon={} remaining={} clipRate={}",
                    name, epsilon, result.privacyBudgetRemaining(), clipper.getClipRate());
            }
            return result.withAggregationTime(AbstractAggregator.elapsedSeconds(start));
        } catch (RuntimeException e) {
            log.error("[{}] AGGREGATION_FAILED received={} reason={}", name, updates.size(), e.getMessage());
            return AggregationResult.failure(e.getMessage(), updates.size(),
                AbstractAggregator.elapsedSeconds(start));
        }
    }

    private ModelUpdate clip(ModelUpdate update) {
        GradientClipper.ClipResult clipped = clipper.clip(update.weights().toFlatVector());
        return update.withClippedWeights(
            ParameterCodec.reconstructLike(clipped.vector(), update.weights()), clipper.getMaxNorm());
    }

    private ModelUpdate addNoise(ModelUpdate update) {
        DifferentialPrivacy.PrivatizedVector noised =
            dp.addNoise(update.weights().toFlatVector(), update.effectiveSamples());
        return update.withNoisedWeights(
            ParameterCodec.reconstructLike(noised.vector(), update.weights()), noised.noiseScale());
    }
}
