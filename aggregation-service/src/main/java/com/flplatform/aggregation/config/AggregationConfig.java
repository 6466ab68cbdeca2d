package com.flplatform.aggregation.config;

import com.flplatform.common.aggregation.Aggregator;
import com.flplatform.common.aggregation.AggregatorFactory;
import com.flplatform.common.aggregation.AggregatorSettings;
import com.flplatform.common.privacy.DPConfig;
import com.flplatform.common.stats.OutlierMethod;
import com.flplatform.common.sync.ModelSynchronizer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AggregationConfig {

    @Value("${aggregation.method:fedavg}")
    private String method;

    @Value("${aggregation.byzantine-tolerance:1}")
    private int byzantineTolerance;

    @Value("${aggregation.multi-krum:false}")
    private boolean multiKrum;

    @Value("${aggregation.multi-krum-selection:1}")
    private int multiKrumSelection;

    @Value("${aggregation.trim-beta:0.1}")
    private double trimBeta;

    @Value("${aggregation.adaptive-f:true}")
    private boolean adaptiveF;

    @Value("${aggregation.adaptive-beta:true}")
    private boolean adaptiveBeta;

    @Value("${aggregation.outlier-method:iqr}")
    private String outlierMethod;

    @Value("${aggregation.variance-threshold:1.0}")
    private double varianceThreshold;

    @Value("${aggregation.variance-sample-dims:100}")
    private int varianceSampleDims;

    @Value("${aggregation.privacy.enabled:true}")
    private boolean privacyEnabled;

    @Value("${aggregation.privacy.target-epsilon:1.0}")
    private double targetEpsilon;

    @Value("${aggregation.privacy.target-delta:1.0e-5}")
    private double targetDelta;

    @Value("${aggregation.privacy.max-grad-norm:1.0}")
    private double maxGradNorm;

    @Value("${aggregation.privacy.noise-multiplier:1.1}")
    private double noiseMultiplier;

    @Value("${aggregation.privacy.max-rounds:100}")
    private int maxRounds;

    @Value("${aggregation.privacy.seed:42}")
    private long seed;

    @Value("${sync.node-id:coordinator}")
    private String nodeId;

    @Value("${sync.history-limit:10}")
    private int historyLimit;

    @Bean
    public AggregatorSettings aggregatorSettings() {
        DPConfig dpConfig = new DPConfig(targetEpsilon, targetDelta, maxGradNorm,
            noiseMultiplier, maxRounds, seed);
        return new AggregatorSettings(byzantineTolerance, multiKrum, multiKrumSelection, trimBeta,
            adaptiveF, adaptiveBeta, OutlierMethod.fromName(outlierMethod),
            varianceThreshold, varianceSampleDims, dpConfig, privacyEnabled);
    }

    /** Fails startup on an unknown method name. */
    @Bean
    public Aggregator aggregator(AggregatorSettings aggregatorSettings) {
        return AggregatorFactory.create(method, aggregatorSettings);
    }

    @Bean
    public ModelSynchronizer modelSynchronizer() {
        return new ModelSynchronizer(nodeId, historyLimit);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
