package com.flplatform.common.aggregation;

import com.flplatform.common.privacy.DPConfig;

/** FedAvg over clipped, optionally noised updates. */
public class SecureFedAvgAggregator extends AbstractSecureAggregator {

    public static final String NAME = "secure_fedavg";

    public SecureFedAvgAggregator(DPConfig config, boolean enableDp) {
        super(NAME, new FedAvgAggregator(), config, enableDp);
    }
}
