package com.flplatform.common.aggregation;

import com.flplatform.common.privacy.DPConfig;

/** Krum / Multi-Krum over clipped, optionally noised updates. */
public class SecureKrumAggregator extends AbstractSecureAggregator {

    public static final String NAME = "secure_krum";

    public SecureKrumAggregator(int f, boolean multiKrum, int m, DPConfig config, boolean enableDp) {
        super(NAME, new KrumAggregator(f, multiKrum, m), config, enableDp);
    }
}
