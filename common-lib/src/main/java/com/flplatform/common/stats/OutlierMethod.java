package com.flplatform.common.stats;

import com.flplatform.common.exception.AggregationException;

import java.util.Locale;

/**
 * Per-coordinate outlier rule used to pre-filter whole updates.
 *
 * <pre>
 *   IQR    → value outside [Q1 − 1.5·IQR, Q3 + 1.5·IQR]
 *   ZSCORE → |x − mean| / (std + 1e-8)  > 3
 *   MAD    → |x − median| / (MAD + 1e-8) > 3
 * </pre>
 */
public enum OutlierMethod {
    IQR,
    ZSCORE,
    MAD;

    public static OutlierMethod fromName(String name) {
        if (name == null) {
            return IQR;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AggregationException("OutlierMethod",
                "Unknown outlier detection method: " + name + ". Available: iqr, zscore, mad", e);
        }
    }
}
