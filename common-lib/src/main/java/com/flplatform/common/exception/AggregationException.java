package com.flplatform.common.exception;

/**
 * Unchecked failure raised by the aggregation core for configuration and integrity
 * errors that must not be silently absorbed: codec dimension mismatches, unknown
 * aggregation methods, unsupported conflict-resolution strategies.
 *
 * <p>Input errors inside {@code aggregate()} are never thrown to the caller; they
 * are converted into a failed {@link com.flplatform.common.model.AggregationResult}.
 */
public class AggregationException extends RuntimeException {
    private final String component;

    public AggregationException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public AggregationException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
