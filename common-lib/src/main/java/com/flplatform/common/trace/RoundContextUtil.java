package com.flplatform.common.trace;

import org.slf4j.MDC;

/**
 * Round-correlation helper for log statements.
 *
 * <p>MDC is only ever written as a temporary bridge during a log statement, never as a
 * persistent ThreadLocal store. Aggregation may run concurrently for different rounds on
 * pooled threads, so a lingering MDC entry would mislabel unrelated log lines.
 *
 * <p>Usage:
 * <pre>
 *     RoundContextUtil.withMdc(RoundContextUtil.roundId(coordinatorId, round), () -&gt;
 *         log.info("[RoundAggregationService] stage={} ...", stage));
 * </pre>
 */
public final class RoundContextUtil {

    public static final String ROUND_ID_KEY = "roundId";

    private RoundContextUtil() {}

    /**
     * Builds the round identifier used as the MDC value: {@code <coordinator>-r<round>}.
     * A {@code null} coordinator id renders as {@code "unknown"}.
     */
    public static String roundId(String coordinatorId, int roundNumber) {
        String owner = coordinatorId == null ? "unknown" : coordinatorId;
        return owner + "-r" + roundNumber;
    }

    /**
     * Temporarily bridges {@code roundId} → MDC for the duration of {@code logAction},
     * then removes the MDC entry.
     *
     * @param roundId   the round identifier to bridge into MDC
     * @param logAction the log statement to execute with MDC populated
     */
    public static void withMdc(String roundId, Runnable logAction) {
        MDC.put(ROUND_ID_KEY, roundId);
        try {
            logAction.run();
        } finally {
            MDC.remove(ROUND_ID_KEY);
        }
    }
}
