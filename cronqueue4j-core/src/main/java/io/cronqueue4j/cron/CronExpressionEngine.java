package io.cronqueue4j.cron;

import java.time.Instant;

/**
 * Computes occurrences of a cron expression.
 */
public interface CronExpressionEngine {

    /**
     * Returns the first occurrence strictly after {@code after}.
     *
     * @param expression cron expression
     * @param after      exclusive lower bound
     * @param bound      exclusive upper bound, or null for none
     * @throws IllegalArgumentException if the expression is malformed, or no occurrence exists before {@code bound}
     */
    Instant next(String expression, Instant after, Instant bound);

    default boolean isValid(String expression) {
        try {
            next(expression, Instant.now(), null);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
