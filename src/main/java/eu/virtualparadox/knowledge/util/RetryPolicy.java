package eu.virtualparadox.knowledge.util;

import java.time.Duration;

/**
 * Bounded exponential backoff settings.
 * <p>
 * For attempt {@code n} (1-based) the delay before the next attempt is
 * {@code min(initialBackoff * multiplier^(n-1), maxBackoff)}.
 * </p>
 *
 * @param maxAttempts    total attempts including the first one (at least 1)
 * @param initialBackoff delay after the first failed attempt
 * @param multiplier     growth factor between consecutive delays
 * @param maxBackoff     upper bound of a single delay
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff;
        }
    }

    /**
     * Single attempt, no retry.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Retries without waiting between attempts.
     */
    public static RetryPolicy immediate(final int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt 1-based number of the attempt that just failed
     * @return backoff duration, capped at {@link #maxBackoff()}
     */
    public Duration backoffAfter(final int attempt) {
        final double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        final double millis = initialBackoff.toMillis() * factor;
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
