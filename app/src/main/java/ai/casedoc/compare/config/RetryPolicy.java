package ai.casedoc.compare.config;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff applied to transient object-store failures.
 *
 * @param maxAttempts    total attempts including the first one
 * @param initialBackoff delay before the second attempt
 * @param maxBackoff     upper bound for any single delay
 * @param jitterFactor   relative jitter in {@code [0.0, 1.0]} applied to each delay
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitterFactor) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(5), 0.2);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be zero or positive");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0);
    }

    /**
     * Delay to wait after the given zero-based failed attempt: {@code initialBackoff * 2^attempt}, capped
     * at {@code maxBackoff}, then scaled by {@code 1 ± jitterFactor}.
     */
    public Duration delayAfter(int attempt) {
        long ceiling = maxBackoff.toMillis();
        long capped;
        try {
            capped = Math.min(Math.multiplyExact(initialBackoff.toMillis(), 1L << Math.min(Math.max(attempt, 0), 62)),
                    ceiling);
        } catch (ArithmeticException ex) {
            capped = ceiling;
        }
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Duration.ofMillis(Math.max(0L, Math.round(capped * jitter)));
    }
}
