package ai.casedoc.compare.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Resource limits for one comparison call.
 *
 * @param workerThreads size of the bounded fetch-and-extract pool
 * @param timeout       deadline covering the whole comparison
 * @param fetchRetry    retry policy for transient storage failures
 */
public record CompareSettings(int workerThreads, Duration timeout, RetryPolicy fetchRetry) {

    public static final CompareSettings DEFAULT = new CompareSettings(4, Duration.ofMinutes(5), RetryPolicy.DEFAULT);

    public CompareSettings {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        Objects.requireNonNull(fetchRetry, "fetchRetry");
    }
}
