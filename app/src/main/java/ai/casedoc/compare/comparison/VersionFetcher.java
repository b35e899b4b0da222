package ai.casedoc.compare.comparison;

import ai.casedoc.compare.config.RetryPolicy;
import ai.casedoc.compare.storage.ObjectStore;
import ai.casedoc.compare.storage.ObjectStoreException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads version bytes, retrying transient storage failures with bounded exponential backoff.
 * Not-found and other non-retryable failures propagate immediately.
 */
public class VersionFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(VersionFetcher.class);

    private final ObjectStore objectStore;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public VersionFetcher(ObjectStore objectStore, RetryPolicy retryPolicy) {
        this(objectStore, retryPolicy, Sleeper.SYSTEM);
    }

    public VersionFetcher(ObjectStore objectStore, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.objectStore = Objects.requireNonNull(objectStore, "objectStore");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public byte[] fetch(String key) {
        for (int attempt = 0; ; attempt++) {
            try {
                return objectStore.getObject(key);
            } catch (ObjectStoreException ex) {
                if (!ex.isRetryable() || attempt == retryPolicy.maxAttempts() - 1) {
                    if (ex.isRetryable()) {
                        LOGGER.warn("Giving up on {} after {} attempt(s)", key, attempt + 1);
                    }
                    throw ex;
                }
                Duration delay = retryPolicy.delayAfter(attempt);
                LOGGER.warn("Transient failure reading {}: {}; retrying in {} ms (attempt {}/{})",
                        key, ex.getMessage(), delay.toMillis(), attempt + 1, retryPolicy.maxAttempts());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Retry of {} interrupted", key);
                    throw ex;
                }
            }
        }
    }
}
