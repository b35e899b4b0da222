package ai.casedoc.compare.comparison;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.casedoc.compare.config.RetryPolicy;
import ai.casedoc.compare.storage.InMemoryObjectStore;
import ai.casedoc.compare.storage.ObjectNotFoundException;
import ai.casedoc.compare.storage.TransientStorageException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class VersionFetcherTest {

    private static final String KEY = "3424/202401011200-3424-LCP.pdf";
    private static final RetryPolicy POLICY = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(1000), 0.0);

    private final InMemoryObjectStore store = new InMemoryObjectStore()
            .put(KEY, "content".getBytes(StandardCharsets.UTF_8), Instant.EPOCH);
    private final List<Duration> sleeps = new ArrayList<>();
    private final VersionFetcher fetcher = new VersionFetcher(store, POLICY, sleeps::add);

    @Test
    void retriesTransientFailuresWithBackoff() {
        store.failTransiently(KEY, 2);

        byte[] content = fetcher.fetch(KEY);

        assertThat(new String(content, StandardCharsets.UTF_8)).isEqualTo("content");
        assertThat(store.readCount()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void givesUpAfterMaxAttempts() {
        store.failTransiently(KEY, 5);

        assertThatThrownBy(() -> fetcher.fetch(KEY)).isInstanceOf(TransientStorageException.class);
        assertThat(store.readCount()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void doesNotRetryMissingObjects() {
        assertThatThrownBy(() -> fetcher.fetch("3424/missing.pdf")).isInstanceOf(ObjectNotFoundException.class);
        assertThat(store.readCount()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void stopsRetryingWhenInterrupted() {
        store.failTransiently(KEY, 5);
        VersionFetcher interrupted = new VersionFetcher(store, POLICY, duration -> {
            throw new InterruptedException("stop");
        });

        try {
            assertThatThrownBy(() -> interrupted.fetch(KEY)).isInstanceOf(TransientStorageException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            assertThat(store.readCount()).isEqualTo(1);
        } finally {
            Thread.interrupted();
        }
    }
}
