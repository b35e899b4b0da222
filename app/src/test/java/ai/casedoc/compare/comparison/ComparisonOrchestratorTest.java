package ai.casedoc.compare.comparison;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

import ai.casedoc.compare.catalog.CatalogException;
import ai.casedoc.compare.catalog.VersionCatalog;
import ai.casedoc.compare.catalog.VersionDescriptor;
import ai.casedoc.compare.catalog.VersionKeyParser;
import ai.casedoc.compare.config.CompareSettings;
import ai.casedoc.compare.config.RetryPolicy;
import ai.casedoc.compare.diff.DiffEngine;
import ai.casedoc.compare.diff.DiffSummary;
import ai.casedoc.compare.diff.SectionDiff;
import ai.casedoc.compare.diff.SectionStatus;
import ai.casedoc.compare.extract.ExtractionException;
import ai.casedoc.compare.extract.PlainTextStrategy;
import ai.casedoc.compare.extract.TextExtractionStrategy;
import ai.casedoc.compare.extract.TextExtractor;
import ai.casedoc.compare.segment.SectionSegmenter;
import ai.casedoc.compare.storage.InMemoryObjectStore;
import ai.casedoc.compare.storage.ObjectNotFoundException;
import ai.casedoc.compare.storage.ObjectStore;
import ai.casedoc.compare.storage.StoredObject;
import ai.casedoc.compare.storage.TransientStorageException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ComparisonOrchestratorTest {

    private static final String V1 = "3424/202401011200-3424-LCP.pdf";
    private static final String V2 = "3424/202402011200-3424-LCP.pdf";
    private static final String V3 = "3424/202403011200-3424-LCP.pdf";
    private static final Instant NOW = Instant.parse("2024-04-01T09:15:30Z");
    private static final byte[] NOT_TEXT = {(byte) 0xC3, (byte) 0x28};

    private static final String V1_TEXT = """
            Section 1: Summary
            Stable.
            Section 2: Medications
            Ibuprofen 400mg
            """;
    private static final String V2_TEXT = """
            Section 1: Summary
            Stable.
            Section 2: Medications
            Ibuprofen 600mg
            Section 3: Therapy
            Weekly PT
            """;
    private static final String V3_TEXT = """
            Section 1: Summary
            Improving.
            Section 3: Therapy
            Weekly PT
            """;

    private final InMemoryObjectStore store = new InMemoryObjectStore();

    @Test
    void sequentialModeComparesEachVersionWithItsSuccessor() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), V2_TEXT.getBytes(StandardCharsets.UTF_8),
                V3_TEXT.getBytes(StandardCharsets.UTF_8));

        ComparisonResult result = orchestrator().compare("3424", ComparisonRequest.sequential());

        assertThat(result.caseId()).isEqualTo("3424");
        assertThat(result.mode()).isEqualTo(ComparisonMode.SEQUENTIAL);
        assertThat(result.generatedAt()).isEqualTo(NOW);
        assertThat(result.versions()).extracting(VersionDescriptor::id).containsExactly(V1, V2, V3);
        assertThat(result.pairs()).extracting(pair -> pair.older().id() + ">" + pair.newer().id())
                .containsExactly(V1 + ">" + V2, V2 + ">" + V3);

        VersionPairComparison first = result.pairs().get(0);
        assertThat(first.sectionDiffs()).extracting(SectionDiff::sectionName, SectionDiff::status).containsExactly(
                tuple("Section 1: Summary", SectionStatus.UNCHANGED),
                tuple("Section 2: Medications", SectionStatus.MODIFIED),
                tuple("Section 3: Therapy", SectionStatus.ADDED));
        assertThat(first.summary()).isEqualTo(new DiffSummary(3, 1, 0, 1, 1));
        assertThat(result.pairs().get(1).summary()).isEqualTo(new DiffSummary(3, 0, 1, 1, 1));
        assertThat(result.summary()).isEqualTo(new DiffSummary(6, 1, 1, 2, 2));
        assertThat(result.hasErrors()).isFalse();
    }

    @Test
    void selectiveModeComparesFirstAgainstLastSelected() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), V2_TEXT.getBytes(StandardCharsets.UTF_8),
                V3_TEXT.getBytes(StandardCharsets.UTF_8));

        ComparisonResult result = orchestrator().compare("3424", ComparisonRequest.selective(List.of(V1, V2, V3)));

        assertThat(result.pairs()).singleElement().satisfies(pair -> {
            assertThat(pair.older().id()).isEqualTo(V1);
            assertThat(pair.newer().id()).isEqualTo(V3);
            assertThat(pair.summary()).isEqualTo(new DiffSummary(3, 1, 1, 1, 0));
        });
        assertThat(result.summary()).isEqualTo(new DiffSummary(3, 1, 1, 1, 0));
    }

    @Test
    void selfComparisonReportsNoChanges() {
        byte[] same = V1_TEXT.getBytes(StandardCharsets.UTF_8);
        storeVersions(same, same, same);

        ComparisonResult result = orchestrator().compare("3424", ComparisonRequest.selective(List.of(V1, V2)));

        assertThat(result.summary().changed()).isZero();
        assertThat(result.pairs().get(0).sectionDiffs()).extracting(SectionDiff::status)
                .containsOnly(SectionStatus.UNCHANGED);
    }

    @Test
    void extractionFailureMakesAdjacentPairsNotComparable() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), NOT_TEXT, V3_TEXT.getBytes(StandardCharsets.UTF_8));

        ComparisonResult result = orchestrator().compare("3424", ComparisonRequest.sequential());

        assertThat(result.pairs()).hasSize(2);
        assertThat(result.pairs()).extracting(VersionPairComparison::status)
                .containsExactly(PairStatus.NOT_COMPARABLE, PairStatus.NOT_COMPARABLE);
        assertThat(result.pairs()).noneMatch(pair -> pair.older().id().equals(V1) && pair.newer().id().equals(V3));
        assertThat(result.pairs().get(0).failures()).extracting(VersionFailure::versionId).containsExactly(V2);
        assertThat(result.perVersionErrors()).singleElement().satisfies(failure -> {
            assertThat(failure.versionId()).isEqualTo(V2);
            assertThat(failure.stage()).isEqualTo(FailureStage.EXTRACTION);
        });
        assertThat(result.summary()).isEqualTo(DiffSummary.EMPTY);
    }

    @Test
    void selectiveModeSkipsUnusableInteriorVersion() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), NOT_TEXT, V3_TEXT.getBytes(StandardCharsets.UTF_8));

        ComparisonResult result = orchestrator().compare("3424", ComparisonRequest.selective(List.of(V1, V2, V3)));

        assertThat(result.pairs()).singleElement().satisfies(pair -> {
            assertThat(pair.isComparable()).isTrue();
            assertThat(pair.older().id()).isEqualTo(V1);
            assertThat(pair.newer().id()).isEqualTo(V3);
        });
        assertThat(result.perVersionErrors()).extracting(VersionFailure::versionId).containsExactly(V2);
    }

    @Test
    void unknownSelectedIdIsRecordedAsFetchFailure() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), V2_TEXT.getBytes(StandardCharsets.UTF_8),
                V3_TEXT.getBytes(StandardCharsets.UTF_8));

        ComparisonResult result = orchestrator().compare("3424",
                ComparisonRequest.selective(List.of(V1, "3424/unknown.pdf", V2, V1)));

        assertThat(result.pairs()).singleElement().satisfies(pair -> assertThat(pair.newer().id()).isEqualTo(V2));
        assertThat(result.perVersionErrors()).singleElement().satisfies(failure -> {
            assertThat(failure.versionId()).isEqualTo("3424/unknown.pdf");
            assertThat(failure.stage()).isEqualTo(FailureStage.FETCH);
            assertThat(failure.message()).contains("3424");
        });
    }

    @Test
    void transientFetchFailuresAreRetried() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), V2_TEXT.getBytes(StandardCharsets.UTF_8),
                V3_TEXT.getBytes(StandardCharsets.UTF_8));
        store.failTransiently(V2, 2);
        RetryPolicy retry = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 0.0);

        ComparisonResult result = orchestrator(new CompareSettings(2, Duration.ofSeconds(10), retry),
                new TextExtractor(List.of(new PlainTextStrategy()))).compare("3424", ComparisonRequest.sequential());

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.pairs()).allMatch(VersionPairComparison::isComparable);
    }

    @Test
    void exhaustedFetchRetriesBecomeFetchFailure() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), V2_TEXT.getBytes(StandardCharsets.UTF_8),
                V3_TEXT.getBytes(StandardCharsets.UTF_8));
        store.failTransiently(V3, 10);

        ComparisonResult result = orchestrator().compare("3424", ComparisonRequest.sequential());

        assertThat(result.pairs()).extracting(VersionPairComparison::status)
                .containsExactly(PairStatus.COMPARED, PairStatus.NOT_COMPARABLE);
        assertThat(result.perVersionErrors()).singleElement()
                .satisfies(failure -> assertThat(failure.stage()).isEqualTo(FailureStage.FETCH));
        assertThat(result.summary()).isEqualTo(result.pairs().get(0).summary());
    }

    @Test
    void failsWhenFewerThanTwoVersionsAreUsable() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), NOT_TEXT, NOT_TEXT);

        InsufficientVersionsException thrown = catchThrowableOfType(
                () -> orchestrator().compare("3424", ComparisonRequest.sequential()), InsufficientVersionsException.class);

        assertThat(thrown.usableVersions()).isEqualTo(1);
        assertThat(thrown.failures()).extracting(VersionFailure::versionId).containsExactly(V2, V3);
    }

    @Test
    void failsWhenCaseHasSingleVersion() {
        store.put(V1, V1_TEXT.getBytes(StandardCharsets.UTF_8), Instant.EPOCH);

        InsufficientVersionsException thrown = catchThrowableOfType(
                () -> orchestrator().compare("3424", ComparisonRequest.sequential()), InsufficientVersionsException.class);

        assertThat(thrown.usableVersions()).isEqualTo(1);
        assertThat(thrown.failures()).isEmpty();
    }

    @Test
    void catalogFailurePropagates() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), V2_TEXT.getBytes(StandardCharsets.UTF_8),
                V3_TEXT.getBytes(StandardCharsets.UTF_8));
        store.setAvailable(false);

        CatalogException thrown = catchThrowableOfType(
                () -> orchestrator().compare("3424", ComparisonRequest.sequential()), CatalogException.class);

        assertThat(thrown.reason()).isEqualTo(CatalogException.Reason.STORAGE_UNAVAILABLE);
    }

    @Test
    void timesOutWhenExtractionHangs() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), V2_TEXT.getBytes(StandardCharsets.UTF_8),
                V3_TEXT.getBytes(StandardCharsets.UTF_8));
        TextExtractor hanging = new TextExtractor(List.of(new HangingStrategy()));

        ComparisonTimeoutException thrown = catchThrowableOfType(
                () -> orchestrator(new CompareSettings(2, Duration.ofMillis(200), RetryPolicy.noRetry()), hanging)
                        .compare("3424", ComparisonRequest.sequential()),
                ComparisonTimeoutException.class);

        assertThat(thrown).hasMessageContaining("3424");
    }

    @Test
    void timeoutCoversHangingCatalogListing() {
        HangingListingStore hangingStore = new HangingListingStore();
        CompareSettings settings = new CompareSettings(2, Duration.ofSeconds(30), RetryPolicy.noRetry());
        ComparisonOrchestrator orchestrator = new ComparisonOrchestrator(
                new VersionCatalog(hangingStore, new VersionKeyParser(List.of("LCP"))),
                new VersionFetcher(hangingStore, settings.fetchRetry(), duration -> { }),
                new TextExtractor(List.of(new PlainTextStrategy())), new SectionSegmenter(), new DiffEngine(),
                settings, Clock.fixed(NOW, ZoneOffset.UTC));

        long started = System.nanoTime();
        ComparisonTimeoutException thrown = catchThrowableOfType(
                () -> orchestrator.compare("3424", ComparisonRequest.sequential(), Duration.ofMillis(200)),
                ComparisonTimeoutException.class);

        assertThat(thrown).hasMessageContaining("3424").hasMessageContaining("PT0.2S");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void perCallTimeoutMustBePositive() {
        assertThatThrownBy(() -> orchestrator().compare("3424", ComparisonRequest.sequential(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clearsDiagnosticContextAfterwards() {
        storeVersions(V1_TEXT.getBytes(StandardCharsets.UTF_8), V2_TEXT.getBytes(StandardCharsets.UTF_8),
                V3_TEXT.getBytes(StandardCharsets.UTF_8));

        orchestrator().compare("3424", ComparisonRequest.sequential());

        assertThat(MDC.get("caseId")).isNull();
        assertThat(MDC.get("comparisonMode")).isNull();
    }

    private void storeVersions(byte[] v1, byte[] v2, byte[] v3) {
        store.put(V1, v1, Instant.EPOCH).put(V2, v2, Instant.EPOCH).put(V3, v3, Instant.EPOCH);
    }

    private ComparisonOrchestrator orchestrator() {
        return orchestrator(new CompareSettings(3, Duration.ofSeconds(10), RetryPolicy.noRetry()),
                new TextExtractor(List.of(new PlainTextStrategy())));
    }

    private ComparisonOrchestrator orchestrator(CompareSettings settings, TextExtractor extractor) {
        VersionCatalog catalog = new VersionCatalog(store, new VersionKeyParser(List.of("LCP")));
        return new ComparisonOrchestrator(catalog, new VersionFetcher(store, settings.fetchRetry(), duration -> { }),
                extractor, new SectionSegmenter(), new DiffEngine(), settings, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static final class HangingListingStore implements ObjectStore {

        private final CountDownLatch never = new CountDownLatch(1);

        @Override
        public List<StoredObject> listObjects(String prefix) {
            try {
                never.await();
                return List.of();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TransientStorageException("listing interrupted", ex);
            }
        }

        @Override
        public byte[] getObject(String key) {
            throw new ObjectNotFoundException(key);
        }
    }

    private static final class HangingStrategy implements TextExtractionStrategy {

        private final CountDownLatch never = new CountDownLatch(1);

        @Override
        public String name() {
            return "hanging";
        }

        @Override
        public String extract(byte[] content) {
            try {
                never.await();
                return "";
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ExtractionException("interrupted", ex);
            }
        }
    }
}
