package ai.casedoc.compare.comparison;

import ai.casedoc.compare.catalog.VersionCatalog;
import ai.casedoc.compare.catalog.VersionDescriptor;
import ai.casedoc.compare.config.CompareSettings;
import ai.casedoc.compare.diff.DiffEngine;
import ai.casedoc.compare.diff.DiffSummary;
import ai.casedoc.compare.extract.ExtractedDocument;
import ai.casedoc.compare.extract.ExtractionException;
import ai.casedoc.compare.extract.TextExtractor;
import ai.casedoc.compare.logging.MdcPropagatingExecutor;
import ai.casedoc.compare.segment.SectionSegmenter;
import ai.casedoc.compare.segment.SegmentedDocument;
import ai.casedoc.compare.storage.ObjectStoreException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives selective and sequential comparisons. Each call fetches and extracts its versions on a
 * private bounded pool, tolerates per-version failures and returns one self-contained result.
 */
public class ComparisonOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ComparisonOrchestrator.class);

    private final VersionCatalog catalog;
    private final VersionFetcher fetcher;
    private final TextExtractor extractor;
    private final SectionSegmenter segmenter;
    private final DiffEngine diffEngine;
    private final CompareSettings settings;
    private final Clock clock;

    public ComparisonOrchestrator(VersionCatalog catalog, VersionFetcher fetcher, TextExtractor extractor,
                                  SectionSegmenter segmenter, DiffEngine diffEngine, CompareSettings settings,
                                  Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.diffEngine = Objects.requireNonNull(diffEngine, "diffEngine");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Compares under the configured timeout.
     *
     * @see #compare(String, ComparisonRequest, Duration)
     */
    public ComparisonResult compare(String caseId, ComparisonRequest request) {
        return compare(caseId, request, settings.timeout());
    }

    /**
     * Compares under a caller-supplied timeout that covers the catalog listing as well as every fetch,
     * extraction and diff.
     *
     * @throws ai.casedoc.compare.catalog.CatalogException if the case catalog cannot be listed
     * @throws InsufficientVersionsException                if fewer than two usable versions remain
     * @throws ComparisonTimeoutException                   if the timeout expires first
     */
    public ComparisonResult compare(String caseId, ComparisonRequest request, Duration timeout) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        Deadline deadline = new Deadline(timeout, System.nanoTime() + timeout.toNanos());
        MDC.put("caseId", String.valueOf(caseId));
        MDC.put("comparisonMode", request.mode().label());
        ExecutorService pool = Executors.newFixedThreadPool(settings.workerThreads(), new WorkerThreadFactory(caseId));
        Executor executor = new MdcPropagatingExecutor(pool);
        try {
            List<VersionDescriptor> catalogVersions = await(caseId,
                    CompletableFuture.supplyAsync(() -> catalog.listVersions(caseId), executor), deadline);
            List<VersionFailure> failures = new ArrayList<>();
            List<VersionDescriptor> candidates = request.mode() == ComparisonMode.SEQUENTIAL
                    ? catalogVersions
                    : resolveSelection(caseId, request.versionIds(), catalogVersions, failures);
            if (candidates.size() < 2) {
                throw new InsufficientVersionsException(caseId, candidates.size(), failures);
            }
            LOGGER.info("Comparing {} version(s) of case {} in {} mode", candidates.size(), caseId, request.mode().label());
            return run(caseId, request.mode(), candidates, failures, executor, deadline);
        } finally {
            pool.shutdownNow();
            MDC.remove("caseId");
            MDC.remove("comparisonMode");
        }
    }

    private List<VersionDescriptor> resolveSelection(String caseId, List<String> versionIds,
                                                     List<VersionDescriptor> catalogVersions,
                                                     List<VersionFailure> failures) {
        Map<String, VersionDescriptor> byId = new LinkedHashMap<>();
        catalogVersions.forEach(version -> byId.put(version.id(), version));
        List<VersionDescriptor> resolved = new ArrayList<>();
        for (String id : new LinkedHashSet<>(versionIds)) {
            VersionDescriptor descriptor = byId.get(id);
            if (descriptor == null) {
                LOGGER.warn("Selected version {} is not part of case {}", id, caseId);
                failures.add(new VersionFailure(id, FailureStage.FETCH, "not a version of case " + caseId));
            } else {
                resolved.add(descriptor);
            }
        }
        return resolved;
    }

    private ComparisonResult run(String caseId, ComparisonMode mode, List<VersionDescriptor> candidates,
                                 List<VersionFailure> failures, Executor executor, Deadline deadline) {
        List<CompletableFuture<LoadedVersion>> loads = new ArrayList<>(candidates.size());
        try {
            for (VersionDescriptor candidate : candidates) {
                loads.add(CompletableFuture.supplyAsync(() -> load(candidate), executor));
            }
            CompletableFuture<List<VersionPairComparison>> work = mode == ComparisonMode.SEQUENTIAL
                    ? consecutivePairs(loads, executor)
                    : firstAgainstLast(loads, executor);
            List<VersionPairComparison> pairs = await(caseId, work, deadline);

            List<LoadedVersion> loaded = loads.stream().map(CompletableFuture::join).toList();
            loaded.stream().filter(LoadedVersion::failed).forEach(version -> failures.add(version.failure()));
            long usable = loaded.stream().filter(version -> !version.failed()).count();
            if (usable < 2) {
                throw new InsufficientVersionsException(caseId, (int) usable, failures);
            }

            DiffSummary summary = pairs.stream()
                    .map(VersionPairComparison::summary)
                    .reduce(DiffSummary.EMPTY, DiffSummary::plus);
            LOGGER.info("Case {}: {} pair(s), {} changed section(s), {} version failure(s)",
                    caseId, pairs.size(), summary.changed(), failures.size());
            return new ComparisonResult(caseId, mode, candidates, pairs, summary, failures, clock.instant());
        } finally {
            loads.forEach(load -> load.cancel(true));
        }
    }

    private CompletableFuture<List<VersionPairComparison>> consecutivePairs(List<CompletableFuture<LoadedVersion>> loads,
                                                                           Executor executor) {
        List<CompletableFuture<VersionPairComparison>> pairs = new ArrayList<>();
        for (int i = 1; i < loads.size(); i++) {
            pairs.add(loads.get(i - 1).thenCombineAsync(loads.get(i), this::comparePair, executor));
        }
        return CompletableFuture.allOf(pairs.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> pairs.stream().map(CompletableFuture::join).toList());
    }

    private CompletableFuture<List<VersionPairComparison>> firstAgainstLast(List<CompletableFuture<LoadedVersion>> loads,
                                                                           Executor executor) {
        return CompletableFuture.allOf(loads.toArray(CompletableFuture[]::new))
                .thenApplyAsync(ignored -> {
                    List<LoadedVersion> usable = loads.stream()
                            .map(CompletableFuture::join)
                            .filter(version -> !version.failed())
                            .toList();
                    if (usable.size() < 2) {
                        return List.of();
                    }
                    return List.of(comparePair(usable.get(0), usable.get(usable.size() - 1)));
                }, executor);
    }

    private <T> T await(String caseId, CompletableFuture<T> work, Deadline deadline) {
        try {
            return work.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            work.cancel(true);
            LOGGER.error("Comparison of case {} timed out after {}", caseId, deadline.timeout());
            throw new ComparisonTimeoutException(caseId, deadline.timeout(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            work.cancel(true);
            throw new ComparisonException("Comparison of case " + caseId + " was interrupted", List.of(), ex);
        } catch (ExecutionException | CancellationException ex) {
            Throwable cause = ex.getCause() instanceof CompletionException wrapped ? wrapped.getCause() : ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ComparisonException("Comparison of case " + caseId + " failed", List.of(), cause == null ? ex : cause);
        }
    }

    private LoadedVersion load(VersionDescriptor version) {
        byte[] content;
        try {
            content = fetcher.fetch(version.id());
        } catch (ObjectStoreException ex) {
            LOGGER.warn("Skipping version {}: fetch failed: {}", version.id(), ex.getMessage());
            return LoadedVersion.failed(version, new VersionFailure(version.id(), FailureStage.FETCH, ex.getMessage()));
        }
        try {
            ExtractedDocument extracted = extractor.extract(version.id(), content);
            LOGGER.debug("Extracted {} with {}", version.id(), extracted.extractionMethod());
            return LoadedVersion.loaded(version, segmenter.segment(extracted.rawText()));
        } catch (ExtractionException ex) {
            LOGGER.warn("Skipping version {}: extraction failed: {}", version.id(), ex.getMessage());
            return LoadedVersion.failed(version, new VersionFailure(version.id(), FailureStage.EXTRACTION, ex.getMessage()));
        }
    }

    private VersionPairComparison comparePair(LoadedVersion older, LoadedVersion newer) {
        if (older.failed() || newer.failed()) {
            List<VersionFailure> pairFailures = new ArrayList<>(2);
            if (older.failed()) {
                pairFailures.add(older.failure());
            }
            if (newer.failed()) {
                pairFailures.add(newer.failure());
            }
            return VersionPairComparison.notComparable(older.descriptor(), newer.descriptor(), pairFailures);
        }
        return VersionPairComparison.compared(older.descriptor(), newer.descriptor(),
                diffEngine.diff(older.document(), newer.document()));
    }

    private record Deadline(Duration timeout, long expiresAtNanos) {

        long remainingNanos() {
            return Math.max(0L, expiresAtNanos - System.nanoTime());
        }
    }

    private record LoadedVersion(VersionDescriptor descriptor, SegmentedDocument document, VersionFailure failure) {

        static LoadedVersion loaded(VersionDescriptor descriptor, SegmentedDocument document) {
            return new LoadedVersion(descriptor, document, null);
        }

        static LoadedVersion failed(VersionDescriptor descriptor, VersionFailure failure) {
            return new LoadedVersion(descriptor, null, failure);
        }

        boolean failed() {
            return failure != null;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String caseId) {
            this.prefix = "compare-" + caseId + "-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
