package ai.casedoc.compare;

import ai.casedoc.compare.catalog.VersionCatalog;
import ai.casedoc.compare.catalog.VersionDescriptor;
import ai.casedoc.compare.catalog.VersionKeyParser;
import ai.casedoc.compare.comparison.ComparisonOrchestrator;
import ai.casedoc.compare.comparison.ComparisonRequest;
import ai.casedoc.compare.comparison.ComparisonResult;
import ai.casedoc.compare.comparison.VersionFetcher;
import ai.casedoc.compare.config.CompareConfig;
import ai.casedoc.compare.diff.DiffEngine;
import ai.casedoc.compare.diff.LineDiffer;
import ai.casedoc.compare.extract.TextExtractor;
import ai.casedoc.compare.report.RenderedReport;
import ai.casedoc.compare.report.ReportEncoding;
import ai.casedoc.compare.report.ReportRenderer;
import ai.casedoc.compare.segment.SectionSegmenter;
import ai.casedoc.compare.storage.FileSystemObjectStore;
import ai.casedoc.compare.storage.ObjectStore;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for callers: list the versions of a case, compare them and render the result.
 */
public class VersionComparisonService {

    private final VersionCatalog catalog;
    private final ComparisonOrchestrator orchestrator;
    private final ReportRenderer renderer;

    public VersionComparisonService(VersionCatalog catalog, ComparisonOrchestrator orchestrator, ReportRenderer renderer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * Wires the default pipeline (PDFBox extraction, built-in heading rules) over a file-system store
     * rooted at the configured storage root.
     */
    public static VersionComparisonService create(CompareConfig config) {
        return create(config, new FileSystemObjectStore(config.storageRoot()), TextExtractor.pdfDefaults(), Clock.systemUTC());
    }

    public static VersionComparisonService create(CompareConfig config, ObjectStore objectStore, TextExtractor extractor,
                                                  Clock clock) {
        VersionCatalog catalog = new VersionCatalog(objectStore, new VersionKeyParser(config.documentTypes()));
        VersionFetcher fetcher = new VersionFetcher(objectStore, config.settings().fetchRetry());
        ComparisonOrchestrator orchestrator = new ComparisonOrchestrator(catalog, fetcher, extractor,
                new SectionSegmenter(), new DiffEngine(new LineDiffer()), config.settings(), clock);
        return new VersionComparisonService(catalog, orchestrator, new ReportRenderer());
    }

    public List<VersionDescriptor> listVersions(String caseId) {
        return catalog.listVersions(caseId);
    }

    public List<String> listCases() {
        return catalog.listCases();
    }

    public ComparisonResult compareVersions(String caseId, ComparisonRequest request) {
        return orchestrator.compare(caseId, request);
    }

    /**
     * Same as {@link #compareVersions(String, ComparisonRequest)} with a timeout overriding the configured one.
     */
    public ComparisonResult compareVersions(String caseId, ComparisonRequest request, Duration timeout) {
        return orchestrator.compare(caseId, request, timeout);
    }

    public RenderedReport renderReport(ComparisonResult result, ReportEncoding encoding) {
        return renderer.render(result, encoding);
    }

    public RenderedReport renderReport(ComparisonResult result, String encoding) {
        return renderer.render(result, encoding);
    }
}
