package ai.casedoc.compare.report;

import ai.casedoc.compare.comparison.ComparisonResult;
import ai.casedoc.compare.comparison.VersionPairComparison;
import ai.casedoc.compare.diff.DiffSummary;
import java.io.IOException;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link ComparisonResult} into a downloadable report. Rendering only reads the result; the
 * counts shown are the ones the comparison produced.
 */
public final class ReportRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportRenderer.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final Map<ReportEncoding, ReportWriter> writers;

    public ReportRenderer() {
        this.writers = new EnumMap<>(ReportEncoding.class);
        writers.put(ReportEncoding.HTML, new HtmlReportWriter());
        writers.put(ReportEncoding.PDF, new PdfReportWriter());
    }

    /**
     * Renders with an encoding given by name, extension or alias.
     *
     * @throws RenderException if the encoding is unsupported, before any rendering starts
     */
    public RenderedReport render(ComparisonResult result, String encoding) {
        return render(result, ReportEncoding.from(encoding));
    }

    public RenderedReport render(ComparisonResult result, ReportEncoding encoding) {
        if (encoding == null) {
            throw new RenderException("Report encoding is required");
        }
        validate(result);
        ReportWriter writer = writers.get(encoding);
        try {
            byte[] content = writer.write(result);
            String fileName = fileName(result, encoding);
            LOGGER.info("Rendered {} report {} ({} bytes)", encoding.extension(), fileName, content.length);
            return new RenderedReport(encoding, fileName, content);
        } catch (IOException ex) {
            throw new RenderException("Failed to render " + encoding.extension() + " report for case " + result.caseId(), ex);
        }
    }

    /**
     * {@code lcp_comparison_<caseId>_<yyyyMMdd_HHmmss>.<ext>}, stamped from the result's generation time in UTC.
     */
    public static String fileName(ComparisonResult result, ReportEncoding encoding) {
        return "lcp_comparison_" + result.caseId() + "_" + FILE_TIMESTAMP.format(result.generatedAt()) + "." + encoding.extension();
    }

    private static void validate(ComparisonResult result) {
        if (result == null) {
            throw new RenderException("Comparison result is required");
        }
        DiffSummary aggregate = DiffSummary.EMPTY;
        for (VersionPairComparison pair : result.pairs()) {
            if (pair.isComparable() && !DiffSummary.of(pair.sectionDiffs()).equals(pair.summary())) {
                throw new RenderException("Summary of pair " + pair.older().id() + " -> " + pair.newer().id()
                        + " does not match its section diffs");
            }
            aggregate = aggregate.plus(pair.summary());
        }
        if (!aggregate.equals(result.summary())) {
            throw new RenderException("Overall summary does not match the compared pairs of case " + result.caseId());
        }
    }
}
