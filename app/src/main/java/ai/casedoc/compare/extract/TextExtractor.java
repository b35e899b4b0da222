package ai.casedoc.compare.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an ordered chain of {@link TextExtractionStrategy} instances and keeps the first non-blank result.
 */
public class TextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextExtractor.class);

    private final List<TextExtractionStrategy> strategies;

    public TextExtractor(List<TextExtractionStrategy> strategies) {
        this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies"));
        if (this.strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one extraction strategy is required");
        }
    }

    /**
     * Default chain for stored PDF renditions: whole-document stream-order text first, then page-by-page
     * recovery that skips unreadable pages.
     */
    public static TextExtractor pdfDefaults() {
        return new TextExtractor(List.of(new PdfBoxTextStrategy(false), new PdfBoxPageTextStrategy()));
    }

    public ExtractedDocument extract(String versionId, byte[] content) {
        Objects.requireNonNull(versionId, "versionId");
        Objects.requireNonNull(content, "content");
        List<String> failures = new ArrayList<>();
        ExtractionException firstCause = null;
        for (TextExtractionStrategy strategy : strategies) {
            try {
                String text = strategy.extract(content);
                if (text != null && !text.isBlank()) {
                    LOGGER.debug("Extracted {} characters from {} using {}", text.length(), versionId, strategy.name());
                    return new ExtractedDocument(versionId, text, strategy.name());
                }
                failures.add(strategy.name() + ": no text");
            } catch (ExtractionException ex) {
                failures.add(strategy.name() + ": " + ex.getMessage());
                if (firstCause == null) {
                    firstCause = ex;
                }
            } catch (RuntimeException ex) {
                // third-party parsers signal malformed input with assorted runtime exceptions
                failures.add(strategy.name() + ": " + ex);
                if (firstCause == null) {
                    firstCause = new ExtractionException(ex.toString(), ex);
                }
            }
        }
        throw new ExtractionException("No text could be extracted from " + versionId + " ("
                + String.join("; ", failures) + ")", firstCause);
    }
}
