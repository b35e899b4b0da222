package ai.casedoc.compare.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.casedoc.compare.PdfFixtures;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextExtractorTest {

    private static final byte[] CONTENT = {1, 2, 3};

    @Test
    void keepsFirstNonBlankResult() {
        ScriptedStrategy blank = new ScriptedStrategy("blank", "   ");
        ScriptedStrategy good = new ScriptedStrategy("good", "Section 1\nText");
        ScriptedStrategy unused = new ScriptedStrategy("unused", "never");

        ExtractedDocument document = new TextExtractor(List.of(blank, good, unused)).extract("v1", CONTENT);

        assertThat(document.rawText()).isEqualTo("Section 1\nText");
        assertThat(document.extractionMethod()).isEqualTo("good");
        assertThat(document.versionId()).isEqualTo("v1");
        assertThat(unused.calls).isEmpty();
    }

    @Test
    void fallsThroughStrategyFailures() {
        ScriptedStrategy failing = ScriptedStrategy.failing("broken", new ExtractionException("corrupt xref"));
        ScriptedStrategy crashing = ScriptedStrategy.failing("crashing", new IllegalStateException("parser bug"));
        ScriptedStrategy good = new ScriptedStrategy("good", "text");

        ExtractedDocument document = new TextExtractor(List.of(failing, crashing, good)).extract("v1", CONTENT);

        assertThat(document.extractionMethod()).isEqualTo("good");
    }

    @Test
    void reportsEveryStrategyWhenAllFail() {
        ScriptedStrategy failing = ScriptedStrategy.failing("broken", new ExtractionException("corrupt xref"));
        ScriptedStrategy blank = new ScriptedStrategy("blank", "");

        assertThatThrownBy(() -> new TextExtractor(List.of(failing, blank)).extract("3424/v2.pdf", CONTENT))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("3424/v2.pdf")
                .hasMessageContaining("broken: corrupt xref")
                .hasMessageContaining("blank: no text");
    }

    @Test
    void pdfDefaultsExtractGeneratedPdf() {
        byte[] pdf = PdfFixtures.pdfWithLines(List.of("1. Introduction", "Baseline assessment."));

        ExtractedDocument document = TextExtractor.pdfDefaults().extract("v1", pdf);

        assertThat(document.extractionMethod()).isEqualTo("pdfbox");
        assertThat(document.rawText()).contains("1. Introduction").contains("Baseline assessment.");
    }

    @Test
    void pdfDefaultsRejectScanWithoutTextLayer() {
        assertThatThrownBy(() -> TextExtractor.pdfDefaults().extract("scan", PdfFixtures.blankPdf()))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("pdfbox: no text")
                .hasMessageContaining("pdfbox-pages: no text");
    }

    @Test
    void pageRecoveryTakesOverWhenWholeDocumentStripperFails() {
        byte[] pdf = PdfFixtures.pdfWithLines(List.of("Section 1", "Recovered body."));
        ScriptedStrategy failing = ScriptedStrategy.failing("pdfbox", new ExtractionException("broken content stream"));

        ExtractedDocument document = new TextExtractor(List.of(failing, new PdfBoxPageTextStrategy())).extract("v1", pdf);

        assertThat(document.extractionMethod()).isEqualTo("pdfbox-pages");
        assertThat(document.rawText()).contains("Section 1").contains("Recovered body.");
    }

    @Test
    void pdfDefaultsReportBothStrategiesForTruncatedPdf() {
        byte[] pdf = PdfFixtures.pdfWithLines(List.of("Section 1", "Body"));
        byte[] truncated = Arrays.copyOf(pdf, 9);

        assertThatThrownBy(() -> TextExtractor.pdfDefaults().extract("cut", truncated))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("pdfbox: ")
                .hasMessageContaining("pdfbox-pages: ");
    }

    @Test
    void requiresAtLeastOneStrategy() {
        assertThatThrownBy(() -> new TextExtractor(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    private static final class ScriptedStrategy implements TextExtractionStrategy {

        private final String name;
        private final String text;
        private final RuntimeException failure;
        private final List<byte[]> calls = new ArrayList<>();

        private ScriptedStrategy(String name, String text) {
            this(name, text, null);
        }

        private ScriptedStrategy(String name, String text, RuntimeException failure) {
            this.name = name;
            this.text = text;
            this.failure = failure;
        }

        static ScriptedStrategy failing(String name, RuntimeException failure) {
            return new ScriptedStrategy(name, null, failure);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String extract(byte[] content) {
            calls.add(content);
            if (failure != null) {
                throw failure;
            }
            return text;
        }
    }
}
