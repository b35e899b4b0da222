package ai.casedoc.compare.extract;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovery strategy that reads a PDF one page at a time in position-sorted order. A page whose content
 * cannot be decoded is skipped and the text of the remaining pages is kept, whereas a whole-document
 * stripper gives up on the first broken page.
 */
public class PdfBoxPageTextStrategy implements TextExtractionStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfBoxPageTextStrategy.class);

    @Override
    public String name() {
        return "pdfbox-pages";
    }

    @Override
    public String extract(byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            if (document.isEncrypted() && !document.getCurrentAccessPermission().canExtractContent()) {
                throw new ExtractionException("document is encrypted and forbids text extraction");
            }
            int pageCount = document.getNumberOfPages();
            StringBuilder text = new StringBuilder();
            List<String> skipped = new ArrayList<>();
            for (int page = 1; page <= pageCount; page++) {
                try {
                    text.append(extractPage(document, page));
                } catch (IOException | RuntimeException ex) {
                    LOGGER.warn("Skipping unreadable page {} of {}: {}", page, pageCount, ex.getMessage());
                    skipped.add(page + " (" + ex.getMessage() + ")");
                }
            }
            if (pageCount > 0 && skipped.size() == pageCount) {
                throw new ExtractionException("every page is unreadable: " + String.join(", ", skipped));
            }
            return text.toString();
        } catch (InvalidPasswordException ex) {
            throw new ExtractionException("document is password protected", ex);
        } catch (IOException ex) {
            throw new ExtractionException("unreadable PDF: " + ex.getMessage(), ex);
        }
    }

    /**
     * Extracts the text of a single 1-based page.
     */
    protected String extractPage(PDDocument document, int page) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setLineSeparator("\n");
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        return stripper.getText(document);
    }
}
