package ai.casedoc.compare.extract;

import java.io.IOException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * Extracts the text layer of a PDF with Apache PDFBox. In position-sorted mode glyphs are re-ordered by
 * their page coordinates, which recovers reading order for documents whose content streams are
 * written out of order.
 */
public class PdfBoxTextStrategy implements TextExtractionStrategy {

    private final boolean sortByPosition;

    public PdfBoxTextStrategy(boolean sortByPosition) {
        this.sortByPosition = sortByPosition;
    }

    @Override
    public String name() {
        return sortByPosition ? "pdfbox-positional" : "pdfbox";
    }

    @Override
    public String extract(byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            if (document.isEncrypted() && !document.getCurrentAccessPermission().canExtractContent()) {
                throw new ExtractionException("document is encrypted and forbids text extraction");
            }
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(sortByPosition);
            stripper.setLineSeparator("\n");
            return stripper.getText(document);
        } catch (InvalidPasswordException ex) {
            throw new ExtractionException("document is password protected", ex);
        } catch (IOException ex) {
            throw new ExtractionException("unreadable PDF: " + ex.getMessage(), ex);
        }
    }
}
