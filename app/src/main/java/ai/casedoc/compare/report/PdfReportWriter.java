package ai.casedoc.compare.report;

import ai.casedoc.compare.comparison.ComparisonResult;
import ai.casedoc.compare.comparison.VersionFailure;
import ai.casedoc.compare.comparison.VersionPairComparison;
import ai.casedoc.compare.diff.DiffSummary;
import ai.casedoc.compare.diff.ModifiedPair;
import ai.casedoc.compare.diff.SectionDiff;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/**
 * Paginated A4 report drawn with the standard Helvetica fonts. Content follows the HTML report's order.
 */
class PdfReportWriter implements ReportWriter {

    private static final float MARGIN = 50f;
    private static final float BODY_SIZE = 10f;
    private static final float HEADING_SIZE = 13f;
    private static final float TITLE_SIZE = 18f;
    private static final float LEADING_FACTOR = 1.35f;
    private static final float INDENT = 14f;

    @Override
    public byte[] write(ComparisonResult result) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            try (PageCursor cursor = new PageCursor(document)) {
                cursor.line(ReportText.TITLE, cursor.bold, TITLE_SIZE, 0);
                cursor.gap();
                cursor.line("Case ID: " + result.caseId(), cursor.regular, BODY_SIZE, 0);
                cursor.line("Comparison Mode: " + ReportText.mode(result), cursor.regular, BODY_SIZE, 0);
                cursor.line("Generated: " + ReportText.generated(result), cursor.regular, BODY_SIZE, 0);
                cursor.line("Versions Compared: " + String.join(", ", ReportText.versionsCompared(result)),
                        cursor.regular, BODY_SIZE, 0);
                summary(cursor, "Overall", result.summary());

                if (result.hasErrors()) {
                    cursor.gap();
                    cursor.line("Versions that could not be compared", cursor.bold, HEADING_SIZE, 0);
                    for (VersionFailure failure : result.perVersionErrors()) {
                        cursor.line("* " + ReportText.failure(failure), cursor.regular, BODY_SIZE, INDENT);
                    }
                }
                for (VersionPairComparison pair : result.pairs()) {
                    pair(cursor, pair);
                }
            }
            document.save(out);
            return out.toByteArray();
        }
    }

    private void pair(PageCursor cursor, VersionPairComparison pair) throws IOException {
        cursor.gap();
        cursor.line(ReportText.pairTitle(pair), cursor.bold, HEADING_SIZE, 0);
        if (!pair.isComparable()) {
            cursor.line("[" + ReportText.NOT_COMPARABLE + "]", cursor.bold, BODY_SIZE, 0);
            for (VersionFailure failure : pair.failures()) {
                cursor.line("* " + ReportText.failure(failure), cursor.regular, BODY_SIZE, INDENT);
            }
            return;
        }
        summary(cursor, "Sections", pair.summary());
        for (SectionDiff section : pair.sectionDiffs()) {
            cursor.gap();
            cursor.line(section.sectionName() + " [" + ReportText.badge(section.status()) + "]", cursor.bold, BODY_SIZE + 1, 0);
            switch (section.status()) {
                case UNCHANGED -> cursor.line(ReportText.noChanges(), cursor.regular, BODY_SIZE, INDENT);
                case ADDED -> lines(cursor, "Section Added", "+ ", section.addedLines());
                case REMOVED -> lines(cursor, "Section Removed", "- ", section.removedLines());
                case MODIFIED -> {
                    lines(cursor, "Added Lines", "+ ", section.addedLines());
                    lines(cursor, "Removed Lines", "- ", section.removedLines());
                    modified(cursor, section.modifiedPairs());
                }
            }
        }
    }

    private void summary(PageCursor cursor, String caption, DiffSummary summary) throws IOException {
        cursor.line(caption + ": Total " + summary.total()
                + " | Added " + summary.added()
                + " | Removed " + summary.removed()
                + " | Modified " + summary.modified()
                + " | Unchanged " + summary.unchanged(), cursor.regular, BODY_SIZE, 0);
    }

    private void lines(PageCursor cursor, String label, String marker, List<String> lines) throws IOException {
        if (lines.isEmpty()) {
            return;
        }
        cursor.line(label + " (" + lines.size() + ")", cursor.bold, BODY_SIZE, INDENT);
        for (String line : lines) {
            cursor.line(marker + line, cursor.regular, BODY_SIZE, INDENT * 2);
        }
    }

    private void modified(PageCursor cursor, List<ModifiedPair> pairs) throws IOException {
        if (pairs.isEmpty()) {
            return;
        }
        cursor.line("Modified Lines (" + pairs.size() + ")", cursor.bold, BODY_SIZE, INDENT);
        for (ModifiedPair pair : pairs) {
            cursor.line("Old: " + pair.oldLine(), cursor.regular, BODY_SIZE, INDENT * 2);
            cursor.line("New: " + pair.newLine(), cursor.regular, BODY_SIZE, INDENT * 2);
        }
    }

    /**
     * Replaces characters the WinAnsi encoding of the standard fonts cannot show.
     */
    static String sanitize(String text) {
        StringBuilder clean = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '\t', '\r', '\n', '\u00A0' -> clean.append(' ');
                case '\u2018', '\u2019' -> clean.append('\'');
                case '\u201C', '\u201D' -> clean.append('"');
                case '\u2013', '\u2014' -> clean.append('-');
                case '\u2022' -> clean.append('*');
                case '\u2026' -> clean.append("...");
                case '\u2192' -> clean.append("->");
                default -> {
                    if ((ch >= 0x20 && ch <= 0x7E) || (ch >= 0xA1 && ch <= 0xFF)) {
                        clean.append(ch);
                    } else {
                        clean.append('?');
                    }
                }
            }
        }
        return clean.toString();
    }

    /**
     * Tracks the current page and vertical position, starting a new page when the next line does not fit.
     */
    private static final class PageCursor implements AutoCloseable {

        private final PDDocument document;
        private final PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        private final PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        private final float width = PDRectangle.A4.getWidth() - 2 * MARGIN;
        private PDPageContentStream stream;
        private float y;

        PageCursor(PDDocument document) throws IOException {
            this.document = document;
            newPage();
        }

        void gap() {
            y -= BODY_SIZE;
        }

        void line(String text, PDType1Font font, float size, float indent) throws IOException {
            float leading = size * LEADING_FACTOR;
            for (String wrapped : wrap(sanitize(text), font, size, width - indent)) {
                if (y - leading < MARGIN) {
                    newPage();
                }
                y -= leading;
                stream.beginText();
                stream.setFont(font, size);
                stream.newLineAtOffset(MARGIN + indent, y);
                stream.showText(wrapped);
                stream.endText();
            }
        }

        private List<String> wrap(String text, PDType1Font font, float size, float maxWidth) throws IOException {
            List<String> lines = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            for (String word : text.split(" ")) {
                String candidate = current.length() == 0 ? word : current + " " + word;
                if (width(candidate, font, size) <= maxWidth) {
                    current.setLength(0);
                    current.append(candidate);
                    continue;
                }
                if (current.length() > 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                }
                String rest = word;
                while (width(rest, font, size) > maxWidth && rest.length() > 1) {
                    int cut = rest.length() - 1;
                    while (cut > 1 && width(rest.substring(0, cut), font, size) > maxWidth) {
                        cut--;
                    }
                    lines.add(rest.substring(0, cut));
                    rest = rest.substring(cut);
                }
                current.append(rest);
            }
            lines.add(current.toString());
            return lines;
        }

        private static float width(String text, PDType1Font font, float size) throws IOException {
            return font.getStringWidth(text) / 1000f * size;
        }

        private void newPage() throws IOException {
            if (stream != null) {
                stream.close();
            }
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = PDRectangle.A4.getHeight() - MARGIN;
        }

        @Override
        public void close() throws IOException {
            if (stream != null) {
                stream.close();
            }
        }
    }
}
