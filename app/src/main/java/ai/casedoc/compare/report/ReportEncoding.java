package ai.casedoc.compare.report;

import java.util.List;
import java.util.Locale;

/**
 * Output encodings a comparison report can be rendered to.
 */
public enum ReportEncoding {
    HTML("interactive-markup", "text/html; charset=UTF-8", "html"),
    PDF("paginated-document", "application/pdf", "pdf");

    private final String alias;
    private final String contentType;
    private final String extension;

    ReportEncoding(String alias, String contentType, String extension) {
        this.alias = alias;
        this.contentType = contentType;
        this.extension = extension;
    }

    public String alias() {
        return alias;
    }

    public String contentType() {
        return contentType;
    }

    public String extension() {
        return extension;
    }

    /**
     * Accepts the enum name, the file extension or the descriptive alias, case-insensitively.
     *
     * @throws RenderException for anything else
     */
    public static ReportEncoding from(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (ReportEncoding encoding : values()) {
                if (List.of(encoding.extension, encoding.alias, encoding.name().toLowerCase(Locale.ROOT)).contains(normalized)) {
                    return encoding;
                }
            }
        }
        throw new RenderException("Unsupported report encoding: " + raw + " (expected html or pdf)");
    }
}
