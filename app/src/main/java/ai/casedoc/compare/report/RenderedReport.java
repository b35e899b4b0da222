package ai.casedoc.compare.report;

import java.util.Objects;

/**
 * Rendered bytes together with what a download needs to serve them.
 */
public record RenderedReport(ReportEncoding encoding, String fileName, byte[] content) {

    public RenderedReport {
        Objects.requireNonNull(encoding, "encoding");
        Objects.requireNonNull(fileName, "fileName");
        content = Objects.requireNonNull(content, "content").clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public String contentType() {
        return encoding.contentType();
    }
}
