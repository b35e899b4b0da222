package ai.casedoc.compare.report;

/**
 * Raised for unsupported encodings or results that cannot be rendered.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
