package ai.casedoc.compare.extract;

/**
 * Raised when a document yields no text through any extraction strategy.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
