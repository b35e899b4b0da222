package ai.casedoc.compare.extract;

/**
 * One way of turning document bytes into plain text.
 */
public interface TextExtractionStrategy {

    String name();

    /**
     * @return the extracted text, possibly empty when the document has no text layer
     * @throws ExtractionException if the bytes cannot be read by this strategy
     */
    String extract(byte[] content);
}
