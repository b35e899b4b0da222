package ai.casedoc.compare.extract;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Treats the bytes as UTF-8 text. PDF input is rejected so that this strategy never masks a PDF parse
 * failure with binary garbage.
 */
public class PlainTextStrategy implements TextExtractionStrategy {

    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

    @Override
    public String name() {
        return "plain-text";
    }

    @Override
    public String extract(byte[] content) {
        if (startsWith(content, PDF_MAGIC)) {
            throw new ExtractionException("content is a PDF, not plain text");
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new ExtractionException("content is not valid UTF-8 text", ex);
        }
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
