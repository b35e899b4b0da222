package ai.casedoc.compare.report;

import ai.casedoc.compare.comparison.ComparisonResult;
import java.io.IOException;

/**
 * Serialises a comparison result in one encoding. Implementations only read the result.
 */
interface ReportWriter {

    byte[] write(ComparisonResult result) throws IOException;
}
