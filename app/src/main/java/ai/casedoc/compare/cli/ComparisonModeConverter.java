package ai.casedoc.compare.cli;

import ai.casedoc.compare.comparison.ComparisonMode;
import picocli.CommandLine;

/**
 * Parses {@code --mode}; {@code all} is accepted as a synonym for sequential.
 */
public class ComparisonModeConverter implements CommandLine.ITypeConverter<ComparisonMode> {
    @Override
    public ComparisonMode convert(String value) {
        try {
            return ComparisonMode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage() + " (expected selective or sequential)");
        }
    }
}
