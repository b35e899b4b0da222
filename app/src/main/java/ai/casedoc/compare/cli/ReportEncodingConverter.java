package ai.casedoc.compare.cli;

import ai.casedoc.compare.report.RenderException;
import ai.casedoc.compare.report.ReportEncoding;
import picocli.CommandLine;

public class ReportEncodingConverter implements CommandLine.ITypeConverter<ReportEncoding> {
    @Override
    public ReportEncoding convert(String value) {
        try {
            return ReportEncoding.from(value);
        } catch (RenderException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
