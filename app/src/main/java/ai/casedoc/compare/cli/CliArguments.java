package ai.casedoc.compare.cli;

import ai.casedoc.compare.comparison.ComparisonMode;
import ai.casedoc.compare.config.LogFormat;
import ai.casedoc.compare.report.ReportEncoding;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "version-compare", description = "Compare stored versions of a case document and render a report")
public class CliArguments {

    @CommandLine.Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    private boolean helpRequested;

    @CommandLine.Option(names = "--case", description = "Case identifier", paramLabel = "CASE_ID")
    private String caseId;

    @CommandLine.Option(names = "--list-cases", description = "List the cases present in the store and exit")
    private boolean listCases;

    @CommandLine.Option(names = "--list", description = "List the versions of the case and exit")
    private boolean listVersions;

    @CommandLine.Option(names = "--mode", converter = ComparisonModeConverter.class,
            description = "Comparison mode: selective or sequential (default: selective when --version is given, otherwise sequential)")
    private ComparisonMode mode;

    @CommandLine.Option(names = "--version", description = "Version key or file name to compare (repeatable, selective mode)",
            paramLabel = "KEY")
    private List<String> versionIds = new ArrayList<>();

    @CommandLine.Option(names = "--format", converter = ReportEncodingConverter.class, description = "Report format: html or pdf")
    private ReportEncoding reportEncoding;

    @CommandLine.Option(names = "--output", description = "Directory the report is written to", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--storage-root", description = "Root directory of the document store", paramLabel = "DIR")
    private Path storageRoot;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--verbose", description = "Enable debug logging")
    private boolean verbose;

    public String caseId() {
        return caseId;
    }

    public boolean listCases() {
        return listCases;
    }

    public boolean listVersions() {
        return listVersions;
    }

    public ComparisonMode mode() {
        return mode;
    }

    public List<String> versionIds() {
        return versionIds == null ? List.of() : List.copyOf(versionIds);
    }

    public ReportEncoding reportEncoding() {
        return reportEncoding;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public Path storageRoot() {
        return storageRoot;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
