package ai.casedoc.compare.cli;

import ai.casedoc.compare.VersionComparisonService;
import ai.casedoc.compare.catalog.CatalogException;
import ai.casedoc.compare.catalog.VersionDescriptor;
import ai.casedoc.compare.comparison.ComparisonException;
import ai.casedoc.compare.comparison.ComparisonMode;
import ai.casedoc.compare.comparison.ComparisonRequest;
import ai.casedoc.compare.comparison.ComparisonResult;
import ai.casedoc.compare.comparison.VersionFailure;
import ai.casedoc.compare.config.CompareConfig;
import ai.casedoc.compare.config.ConfigLoader;
import ai.casedoc.compare.config.SystemEnvironmentReader;
import ai.casedoc.compare.logging.LoggingConfigurator;
import ai.casedoc.compare.report.RenderException;
import ai.casedoc.compare.report.RenderedReport;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and comparison service.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final Function<CompareConfig, VersionComparisonService> serviceFactory;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), VersionComparisonService::create, null, null);
    }

    CliApplication(ConfigLoader configLoader, Function<CompareConfig, VersionComparisonService> serviceFactory,
                   PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.serviceFactory = serviceFactory;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        if (out != null) {
            commandLine.setOut(out);
        }
        if (err != null) {
            commandLine.setErr(err);
        }

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }

        if (!cliArguments.listCases() && (cliArguments.caseId() == null || cliArguments.caseId().isBlank())) {
            commandLine.getErr().println("Missing required option: '--case=CASE_ID'");
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        CompareConfig config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println("Invalid configuration: " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
        LOGGER.info("Using storage root {} (report format {})", config.storageRoot(), config.reportEncoding().extension());

        VersionComparisonService service = serviceFactory.apply(config);
        PrintWriter stdout = commandLine.getOut();
        try {
            if (cliArguments.listCases()) {
                service.listCases().forEach(stdout::println);
                stdout.flush();
                return 0;
            }
            if (cliArguments.listVersions()) {
                printVersions(stdout, service.listVersions(cliArguments.caseId()));
                return 0;
            }
            ComparisonRequest request;
            try {
                request = buildRequest(cliArguments);
            } catch (IllegalArgumentException ex) {
                commandLine.getErr().println(ex.getMessage());
                return commandLine.getCommandSpec().exitCodeOnInvalidInput();
            }
            ComparisonResult result = service.compareVersions(cliArguments.caseId(), request);
            for (VersionFailure failure : result.perVersionErrors()) {
                LOGGER.warn("Version {} skipped during {}: {}", failure.versionId(), failure.stage(), failure.message());
            }
            RenderedReport report = service.renderReport(result, config.reportEncoding());
            Path target = writeReport(cliArguments.outputDirectory(), report);
            stdout.println(target);
            stdout.flush();
            return 0;
        } catch (CatalogException | ComparisonException | RenderException ex) {
            LOGGER.error("Comparison for case {} failed: {}", cliArguments.caseId(), ex.getMessage());
            commandLine.getErr().println(ex.getMessage());
            commandLine.getErr().flush();
            return EXIT_FAILURE;
        } catch (IOException ex) {
            LOGGER.error("Failed to write report for case {}", cliArguments.caseId(), ex);
            commandLine.getErr().println("Failed to write report: " + ex.getMessage());
            commandLine.getErr().flush();
            return EXIT_FAILURE;
        }
    }

    static ComparisonRequest buildRequest(CliArguments arguments) {
        List<String> versionIds = arguments.versionIds().stream()
                .map(id -> id.contains("/") ? id : arguments.caseId() + "/" + id)
                .collect(Collectors.toList());
        ComparisonMode mode = arguments.mode() != null
                ? arguments.mode()
                : versionIds.isEmpty() ? ComparisonMode.SEQUENTIAL : ComparisonMode.SELECTIVE;
        return mode == ComparisonMode.SEQUENTIAL
                ? new ComparisonRequest(mode, versionIds)
                : ComparisonRequest.selective(versionIds);
    }

    private static void printVersions(PrintWriter stdout, List<VersionDescriptor> versions) {
        for (VersionDescriptor version : versions) {
            stdout.printf("%s\t%s\t%d\t%s%n", version.id(), version.timestamp(), version.size(), version.kind());
        }
        stdout.flush();
    }

    private static Path writeReport(Path outputDirectory, RenderedReport report) throws IOException {
        Path directory = outputDirectory != null ? outputDirectory : Path.of(".");
        Files.createDirectories(directory);
        Path target = directory.resolve(report.fileName());
        Files.write(target, report.content());
        LOGGER.info("Wrote {} ({} bytes)", target, report.content().length);
        return target;
    }
}
