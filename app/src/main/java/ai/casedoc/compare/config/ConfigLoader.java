package ai.casedoc.compare.config;

import ai.casedoc.compare.cli.CliArguments;
import ai.casedoc.compare.report.RenderException;
import ai.casedoc.compare.report.ReportEncoding;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a {@link CompareConfig} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_STORAGE_ROOT = "STORAGE_ROOT";
    static final String ENV_VERSION_DOCUMENT_TYPES = "VERSION_DOCUMENT_TYPES";
    static final String ENV_COMPARE_WORKER_THREADS = "COMPARE_WORKER_THREADS";
    static final String ENV_STORAGE_MAX_RETRY_ATTEMPTS = "STORAGE_MAX_RETRY_ATTEMPTS";
    static final String ENV_STORAGE_INITIAL_BACKOFF_MILLIS = "STORAGE_INITIAL_BACKOFF_MILLIS";
    static final String ENV_STORAGE_MAX_BACKOFF_MILLIS = "STORAGE_MAX_BACKOFF_MILLIS";
    static final String ENV_STORAGE_RETRY_JITTER_FACTOR = "STORAGE_RETRY_JITTER_FACTOR";
    static final String ENV_COMPARE_TIMEOUT_SECONDS = "COMPARE_TIMEOUT_SECONDS";
    static final String ENV_REPORT_FORMAT = "REPORT_FORMAT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_STORAGE_ROOT = "storage";
    private static final List<String> DEFAULT_DOCUMENT_TYPES = List.of("CompleteAIGeneratedReport", "LCP", "LifeCarePlan");
    private static final int DEFAULT_WORKER_THREADS = 4;
    private static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    private static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 200;
    private static final long DEFAULT_MAX_BACKOFF_MILLIS = 5_000;
    private static final double DEFAULT_RETRY_JITTER_FACTOR = 0.2;
    private static final long DEFAULT_TIMEOUT_SECONDS = 300;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public CompareConfig load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path storageRoot = arguments.storageRoot() != null
                ? arguments.storageRoot()
                : Path.of(environmentReader.getNonBlank(ENV_STORAGE_ROOT).orElse(DEFAULT_STORAGE_ROOT));

        List<String> documentTypes = environmentReader.getNonBlank(ENV_VERSION_DOCUMENT_TYPES)
                .map(ConfigLoader::parseDocumentTypes)
                .orElse(DEFAULT_DOCUMENT_TYPES);

        int workerThreads = readPositiveInt(ENV_COMPARE_WORKER_THREADS, DEFAULT_WORKER_THREADS);
        int maxAttempts = readPositiveInt(ENV_STORAGE_MAX_RETRY_ATTEMPTS, DEFAULT_MAX_RETRY_ATTEMPTS);
        long initialBackoffMillis = readNonNegativeLong(ENV_STORAGE_INITIAL_BACKOFF_MILLIS, DEFAULT_INITIAL_BACKOFF_MILLIS);
        long maxBackoffMillis = readNonNegativeLong(ENV_STORAGE_MAX_BACKOFF_MILLIS, DEFAULT_MAX_BACKOFF_MILLIS);
        double jitterFactor = environmentReader.getNonBlank(ENV_STORAGE_RETRY_JITTER_FACTOR)
                .map(raw -> parse(ENV_STORAGE_RETRY_JITTER_FACTOR, raw, Double::parseDouble))
                .orElse(DEFAULT_RETRY_JITTER_FACTOR);
        long timeoutSeconds = readPositiveLong(ENV_COMPARE_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS);

        if (maxBackoffMillis < initialBackoffMillis) {
            throw new IllegalArgumentException(ENV_STORAGE_MAX_BACKOFF_MILLIS + " must be at least "
                    + ENV_STORAGE_INITIAL_BACKOFF_MILLIS);
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(ENV_STORAGE_RETRY_JITTER_FACTOR + " must be between 0.0 and 1.0");
        }

        RetryPolicy retryPolicy = new RetryPolicy(maxAttempts,
                Duration.ofMillis(initialBackoffMillis),
                Duration.ofMillis(maxBackoffMillis),
                jitterFactor);
        CompareSettings settings = new CompareSettings(workerThreads, Duration.ofSeconds(timeoutSeconds), retryPolicy);

        return new CompareConfig(storageRoot, documentTypes, settings, resolveReportEncoding(arguments),
                resolveLogFormat(arguments));
    }

    private ReportEncoding resolveReportEncoding(CliArguments arguments) {
        if (arguments.reportEncoding() != null) {
            return arguments.reportEncoding();
        }
        return environmentReader.getNonBlank(ENV_REPORT_FORMAT)
                .map(raw -> {
                    try {
                        return ReportEncoding.from(raw);
                    } catch (RenderException ex) {
                        throw new IllegalArgumentException(ENV_REPORT_FORMAT + ": " + ex.getMessage(), ex);
                    }
                })
                .orElse(ReportEncoding.HTML);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        if (arguments.logFormat() != null) {
            return arguments.logFormat();
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int readPositiveInt(String key, int defaultValue) {
        int value = environmentReader.getNonBlank(key)
                .map(raw -> parse(key, raw, Integer::parseInt))
                .orElse(defaultValue);
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be at least 1");
        }
        return value;
    }

    private long readPositiveLong(String key, long defaultValue) {
        long value = readNonNegativeLong(key, defaultValue);
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be at least 1");
        }
        return value;
    }

    private long readNonNegativeLong(String key, long defaultValue) {
        long value = environmentReader.getNonBlank(key)
                .map(raw -> parse(key, raw, Long::parseLong))
                .orElse(defaultValue);
        if (value < 0) {
            throw new IllegalArgumentException(key + " must be zero or greater");
        }
        return value;
    }

    private static <T> T parse(String key, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be numeric but was '" + raw + "'", ex);
        }
    }

    private static List<String> parseDocumentTypes(String raw) {
        Set<String> types = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (types.isEmpty()) {
            throw new IllegalArgumentException(ENV_VERSION_DOCUMENT_TYPES + " must list at least one type");
        }
        return List.copyOf(types);
    }
}
