package ai.casedoc.compare.catalog;

import ai.casedoc.compare.storage.StoredObject;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recognises version objects by file name. Accepted shapes:
 * <ul>
 *   <li>{@code YYYYMMDDHHMM-<caseId>-<type>.pdf} with {@code type} among the configured document types</li>
 *   <li>any {@code .pdf} whose name contains {@value #GROUND_TRUTH_MARKER}</li>
 * </ul>
 */
public class VersionKeyParser {

    static final String GROUND_TRUTH_MARKER = "GroundTruth";

    private static final Pattern REPORT_NAME = Pattern.compile("^(\\d{12})-(.+)-([A-Za-z0-9_]+)\\.pdf$", Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("uuuuMMddHHmm", Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private final Set<String> documentTypes;

    public VersionKeyParser(List<String> documentTypes) {
        Objects.requireNonNull(documentTypes, "documentTypes");
        this.documentTypes = documentTypes.stream()
                .map(type -> type.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public Optional<VersionDescriptor> parse(String caseId, StoredObject object) {
        String fileName = object.fileName();
        Matcher matcher = REPORT_NAME.matcher(fileName);
        if (matcher.matches()) {
            if (!matcher.group(2).equals(caseId) || !documentTypes.contains(matcher.group(3).toLowerCase(Locale.ROOT))) {
                return Optional.empty();
            }
            return parseTimestamp(matcher.group(1))
                    .map(timestamp -> new VersionDescriptor(object.key(), caseId, timestamp, object.size(), fileName,
                            VersionKind.REPORT));
        }
        if (fileName.contains(GROUND_TRUTH_MARKER) && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            LocalDateTime timestamp = LocalDateTime.ofInstant(object.lastModified(), ZoneOffset.UTC);
            return Optional.of(new VersionDescriptor(object.key(), caseId, timestamp, object.size(), fileName,
                    VersionKind.GROUND_TRUTH));
        }
        return Optional.empty();
    }

    private static Optional<LocalDateTime> parseTimestamp(String raw) {
        try {
            return Optional.of(LocalDateTime.parse(raw, TIMESTAMP));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }
}
