package ai.casedoc.compare.segment;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heading grammar: a whole-line pattern plus the function that turns a match into a section label.
 */
public record HeadingRule(String name, Pattern pattern, Function<MatchResult, String> labeler) {

    public static final HeadingRule NUMBERED_SECTION = new HeadingRule("numbered-section",
            Pattern.compile("^section\\s+(\\d+)(?:[:\\-.\\s]+(\\S.*))?$", Pattern.CASE_INSENSITIVE),
            match -> label("Section " + match.group(1), match.group(2)));

    public static final HeadingRule NUMBERED_LIST = new HeadingRule("numbered-list",
            Pattern.compile("^(\\d+)\\.\\s+([A-Z].*)$"),
            match -> label("Section " + match.group(1), match.group(2)));

    public static final HeadingRule ROMAN_PART = new HeadingRule("roman-part",
            Pattern.compile("^part\\s+([IVXLC]+)(?:[:\\-.\\s]+(\\S.*))?$", Pattern.CASE_INSENSITIVE),
            match -> label("Part " + match.group(1).toUpperCase(Locale.ROOT), match.group(2)));

    /** Built-in rules in priority order. */
    public static final List<HeadingRule> DEFAULTS = List.of(NUMBERED_SECTION, NUMBERED_LIST, ROMAN_PART);

    public HeadingRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(labeler, "labeler");
    }

    /**
     * Returns the section label when the (trimmed) line is a heading under this rule.
     */
    public Optional<String> match(String line) {
        Matcher matcher = pattern.matcher(line.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(labeler.apply(matcher.toMatchResult()));
    }

    private static String label(String prefix, String title) {
        if (title == null || title.isBlank()) {
            return prefix;
        }
        return prefix + ": " + title.strip();
    }
}
