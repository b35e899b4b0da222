package ai.casedoc.compare.segment;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits plain text into sections. Rules are tried in priority order against the whole text; the first
 * rule that recognises any heading fixes the grammar for the entire document.
 */
public class SectionSegmenter {

    public static final String PREAMBLE = "Preamble";
    public static final String FULL_DOCUMENT = "Full Document";

    private static final Logger LOGGER = LoggerFactory.getLogger(SectionSegmenter.class);

    private final List<HeadingRule> rules;

    public SectionSegmenter() {
        this(HeadingRule.DEFAULTS);
    }

    public SectionSegmenter(List<HeadingRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public SegmentedDocument segment(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return SegmentedDocument.empty();
        }
        List<String> lines = List.of(text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1));

        Optional<HeadingRule> grammar = selectGrammar(lines);
        if (grammar.isEmpty()) {
            LOGGER.debug("No heading rule matched; using a single implicit section");
            return new SegmentedDocument(text, List.of(new Section(FULL_DOCUMENT, 0, text.strip())), Optional.empty());
        }
        HeadingRule rule = grammar.get();
        LOGGER.debug("Segmenting with heading rule {}", rule.name());

        List<Section> sections = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String currentName = PREAMBLE;
        List<String> body = new ArrayList<>();
        for (String line : lines) {
            Optional<String> heading = rule.match(line);
            if (heading.isPresent() && !seen.contains(heading.get())) {
                flush(sections, seen, currentName, body);
                currentName = heading.get();
                seen.add(currentName);
                body = new ArrayList<>();
            } else {
                body.add(line);
            }
        }
        flush(sections, seen, currentName, body);
        return new SegmentedDocument(text, sections, Optional.of(rule.name()));
    }

    private Optional<HeadingRule> selectGrammar(List<String> lines) {
        for (HeadingRule rule : rules) {
            for (String line : lines) {
                if (rule.match(line).isPresent()) {
                    return Optional.of(rule);
                }
            }
        }
        return Optional.empty();
    }

    private static void flush(List<Section> sections, Set<String> seen, String name, List<String> body) {
        String text = String.join("\n", body).strip();
        if (name.equals(PREAMBLE)) {
            if (text.isEmpty()) {
                return;
            }
            seen.add(PREAMBLE);
        }
        sections.add(new Section(name, sections.size(), text));
    }
}
