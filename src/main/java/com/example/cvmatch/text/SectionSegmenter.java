package com.example.cvmatch.text;

import com.example.cvmatch.config.MatchingProperties;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits a document into labeled sections by heading keywords. A heading is either a line of
 * its own (optionally ending in a colon) or a known phrase followed by a colon inside running
 * text, which keeps whitespace-collapsed documents segmentable.
 */
public final class SectionSegmenter {

    private static final Pattern ITEM_BREAK = Pattern.compile(
            "\\r?\\n|[•·▪◦‣]|;|(?<=[.!?])\\s+(?=\\p{Lu})|(?<=[\\p{L}.,)])\\s+[-*]\\s+(?=\\p{Lu})");
    private static final Pattern LEADING_BULLET = Pattern.compile("^[\\s\\-*–—>]+");
    private static final Pattern TRAILING_PUNCT = Pattern.compile("[\\s.;,]+$");

    private final Pattern headingPattern;
    private final Map<String, SectionKind> kindByHeading = new HashMap<>();

    public SectionSegmenter(MatchingProperties properties) {
        List<String> synonyms = new ArrayList<>();
        properties.getSectionHeaders().forEach((kind, list) -> {
            for (String s : list) {
                String key = TextNormalizer.normalize(s);
                if (key.isEmpty()) continue;
                kindByHeading.putIfAbsent(key, kind);
                synonyms.add(s.trim());
            }
        });
        String alternation = synonyms.stream()
                .distinct()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(s -> Pattern.quote(s).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
        this.headingPattern = Pattern.compile(
                "^[ \\t]*[#*]*[ \\t]*(" + alternation + ")[ \\t]*:?[ \\t]*$"
                        + "|(?<![\\p{L}\\p{N}])(" + alternation + ")[ \\t]*:",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE);
    }

    public List<Section> segment(String text) {
        List<Section> sections = new ArrayList<>();
        if (text == null || text.isBlank()) return sections;

        Matcher m = headingPattern.matcher(text);
        int bodyStart = 0;
        SectionKind kind = SectionKind.PREAMBLE;
        String heading = null;
        while (m.find()) {
            addSection(sections, kind, heading, text.substring(bodyStart, m.start()));
            heading = m.group(1) != null ? m.group(1) : m.group(2);
            kind = kindByHeading.getOrDefault(TextNormalizer.normalize(heading), SectionKind.OTHER);
            bodyStart = m.end();
        }
        addSection(sections, kind, heading, text.substring(bodyStart));
        return sections;
    }

    private static void addSection(List<Section> sections, SectionKind kind, String heading, String body) {
        if (body.isBlank() && kind == SectionKind.PREAMBLE) return;
        sections.add(new Section(kind, heading, body.strip()));
    }

    /** Raw fragments of a section body, split like {@link #splitItems} but without filtering. */
    public static List<String> fragments(String body) {
        if (body == null || body.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String part : ITEM_BREAK.split(body)) {
            if (!part.isBlank()) out.add(part.strip());
        }
        return out;
    }

    /**
     * Items of a section body: one per line, bullet, semicolon or sentence. Items shorter than
     * two tokens are dropped and repeats (ignoring case and punctuation) are removed.
     */
    public static List<String> splitItems(String body) {
        if (body == null || body.isBlank()) return List.of();
        Set<String> seen = new LinkedHashSet<>();
        List<String> items = new ArrayList<>();
        for (String part : ITEM_BREAK.split(body)) {
            String item = TRAILING_PUNCT.matcher(LEADING_BULLET.matcher(part).replaceFirst("")).replaceFirst("");
            if (TextNormalizer.countTokens(item) < 2) continue;
            if (seen.add(TextNormalizer.normalize(item))) items.add(item);
        }
        return items;
    }
}
