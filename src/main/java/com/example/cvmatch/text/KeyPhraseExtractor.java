package com.example.cvmatch.text;

import com.example.cvmatch.model.Skill;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Multi-word noun phrase candidates: runs of content tokens broken at stop words, numbers,
 * clause punctuation and, for ranked phrases, action verbs. Tokens are lower-cased and
 * singularized so that the phrases of a posting and the terms of a CV compare by equality.
 */
public final class KeyPhraseExtractor {

    private static final Pattern BREAKING_GAP = Pattern.compile("[.,;:!?()\\[\\]{}\"\\n\\r|]");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\p{N}");

    private final SkillDictionary dictionary;

    public KeyPhraseExtractor(SkillDictionary dictionary) {
        this.dictionary = dictionary;
    }

    /**
     * The {@code limit} most frequent 2 and 3 word phrases. Runs are also broken at action verbs;
     * dictionary skills and phrases containing one of the {@code captured} skills are left out.
     * Ties keep first-occurrence order.
     */
    public List<String> topPhrases(String text, Collection<Skill> captured, int limit) {
        Set<Skill> capturedSet = Set.copyOf(captured);
        Map<String, Integer> counts = new HashMap<>();
        Map<String, Integer> firstSeen = new HashMap<>();
        int position = 0;
        for (List<String> run : contentRuns(text, true)) {
            for (int n = 2; n <= 3; n++) {
                for (int i = 0; i + n <= run.size(); i++) {
                    String phrase = String.join(" ", run.subList(i, i + n));
                    counts.merge(phrase, 1, Integer::sum);
                    firstSeen.putIfAbsent(phrase, (position + i) * 4 + n);
                }
            }
            position += run.size() + 1;
        }
        return counts.keySet().stream()
                .filter(p -> !dictionary.isSkillPhrase(p) && !containsSkill(p, capturedSet))
                .sorted(Comparator.<String>comparingInt(counts::get).reversed()
                        .thenComparingInt(firstSeen::get))
                .limit(Math.max(0, limit))
                .toList();
    }

    /** Every 1 to 3 word term of {@code text}, in the same form {@link #topPhrases} produces. */
    public Set<String> terms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        for (List<String> run : contentRuns(text, false)) {
            for (int n = 1; n <= 3; n++) {
                for (int i = 0; i + n <= run.size(); i++) {
                    terms.add(String.join(" ", run.subList(i, i + n)));
                }
            }
        }
        return terms;
    }

    private boolean containsSkill(String phrase, Set<Skill> captured) {
        if (captured.isEmpty()) return false;
        List<String> words = List.of(phrase.split(" "));
        for (int n = 1; n <= words.size(); n++) {
            for (int i = 0; i + n <= words.size(); i++) {
                Optional<Skill> hit = dictionary.lookup(String.join(" ", words.subList(i, i + n)));
                if (hit.isPresent() && captured.contains(hit.get())) return true;
            }
        }
        return false;
    }

    List<List<String>> contentRuns(String text, boolean breakAtVerbs) {
        List<List<String>> runs = new ArrayList<>();
        if (text == null) return runs;
        String folded = TextNormalizer.fold(text);
        List<Token> tokens = TextNormalizer.tokenize(folded);
        List<String> run = new ArrayList<>();
        int prevEnd = -1;
        for (Token t : tokens) {
            boolean broken = prevEnd >= 0 && BREAKING_GAP.matcher(folded.substring(prevEnd, t.start())).find();
            if (broken) run = flush(runs, run);
            prevEnd = t.end();
            if (dictionary.isStopWord(t.norm()) || HAS_DIGIT.matcher(t.norm()).find()
                    || (breakAtVerbs && dictionary.isActionVerb(t.norm()))) {
                run = flush(runs, run);
                continue;
            }
            run.add(TextNormalizer.singular(t.norm()));
        }
        flush(runs, run);
        return runs;
    }

    private static List<String> flush(List<List<String>> runs, List<String> run) {
        if (!run.isEmpty()) runs.add(run);
        return run.isEmpty() ? run : new ArrayList<>();
    }
}
