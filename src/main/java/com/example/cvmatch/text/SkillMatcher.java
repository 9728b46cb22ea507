package com.example.cvmatch.text;

import com.example.cvmatch.model.Skill;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Finds dictionary skills in free text by greedy longest n-gram lookup. A token consumed by a
 * longer match is not reused, so "Spring Boot" never also yields "Spring".
 */
public final class SkillMatcher {

    /** Gap allowed inside one n-gram: blanks, or a single joiner such as "." in "Node.js". */
    private static final Pattern JOINABLE_GAP = Pattern.compile("[ \\t]+|[./&_\\-]");

    private final SkillDictionary dictionary;

    public SkillMatcher(SkillDictionary dictionary) {
        this.dictionary = dictionary;
    }

    /** Skills mentioned in {@code text}, first-occurrence order, surface forms merged per id. */
    public List<Skill> match(String text) {
        if (text == null || text.isBlank()) return List.of();
        String folded = TextNormalizer.fold(text);
        List<Token> tokens = TextNormalizer.tokenize(folded);
        boolean[] used = new boolean[tokens.size()];
        List<Hit> hits = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            if (used[i]) continue;
            int maxLen = Math.min(dictionary.maxAliasTokens(), tokens.size() - i);
            for (int len = maxLen; len >= 1; len--) {
                if (!joinable(folded, tokens, i, len, used)) continue;
                Optional<Skill> skill = lookup(tokens, i, len);
                if (skill.isPresent()) {
                    int start = tokens.get(i).start();
                    int end = tokens.get(i + len - 1).end();
                    hits.add(new Hit(skill.get(), folded.substring(start, end)));
                    for (int k = i; k < i + len; k++) used[k] = true;
                    break;
                }
            }
        }

        Map<String, Skill> merged = new LinkedHashMap<>();
        for (Hit hit : hits) {
            merged.merge(hit.skill().id(), hit.skill().withSurfaceForms(Set.of(hit.surface())),
                    (a, b) -> a.withSurfaceForms(union(a.surfaceForms(), b.surfaceForms())));
        }
        return List.copyOf(merged.values());
    }

    private Optional<Skill> lookup(List<Token> tokens, int from, int len) {
        if (len == 1) {
            Optional<Skill> exact = dictionary.lookupCaseSensitive(tokens.get(from).raw());
            if (exact.isPresent()) return exact;
        }
        StringBuilder phrase = new StringBuilder();
        for (int k = from; k < from + len; k++) {
            if (k > from) phrase.append(' ');
            phrase.append(tokens.get(k).norm());
        }
        return dictionary.lookup(phrase.toString());
    }

    private static boolean joinable(String folded, List<Token> tokens, int from, int len, boolean[] used) {
        for (int k = from + 1; k < from + len; k++) {
            if (used[k]) return false;
            String gap = folded.substring(tokens.get(k - 1).end(), tokens.get(k).start());
            if (!JOINABLE_GAP.matcher(gap).matches()) return false;
        }
        return true;
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> out = new TreeSet<>(a);
        out.addAll(b);
        return out;
    }

    /**
     * Union of several skill lists by id, keeping the first list's order and appending new ids
     * from later lists. Surface forms of repeated ids are merged.
     */
    @SafeVarargs
    public static List<Skill> unionOf(Collection<Skill>... lists) {
        Map<String, Skill> merged = new LinkedHashMap<>();
        for (Collection<Skill> list : lists) {
            for (Skill s : list) {
                merged.merge(s.id(), s, (a, b) -> a.withSurfaceForms(union(a.surfaceForms(), b.surfaceForms())));
            }
        }
        return List.copyOf(merged.values());
    }

    private record Hit(Skill skill, String surface) {}
}
