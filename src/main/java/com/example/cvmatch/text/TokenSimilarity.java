package com.example.cvmatch.text;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/** Jaccard overlap of content tokens, with action-verb synonyms collapsed first. */
public final class TokenSimilarity {

    private final SkillDictionary dictionary;

    public TokenSimilarity(SkillDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public Set<String> contentTokens(String text) {
        Set<String> out = new LinkedHashSet<>();
        for (String word : TextNormalizer.words(text)) {
            String canonical = dictionary.canonicalToken(word);
            if (dictionary.isStopWord(canonical)) continue;
            out.add(TextNormalizer.singular(canonical));
        }
        return out;
    }

    /** 0 when either side has no content tokens. */
    public double jaccard(String a, String b) {
        return jaccard(contentTokens(a), contentTokens(b));
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }
}
