package com.example.cvmatch.text;

import com.example.cvmatch.model.IndustryCategory;

import java.util.List;
import java.util.Map;

/** Picks the industry whose trigger terms occur most often; declaration order breaks ties. */
public final class IndustryClassifier {

    private final SkillDictionary dictionary;

    public IndustryClassifier(SkillDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public IndustryCategory classify(String text) {
        List<String> words = TextNormalizer.words(text);
        Map<IndustryCategory, List<List<String>>> triggers = dictionary.industryTriggers();
        IndustryCategory best = IndustryCategory.GENERAL;
        int bestHits = 0;
        for (IndustryCategory category : IndustryCategory.values()) {
            int hits = 0;
            for (List<String> phrase : triggers.getOrDefault(category, List.of())) {
                hits += TextNormalizer.countPhrase(words, phrase);
            }
            if (hits > bestHits) {
                best = category;
                bestHits = hits;
            }
        }
        return best;
    }
}
