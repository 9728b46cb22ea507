package com.example.cvmatch.text;

import com.example.cvmatch.model.ExperienceLevel;
import com.example.cvmatch.model.IndustryCategory;
import com.example.cvmatch.model.Skill;
import com.example.cvmatch.model.SkillCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Versioned, read-only lookup table of skills, synonyms and the small vocabularies the
 * extractors need. Built once from a {@link DictionaryDocument}; every alias is stored in
 * {@link TextNormalizer#normalize normalized} form.
 */
public final class SkillDictionary {

    private static final String SKILL_PLACEHOLDER = "{skill}";

    private final String version;
    private final Map<String, Skill> byAlias = new HashMap<>();
    private final Map<String, Skill> byCaseSensitiveAlias = new HashMap<>();
    private final List<Skill> skills = new ArrayList<>();
    private final Set<String> stopWords;
    private final Map<String, String> tokenSynonyms;
    private final Set<String> actionVerbs;
    private final Map<ExperienceLevel, List<List<String>>> seniorityPhrases = new EnumMap<>(ExperienceLevel.class);
    private final Map<String, List<String>> cultureSignals = new LinkedHashMap<>();
    private final Map<IndustryCategory, List<List<String>>> industryTriggers = new EnumMap<>(IndustryCategory.class);
    private final Map<SkillCategory, String> learningSuggestions = new EnumMap<>(SkillCategory.class);
    private final String genericLearningSuggestion;
    private int maxAliasTokens = 1;

    public SkillDictionary(DictionaryDocument doc) {
        this.version = doc.version() == null ? "unversioned" : doc.version();

        for (DictionaryDocument.SkillEntry entry : nullSafe(doc.skills())) {
            String id = TextNormalizer.normalize(entry.name());
            if (id.isEmpty()) {
                throw new IllegalArgumentException("Dictionary skill without a usable name: " + entry);
            }
            Skill skill = new Skill(id,
                    entry.name(),
                    entry.category() == null ? SkillCategory.UNCATEGORIZED : entry.category(),
                    Set.of());
            skills.add(skill);
            // names listed as case-sensitive ("Go", "Swift") are ordinary words in lower case
            if (!nullSafe(entry.caseSensitiveAliases()).contains(entry.name())) registerAlias(id, skill);
            for (String alias : nullSafe(entry.aliases())) registerAlias(TextNormalizer.normalize(alias), skill);
            for (String alias : nullSafe(entry.caseSensitiveAliases())) byCaseSensitiveAlias.put(alias.trim(), skill);
        }

        Set<String> stops = new LinkedHashSet<>();
        for (String w : nullSafe(doc.stopWords())) stops.add(TextNormalizer.normalize(w));
        this.stopWords = Collections.unmodifiableSet(stops);

        Map<String, String> synonyms = new HashMap<>();
        if (doc.tokenSynonyms() != null) {
            doc.tokenSynonyms().forEach((k, v) ->
                    synonyms.put(TextNormalizer.normalize(k), TextNormalizer.normalize(v)));
        }
        this.tokenSynonyms = Collections.unmodifiableMap(synonyms);
        Set<String> verbs = new HashSet<>(synonyms.keySet());
        verbs.addAll(synonyms.values());
        this.actionVerbs = Collections.unmodifiableSet(verbs);

        if (doc.seniorityTerms() != null) {
            doc.seniorityTerms().forEach((level, terms) -> seniorityPhrases.put(level, tokenized(terms)));
        }
        for (String signal : nullSafe(doc.cultureSignals())) {
            cultureSignals.put(signal, TextNormalizer.words(signal));
        }
        if (doc.industryCategories() != null) {
            doc.industryCategories().forEach((cat, terms) -> industryTriggers.put(cat, tokenized(terms)));
        }
        if (doc.learningSuggestions() != null) learningSuggestions.putAll(doc.learningSuggestions());
        this.genericLearningSuggestion = doc.genericLearningSuggestion() != null
                ? doc.genericLearningSuggestion()
                : "Build a small project that uses {skill} and describe the outcome on your CV.";
    }

    private void registerAlias(String alias, Skill skill) {
        if (alias.isEmpty()) return;
        Skill previous = byAlias.putIfAbsent(alias, skill);
        if (previous != null && !previous.equals(skill)) {
            throw new IllegalArgumentException("Alias '" + alias + "' maps to both "
                    + previous.name() + " and " + skill.name());
        }
        maxAliasTokens = Math.max(maxAliasTokens, alias.split(" ").length);
    }

    private static List<List<String>> tokenized(List<String> terms) {
        List<List<String>> out = new ArrayList<>();
        for (String t : nullSafe(terms)) {
            List<String> words = TextNormalizer.words(t);
            if (!words.isEmpty()) out.add(words);
        }
        return out;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    // ------------------------------------------------------------------ lookups

    /** Looks up an already-normalized phrase, retrying with its last word singularized. */
    public Optional<Skill> lookup(String normalizedPhrase) {
        Skill hit = byAlias.get(normalizedPhrase);
        if (hit == null) {
            int cut = normalizedPhrase.lastIndexOf(' ') + 1;
            String last = normalizedPhrase.substring(cut);
            String singular = TextNormalizer.singular(last);
            if (!singular.equals(last)) {
                hit = byAlias.get(normalizedPhrase.substring(0, cut) + singular);
            }
        }
        return Optional.ofNullable(hit);
    }

    public Optional<Skill> lookupCaseSensitive(String rawToken) {
        return Optional.ofNullable(byCaseSensitiveAlias.get(rawToken));
    }

    /**
     * Maps a free-form term onto a dictionary skill, or onto an {@link SkillCategory#UNCATEGORIZED}
     * skill keyed by its normalized form when the dictionary does not know it. Returns empty for
     * terms with no word characters.
     */
    public Optional<Skill> resolve(String term) {
        if (term == null) return Optional.empty();
        String trimmed = term.trim();
        String normalized = TextNormalizer.normalize(trimmed);
        if (normalized.isEmpty()) return Optional.empty();
        Optional<Skill> known = lookupCaseSensitive(trimmed).or(() -> lookup(normalized));
        Skill skill = known.orElseGet(() ->
                new Skill(normalized, trimmed, SkillCategory.UNCATEGORIZED, Set.of()));
        return Optional.of(skill.withSurfaceForms(Set.of(trimmed)));
    }

    public boolean isSkillPhrase(String normalizedPhrase) {
        return lookup(normalizedPhrase).isPresent();
    }

    public boolean isStopWord(String normalizedWord) {
        return stopWords.contains(normalizedWord);
    }

    /** True for the action verbs of the synonym table, in any listed form. */
    public boolean isActionVerb(String normalizedWord) {
        return actionVerbs.contains(normalizedWord);
    }

    /** Collapses action-verb variants ("led", "managed") onto one canonical token. */
    public String canonicalToken(String normalizedWord) {
        return tokenSynonyms.getOrDefault(normalizedWord, normalizedWord);
    }

    public String learningSuggestion(Skill skill) {
        String template = learningSuggestions.getOrDefault(skill.category(), genericLearningSuggestion);
        return template.replace(SKILL_PLACEHOLDER, skill.name());
    }

    public Map<ExperienceLevel, List<List<String>>> seniorityPhrases() {
        return Collections.unmodifiableMap(seniorityPhrases);
    }

    /** Display form of each culture signal mapped to its tokenized form. */
    public Map<String, List<String>> cultureSignals() {
        return Collections.unmodifiableMap(cultureSignals);
    }

    public Map<IndustryCategory, List<List<String>>> industryTriggers() {
        return Collections.unmodifiableMap(industryTriggers);
    }

    public int maxAliasTokens() {
        return maxAliasTokens;
    }

    public List<Skill> skills() {
        return Collections.unmodifiableList(skills);
    }

    public String version() {
        return version;
    }
}
