package com.example.cvmatch.text;

import com.example.cvmatch.model.ExperienceLevel;
import com.example.cvmatch.model.IndustryCategory;
import com.example.cvmatch.model.SkillCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/** On-disk shape of the skill dictionary, as read by Jackson. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DictionaryDocument(
        String version,
        List<SkillEntry> skills,
        List<String> stopWords,
        Map<String, String> tokenSynonyms,
        Map<ExperienceLevel, List<String>> seniorityTerms,
        List<String> cultureSignals,
        Map<IndustryCategory, List<String>> industryCategories,
        Map<SkillCategory, String> learningSuggestions,
        String genericLearningSuggestion
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SkillEntry(
            String name,
            SkillCategory category,
            List<String> aliases,
            List<String> caseSensitiveAliases
    ) {}
}
