package com.example.cvmatch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CV rewrite guidance derived from a {@link CompatibilityReport}. {@code sectionAdvice} only
 * contains sections that have something to add.
 */
public record OptimizationAdvice(
        List<SkillRecommendation> skillRecommendations,
        List<String> keywordRecommendations,
        Map<String, List<String>> sectionAdvice,
        List<String> tailoringSuggestions,
        List<String> interviewFocusAreas,
        List<String> atsTips
) {
    public OptimizationAdvice {
        skillRecommendations   = List.copyOf(skillRecommendations);
        keywordRecommendations = List.copyOf(keywordRecommendations);
        Map<String, List<String>> sections = new LinkedHashMap<>();
        sectionAdvice.forEach((k, v) -> sections.put(k, List.copyOf(v)));
        sectionAdvice          = Collections.unmodifiableMap(sections);
        tailoringSuggestions   = List.copyOf(tailoringSuggestions);
        interviewFocusAreas    = List.copyOf(interviewFocusAreas);
        atsTips                = List.copyOf(atsTips);
    }
}
