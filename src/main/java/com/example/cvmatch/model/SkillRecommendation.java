package com.example.cvmatch.model;

public record SkillRecommendation(
        Skill skill,
        Priority priority,
        String rationale,
        String learningSuggestion
) {}
