package com.example.cvmatch.model;

import java.util.List;

/**
 * Requirements extracted from one job posting. Collections keep first-occurrence order and
 * hold no duplicates; {@code requiredSkills} and {@code preferredSkills} never overlap.
 * {@code educationRequirement} is the posting's degree line, or null when it names none.
 */
public record JobRequirementProfile(
        String jobTitle,
        String company,
        List<Skill> requiredSkills,
        List<Skill> preferredSkills,
        ExperienceLevel experienceLevel,
        String educationRequirement,
        List<String> responsibilities,
        List<String> industryKeywords,
        List<String> cultureSignals,
        IndustryCategory industryCategory,
        boolean inferenceDegraded
) {
    public JobRequirementProfile {
        requiredSkills   = copy(requiredSkills);
        preferredSkills  = copy(preferredSkills);
        responsibilities = copy(responsibilities);
        industryKeywords = copy(industryKeywords);
        cultureSignals   = copy(cultureSignals);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? null : List.copyOf(list);
    }
}
