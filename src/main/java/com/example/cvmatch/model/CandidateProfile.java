package com.example.cvmatch.model;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public record CandidateProfile(
        List<Skill> skills,
        ExperienceLevel experienceLevel,
        Integer estimatedYears,
        List<String> experienceBullets,
        Set<String> textTerms,
        boolean inferenceDegraded
) {
    public CandidateProfile {
        skills            = skills == null ? null : List.copyOf(skills);
        experienceBullets = experienceBullets == null ? null : List.copyOf(experienceBullets);
        textTerms         = textTerms == null ? null
                : Collections.unmodifiableSortedSet(new TreeSet<>(textTerms));
    }
}
