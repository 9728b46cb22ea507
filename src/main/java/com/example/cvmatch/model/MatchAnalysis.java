package com.example.cvmatch.model;

public record MatchAnalysis(
        JobRequirementProfile jobProfile,
        CandidateProfile candidateProfile,
        CompatibilityReport report
) {}
