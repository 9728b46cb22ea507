package com.example.cvmatch.model;

import java.util.List;

public record CandidateDocument(
        String text,
        List<String> preExtractedSkills
) {
    public CandidateDocument {
        preExtractedSkills = preExtractedSkills == null ? List.of() : List.copyOf(preExtractedSkills);
    }

    public static CandidateDocument of(String text) {
        return new CandidateDocument(text, List.of());
    }
}
