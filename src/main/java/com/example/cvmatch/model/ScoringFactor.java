package com.example.cvmatch.model;

public enum ScoringFactor {
    SKILL_MATCH("skill_match"),
    EXPERIENCE_ALIGNMENT("experience_alignment"),
    KEYWORD_COVERAGE("keyword_coverage"),
    RESPONSIBILITY_ALIGNMENT("responsibility_alignment");

    private final String key;

    ScoringFactor(String key) {
        this.key = key;
    }

    /** Key used in serialized factor maps. */
    public String key() {
        return key;
    }
}
