package com.example.cvmatch.text;

public enum SectionKind {
    /** Text before the first recognized heading. */
    PREAMBLE,
    REQUIREMENTS,
    PREFERRED,
    RESPONSIBILITIES,
    EXPERIENCE,
    EDUCATION,
    SUMMARY,
    OTHER;

    /** Sections whose skills count as required in a job posting. */
    public boolean isRequirementLike() {
        return this == REQUIREMENTS || this == RESPONSIBILITIES || this == EXPERIENCE;
    }
}
