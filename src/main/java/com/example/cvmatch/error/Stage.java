package com.example.cvmatch.error;

/** Pipeline stage an engine error originated in. */
public enum Stage {
    REQUIREMENT_EXTRACTION,
    CANDIDATE_PROFILING,
    INFERENCE,
    SCORING,
    PIPELINE
}
