package com.example.cvmatch.inference;

/** Which kind of document a term proposal is requested for. */
public enum InferenceKind {
    JOB_POSTING,
    CANDIDATE_DOCUMENT
}
