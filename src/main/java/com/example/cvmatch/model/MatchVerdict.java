package com.example.cvmatch.model;

public enum MatchVerdict {
    STRONG_MATCH,
    PARTIAL_MATCH,
    WEAK_MATCH;

    public static MatchVerdict forScore(int overallScore) {
        return overallScore >= 70 ? STRONG_MATCH
             : overallScore >= 50 ? PARTIAL_MATCH
             : WEAK_MATCH;
    }
}
