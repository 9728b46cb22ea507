package com.example.cvmatch.model;

import java.time.Instant;

public record MatchHistoryEntry(
        String id,
        Instant recordedAt,
        String jobTitle,
        int overallScore,
        MatchVerdict verdict,
        int missingRequiredCount,
        int missingPreferredCount
) {}
