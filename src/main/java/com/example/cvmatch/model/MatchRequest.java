package com.example.cvmatch.model;

public record MatchRequest(
        String pairId,
        JobPosting job,
        CandidateDocument candidate
) {}
