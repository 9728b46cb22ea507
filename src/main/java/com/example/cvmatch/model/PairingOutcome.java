package com.example.cvmatch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/** Result of one pair in a batch: exactly one of {@code analysis} and {@code failure} is set. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PairingOutcome(
        String pairId,
        MatchAnalysis analysis,
        Failure failure
) {
    public record Failure(String stage, String errorType, String message) {}

    public static PairingOutcome success(String pairId, MatchAnalysis analysis) {
        return new PairingOutcome(pairId, analysis, null);
    }

    public static PairingOutcome failed(String pairId, String stage, String errorType, String message) {
        return new PairingOutcome(pairId, null, new Failure(stage, errorType, message));
    }

    @JsonIgnore
    public boolean isSuccess() {
        return failure == null;
    }
}
