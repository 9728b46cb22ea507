package com.example.cvmatch.error;

public class ScoringException extends MatchingEngineException {

    public ScoringException(String input, String message) {
        super(Stage.SCORING, input, message);
    }
}
