package com.example.cvmatch.error;

/** Input text is empty, too short or yields nothing to compare. Not retried. */
public class ExtractionException extends MatchingEngineException {

    public ExtractionException(Stage stage, String input, String message) {
        super(stage, input, message);
    }
}
