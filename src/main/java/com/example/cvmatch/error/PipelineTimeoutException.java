package com.example.cvmatch.error;

import java.time.Duration;

public class PipelineTimeoutException extends MatchingEngineException {

    public PipelineTimeoutException(String input, Duration timeout) {
        super(Stage.PIPELINE, input, "Analysis did not complete within " + timeout.toMillis() + " ms");
    }
}
