package com.example.cvmatch.error;

public class InferenceCollaboratorException extends MatchingEngineException {

    public InferenceCollaboratorException(String input, String message) {
        super(Stage.INFERENCE, input, message);
    }

    public InferenceCollaboratorException(String input, String message, Throwable cause) {
        super(Stage.INFERENCE, input, message, cause);
    }
}
