package com.example.cvmatch.error;

/**
 * Base of all engine failures. Carries the stage and a short description of the input that
 * failed so callers can log it without inspecting the message.
 */
public class MatchingEngineException extends RuntimeException {

    private final Stage stage;
    private final String input;

    public MatchingEngineException(Stage stage, String input, String message) {
        super(message);
        this.stage = stage;
        this.input = input;
    }

    public MatchingEngineException(Stage stage, String input, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.input = input;
    }

    public Stage getStage() {
        return stage;
    }

    public String getInput() {
        return input;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + stage + ", " + input + "]: " + getMessage();
    }
}
