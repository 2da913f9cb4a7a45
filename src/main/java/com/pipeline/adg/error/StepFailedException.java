package com.pipeline.adg.error;

/**
 * A computation kept raising until its retry policy was exhausted.
 */
public class StepFailedException extends AssetGraphException {
    private final int attempts;

    public StepFailedException(String stepName, int attempts, Throwable cause) {
        super("Step " + stepName + " failed after " + attempts + " attempt(s): " + cause, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
