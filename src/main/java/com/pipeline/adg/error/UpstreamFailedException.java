package com.pipeline.adg.error;

/**
 * A step was not executed because a step it depends on failed.
 */
public class UpstreamFailedException extends AssetGraphException {
    private final String originStep;

    public UpstreamFailedException(String stepName, String originStep) {
        super("Step " + stepName + " not executed: upstream step " + originStep + " failed");
        this.originStep = originStep;
    }

    public String originStep() {
        return originStep;
    }
}
