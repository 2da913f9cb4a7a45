package com.pipeline.adg.error;

import java.util.List;

/**
 * Run config for a step does not satisfy the step's config schema.
 */
public class ConfigValidationException extends AssetGraphException {
    private final List<String> problems;

    public ConfigValidationException(String stepName, List<String> problems) {
        super("Invalid config for step " + stepName + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
