package com.pipeline.adg.error;

/**
 * A reference (input binding, internal dependency, selection key) that does not
 * resolve to exactly one asset of the graph.
 */
public class UnknownDependencyException extends AssetGraphException {
    private final String reference;

    public UnknownDependencyException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public String reference() {
        return reference;
    }
}
