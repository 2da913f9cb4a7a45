package com.pipeline.adg.error;

/**
 * Two declarations claim the same asset key (or step name).
 */
public class DuplicateKeyException extends AssetGraphException {
    private final String key;
    private final String firstSite;
    private final String secondSite;

    public DuplicateKeyException(String key, String firstSite, String secondSite) {
        super("Duplicate key '" + key + "' declared by " + firstSite + " and " + secondSite);
        this.key = key;
        this.firstSite = firstSite;
        this.secondSite = secondSite;
    }

    public String key() {
        return key;
    }

    public String firstSite() {
        return firstSite;
    }

    public String secondSite() {
        return secondSite;
    }
}
