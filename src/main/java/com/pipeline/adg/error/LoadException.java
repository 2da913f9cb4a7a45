package com.pipeline.adg.error;

/**
 * An I/O manager failed to load a value.
 */
public class LoadException extends AssetGraphException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
