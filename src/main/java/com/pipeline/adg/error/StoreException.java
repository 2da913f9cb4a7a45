package com.pipeline.adg.error;

/**
 * An I/O manager failed to persist a value.
 */
public class StoreException extends AssetGraphException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
