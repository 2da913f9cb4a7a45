package com.pipeline.adg.error;

/**
 * Base of every error raised by the asset graph.
 */
public class AssetGraphException extends RuntimeException {

    public AssetGraphException(String message) {
        super(message);
    }

    public AssetGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
