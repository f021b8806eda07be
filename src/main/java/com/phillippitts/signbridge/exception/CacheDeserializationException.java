package com.phillippitts.signbridge.exception;

/**
 * Thrown when a persisted cache blob is corrupt or has an unexpected shape.
 */
public class CacheDeserializationException extends PersistenceException {

    public CacheDeserializationException(String namespace, String message) {
        super(namespace, message);
    }

    public CacheDeserializationException(String namespace, String message, Throwable cause) {
        super(namespace, message, cause);
    }
}
