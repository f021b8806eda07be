package com.phillippitts.signbridge.exception;

/**
 * Thrown when the durable key-value store cannot be read or written.
 *
 * <p>Content caches treat this as non-fatal and continue in memory-only mode.
 */
public class PersistenceException extends SignBridgeException {

    private final String namespace;

    public PersistenceException(String namespace, String message) {
        super(message + " (namespace: " + namespace + ")");
        this.namespace = namespace;
    }

    public PersistenceException(String namespace, String message, Throwable cause) {
        super(message + " (namespace: " + namespace + ")", cause);
        this.namespace = namespace;
    }

    public String getNamespace() {
        return namespace;
    }
}
