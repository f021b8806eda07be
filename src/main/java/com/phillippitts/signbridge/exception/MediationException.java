package com.phillippitts.signbridge.exception;

/**
 * Thrown when the external mediation operation fails or returns unusable output.
 *
 * <p>The pipeline controller never lets this escape to observers; it is recovered into a
 * fallback output and surfaced through the error channel.
 */
public class MediationException extends SignBridgeException {

    private final String backend;

    public MediationException(String message) {
        super(message);
        this.backend = "unknown";
    }

    public MediationException(String message, String backend) {
        super(message + " (backend: " + backend + ")");
        this.backend = backend;
    }

    public MediationException(String message, Throwable cause) {
        super(message, cause);
        this.backend = "unknown";
    }

    public MediationException(String message, String backend, Throwable cause) {
        super(message + " (backend: " + backend + ")", cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
