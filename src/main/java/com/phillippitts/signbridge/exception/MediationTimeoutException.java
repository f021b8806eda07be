package com.phillippitts.signbridge.exception;

/**
 * Thrown when the mediation operation does not complete within the configured timeout.
 */
public class MediationTimeoutException extends MediationException {

    private final long timeoutMs;

    public MediationTimeoutException(long timeoutMs) {
        super("Mediation timed out after " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }

    public MediationTimeoutException(long timeoutMs, Throwable cause) {
        super("Mediation timed out after " + timeoutMs + " ms", cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
