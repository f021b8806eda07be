package com.phillippitts.signbridge.exception;

/**
 * Base exception for all SignBridge application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SignBridgeException extends RuntimeException {

    public SignBridgeException(String message) {
        super(message);
    }

    public SignBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public SignBridgeException(Throwable cause) {
        super(cause);
    }
}
