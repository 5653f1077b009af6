package com.phillippitts.wfmparity.exception;

/**
 * Base exception for all wfm-parity application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ParityException extends RuntimeException {

    public ParityException(String message) {
        super(message);
    }

    public ParityException(String message, Throwable cause) {
        super(message, cause);
    }
}
