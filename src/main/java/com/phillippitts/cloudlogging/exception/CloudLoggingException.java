package com.phillippitts.cloudlogging.exception;

/**
 * Base exception for all cloud-logging-handler errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CloudLoggingException extends RuntimeException {

    public CloudLoggingException(String message) {
        super(message);
    }

    public CloudLoggingException(String message, Throwable cause) {
        super(message, cause);
    }

    public CloudLoggingException(Throwable cause) {
        super(cause);
    }
}
