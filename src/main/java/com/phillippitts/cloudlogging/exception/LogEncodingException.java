package com.phillippitts.cloudlogging.exception;

/**
 * Thrown when a log entry cannot be serialized to JSON.
 * Usually caused by a request attachment the configured encoder cannot handle.
 */
public class LogEncodingException extends CloudLoggingException {

    private final String encoderName;

    public LogEncodingException(String message) {
        super(message);
        this.encoderName = "unknown";
    }

    public LogEncodingException(String message, String encoderName, Throwable cause) {
        super(message + " (encoder: " + encoderName + ")", cause);
        this.encoderName = encoderName;
    }

    public String getEncoderName() {
        return encoderName;
    }
}
