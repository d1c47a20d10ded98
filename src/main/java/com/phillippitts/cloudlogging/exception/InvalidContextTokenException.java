package com.phillippitts.cloudlogging.exception;

/**
 * Thrown when a request context token is used on a thread other than the one that created it.
 */
public class InvalidContextTokenException extends CloudLoggingException {

    private final long ownerThreadId;

    public InvalidContextTokenException(long ownerThreadId, long callerThreadId) {
        super("Context token created on thread " + ownerThreadId
                + " cannot be reset from thread " + callerThreadId);
        this.ownerThreadId = ownerThreadId;
    }

    public long getOwnerThreadId() {
        return ownerThreadId;
    }
}
