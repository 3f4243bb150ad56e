package com.hospitality.staysync.exception;

/**
 * Base exception for stay and guest synchronization errors.
 */
public class StaySyncException extends RuntimeException {

    public StaySyncException(String message) {
        super(message);
    }

    public StaySyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
