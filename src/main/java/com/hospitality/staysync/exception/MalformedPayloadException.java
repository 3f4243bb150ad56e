package com.hospitality.staysync.exception;

/**
 * Thrown when a vendor body is empty, is not JSON, or lacks the envelope
 * the adapter needs. The whole webhook invocation is rejected.
 */
public class MalformedPayloadException extends StaySyncException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
