package com.hospitality.staysync.exception;

/**
 * Thrown when a vendor record is missing a required field or carries a value
 * we cannot map. Skippable at the item level.
 */
public class InvalidVendorDataException extends StaySyncException {

    public InvalidVendorDataException(String message) {
        super(message);
    }

    public InvalidVendorDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
