package com.hospitality.staysync.exception;

/**
 * No adapter is registered for the requested vendor name.
 */
public class UnknownPmsException extends StaySyncException {

    public UnknownPmsException(String pmsName) {
        super("No PMS adapter registered for: " + pmsName);
    }
}
