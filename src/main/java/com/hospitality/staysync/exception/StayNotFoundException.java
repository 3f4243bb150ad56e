package com.hospitality.staysync.exception;

public class StayNotFoundException extends StaySyncException {

    public StayNotFoundException(Long stayId) {
        super("Stay not found: " + stayId);
    }
}
