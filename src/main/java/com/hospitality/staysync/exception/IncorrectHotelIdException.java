package com.hospitality.staysync.exception;

/**
 * Thrown when a vendor stay points at a hotel we do not know.
 * Callers skip the affected event or reservation and carry on with the batch.
 */
public class IncorrectHotelIdException extends StaySyncException {

    private final String pmsHotelId;

    public IncorrectHotelIdException(String pmsHotelId) {
        super("Hotel ID not found: " + pmsHotelId);
        this.pmsHotelId = pmsHotelId;
    }

    public String getPmsHotelId() {
        return pmsHotelId;
    }
}
