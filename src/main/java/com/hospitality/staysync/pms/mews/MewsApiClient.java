package com.hospitality.staysync.pms.mews;

import com.hospitality.staysync.exception.PmsApiException;

/**
 * Interface for the Mews API.
 * <p>
 * Every call returns the raw JSON body; parsing is up to the adapter. Any call
 * may fail with {@link PmsApiException} when Mews is unavailable or rate limits us.
 */
public interface MewsApiClient {

    /**
     * @param checkinDate ISO date, e.g. "2026-10-19"
     * @return JSON array of reservations
     */
    String getReservationsForCheckinDate(String checkinDate) throws PmsApiException;

    /**
     * @return JSON object of one reservation, including breakfast inclusion
     */
    String getReservationDetails(String reservationId) throws PmsApiException;

    /**
     * @return JSON object of one guest
     */
    String getGuestDetails(String guestId) throws PmsApiException;
}
