package com.hospitality.staysync.dto;

import com.hospitality.staysync.entity.StayStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A reservation as described by a PMS, mapped onto our own vocabulary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VendorStay {

    private String pmsReservationId;

    /**
     * The vendor's id for the hotel; resolved against {@code hotels.pms_hotel_id}.
     */
    private String pmsHotelId;

    private String pmsGuestId;

    private StayStatus status;

    private LocalDate checkin;

    private LocalDate checkout;
}
