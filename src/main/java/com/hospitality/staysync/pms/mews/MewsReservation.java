package com.hospitality.staysync.pms.mews;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A reservation as returned by the Mews reservation endpoints.
 * Dates are ISO-8601 strings; they are validated when mapped onto a stay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MewsReservation {

    @JsonProperty("ReservationId")
    private String reservationId;

    @JsonProperty("HotelId")
    private String hotelId;

    @JsonProperty("GuestId")
    private String guestId;

    @JsonProperty("Status")
    private String status;

    @JsonProperty("CheckInDate")
    private String checkInDate;

    @JsonProperty("CheckOutDate")
    private String checkOutDate;

    /**
     * Null when Mews does not know.
     */
    @JsonProperty("BreakfastIncluded")
    private Boolean breakfastIncluded;
}
