package com.hospitality.staysync.pms.mews;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of a Mews webhook delivery: one or more events about reservations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MewsWebhookPayload {

    @JsonProperty("HotelId")
    private String hotelId;

    @JsonProperty("IntegrationId")
    private String integrationId;

    @JsonProperty("Events")
    private List<Event> events;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Event {

        /**
         * e.g. "ReservationUpdated"
         */
        @JsonProperty("Name")
        private String name;

        @JsonProperty("Value")
        private EventValue value;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventValue {

        @JsonProperty("ReservationId")
        private String reservationId;
    }
}
