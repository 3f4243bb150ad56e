package com.hospitality.staysync.pms.mews;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hospitality.staysync.dto.SyncResult;
import com.hospitality.staysync.dto.SyncResult.SyncOperation;
import com.hospitality.staysync.dto.VendorGuest;
import com.hospitality.staysync.dto.VendorStay;
import com.hospitality.staysync.entity.Stay;
import com.hospitality.staysync.entity.StayStatus;
import com.hospitality.staysync.exception.InvalidVendorDataException;
import com.hospitality.staysync.exception.MalformedPayloadException;
import com.hospitality.staysync.exception.StaySyncException;
import com.hospitality.staysync.pms.AbstractPmsAdapter;
import com.hospitality.staysync.pms.PmsApiCallExecutor;
import com.hospitality.staysync.service.StayReconciliationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PMS adapter for Mews.
 * <p>
 * A Mews webhook only names the reservations that changed, so every event is
 * followed by a reservation lookup and a guest lookup before reconciling.
 */
@Component
@Slf4j
public class MewsPmsAdapter extends AbstractPmsAdapter {

    private final MewsApiClient apiClient;

    public MewsPmsAdapter(MewsApiClient apiClient,
                          PmsApiCallExecutor callExecutor,
                          StayReconciliationService reconciliationService,
                          ObjectMapper objectMapper,
                          Clock clock) {
        super(callExecutor, reconciliationService, objectMapper, clock);
        this.apiClient = apiClient;
    }

    @Override
    public SyncResult handleWebhook(JsonNode payload) {
        MewsWebhookPayload webhook = readWebhook(payload);
        SyncResult result = startResult(SyncOperation.WEBHOOK);

        return reconcileEach(result, webhook.getEvents(), MewsPmsAdapter::eventReference, event -> {
            String reservationId = reservationIdOf(event);
            MewsReservation reservation = readAs(
                    callExecutor.callWithRetry(getName(), apiClient::getReservationDetails, reservationId),
                    MewsReservation.class);
            reconcile(reservation);
        });
    }

    @Override
    public SyncResult pullTomorrowsStays() {
        SyncResult result = startResult(SyncOperation.DAILY_PULL);
        LocalDate tomorrow = LocalDate.now(clock).plusDays(1);

        List<JsonNode> reservations;
        try {
            JsonNode node = callExecutor.callWithRetry(
                    getName(), apiClient::getReservationsForCheckinDate, tomorrow.toString());
            reservations = readReservations(node);
        } catch (Exception e) {
            log.error("Could not fetch Mews reservations checking in on {}: {}", tomorrow, e.getMessage(), e);
            result.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
            return complete(result);
        }

        log.info("Mews returned {} reservations checking in on {}", reservations.size(), tomorrow);
        return reconcileEach(result, reservations,
                node -> node.path("ReservationId").asText(null),
                node -> reconcile(readAs(node, MewsReservation.class)));
    }

    @Override
    public Optional<Boolean> stayHasBreakfast(Stay stay) {
        try {
            MewsReservation reservation = readAs(
                    callExecutor.callWithRetry(getName(), apiClient::getReservationDetails, stay.getPmsReservationId()),
                    MewsReservation.class);
            return Optional.ofNullable(reservation.getBreakfastIncluded());
        } catch (StaySyncException e) {
            log.warn("Breakfast for Mews reservation {} unknown: {}", stay.getPmsReservationId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Guest first, so the stay can point at it.
     */
    private void reconcile(MewsReservation reservation) {
        VendorStay vendorStay = toVendorStay(reservation);

        Long guestId = null;
        if (reservation.getGuestId() != null && !reservation.getGuestId().isBlank()) {
            MewsGuest guest = readAs(
                    callExecutor.callWithRetry(getName(), apiClient::getGuestDetails, reservation.getGuestId()),
                    MewsGuest.class);
            guestId = reconciliationService.upsertGuest(toVendorGuest(guest, reservation.getGuestId()))
                    .orElse(null);
        }

        reconciliationService.upsertStay(vendorStay, guestId);
    }

    private MewsWebhookPayload readWebhook(JsonNode payload) {
        if (payload == null || !payload.isObject() || !payload.path("Events").isArray()) {
            throw new MalformedPayloadException("Mews webhook has no Events array");
        }
        try {
            return readAs(payload, MewsWebhookPayload.class);
        } catch (InvalidVendorDataException e) {
            throw new MalformedPayloadException("Mews webhook cannot be read: " + e.getMessage(), e);
        }
    }

    /**
     * Elements stay untyped here so one unreadable reservation is skipped, not fatal.
     */
    private List<JsonNode> readReservations(JsonNode node) {
        if (!node.isArray()) {
            throw new MalformedPayloadException("Mews reservation list is not an array");
        }
        List<JsonNode> reservations = new ArrayList<>();
        node.forEach(reservations::add);
        return reservations;
    }

    private static String eventReference(MewsWebhookPayload.Event event) {
        if (event == null || event.getValue() == null) {
            return null;
        }
        return event.getValue().getReservationId();
    }

    private static String reservationIdOf(MewsWebhookPayload.Event event) {
        String reservationId = eventReference(event);
        if (reservationId == null || reservationId.isBlank()) {
            throw new InvalidVendorDataException("Mews event has no ReservationId");
        }
        return reservationId;
    }

    static VendorStay toVendorStay(MewsReservation reservation) {
        if (reservation.getReservationId() == null || reservation.getReservationId().isBlank()) {
            throw new InvalidVendorDataException("Mews reservation has no ReservationId");
        }
        return VendorStay.builder()
                .pmsReservationId(reservation.getReservationId())
                .pmsHotelId(reservation.getHotelId())
                .pmsGuestId(reservation.getGuestId())
                .status(StayStatus.fromVendorCode(reservation.getStatus()))
                .checkin(parseDate(reservation.getCheckInDate(), "CheckInDate", reservation))
                .checkout(parseDate(reservation.getCheckOutDate(), "CheckOutDate", reservation))
                .build();
    }

    static VendorGuest toVendorGuest(MewsGuest guest, String requestedGuestId) {
        return VendorGuest.builder()
                .pmsGuestId(guest.getGuestId() != null ? guest.getGuestId() : requestedGuestId)
                .name(guest.getName())
                .phone(guest.getPhone())
                .country(guest.getCountry())
                .build();
    }

    private static LocalDate parseDate(String value, String field, MewsReservation reservation) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            // Mews may send a full timestamp; the date part is what we keep
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            throw new InvalidVendorDataException(String.format(
                    "Mews reservation %s has an invalid %s: %s", reservation.getReservationId(), field, value), e);
        }
    }
}
