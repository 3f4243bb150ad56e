package com.hospitality.staysync.pms.mews;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hospitality.staysync.config.ClockConfig;
import com.hospitality.staysync.config.RetryConfig;
import com.hospitality.staysync.dto.SyncResult;
import com.hospitality.staysync.dto.VendorGuest;
import com.hospitality.staysync.dto.VendorStay;
import com.hospitality.staysync.entity.Stay;
import com.hospitality.staysync.entity.StayStatus;
import com.hospitality.staysync.exception.IncorrectHotelIdException;
import com.hospitality.staysync.exception.MalformedPayloadException;
import com.hospitality.staysync.exception.PmsApiException;
import com.hospitality.staysync.pms.PmsAdapter;
import com.hospitality.staysync.pms.PmsAdapterRegistry;
import com.hospitality.staysync.pms.PmsApiCallExecutor;
import com.hospitality.staysync.service.StayReconciliationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MewsPmsAdapter, with the real retrying call executor in front
 * of a mocked Mews API.
 */
@ExtendWith(MockitoExtension.class)
class MewsPmsAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-18T22:30:00Z"), ZoneOffset.UTC);

    @Mock
    private MewsApiClient apiClient;

    @Mock
    private StayReconciliationService reconciliationService;

    @Mock
    private ObjectProvider<PmsAdapter> adapterProvider;

    private MewsPmsAdapter adapter;

    @BeforeEach
    void setUp() {
        PmsAdapterRegistry registry = new PmsAdapterRegistry(adapterProvider);
        PmsApiCallExecutor callExecutor = new PmsApiCallExecutor(
                registry,
                new RetryConfig().pmsApiRetryTemplate(10, 0),
                new SimpleMeterRegistry()
        );
        adapter = new MewsPmsAdapter(apiClient, callExecutor, reconciliationService, new ObjectMapper(), CLOCK);
        registry.register(adapter);
    }

    @Test
    @DisplayName("Should be registered under the name Mews")
    void shouldBeNamedMews() {
        assertThat(adapter.getName()).isEqualTo("Mews");
    }

    @Nested
    @DisplayName("Payload Cleaning Tests")
    class PayloadCleaningTests {

        @Test
        @DisplayName("Should parse a JSON body")
        void shouldParseJson() {
            assertThat(adapter.cleanPayload("{\"Events\":[]}").path("Events").isArray()).isTrue();
        }

        @Test
        @DisplayName("Should reject empty bodies")
        void shouldRejectEmptyBody() {
            assertThatThrownBy(() -> adapter.cleanPayload(""))
                    .isInstanceOf(MalformedPayloadException.class);
            assertThatThrownBy(() -> adapter.cleanPayload(null))
                    .isInstanceOf(MalformedPayloadException.class);
        }

        @Test
        @DisplayName("Should reject bodies that are not JSON")
        void shouldRejectUnparsableBody() {
            assertThatThrownBy(() -> adapter.cleanPayload("{\"Events\": ["))
                    .isInstanceOf(MalformedPayloadException.class);
        }

        @Test
        @DisplayName("Should reject a webhook without Events")
        void shouldRejectWebhookWithoutEvents() {
            assertThatThrownBy(() -> adapter.handleWebhook(adapter.cleanPayload("{\"HotelId\":\"MEWS-AMS-01\"}")))
                    .isInstanceOf(MalformedPayloadException.class);
        }
    }

    @Nested
    @DisplayName("Webhook Tests")
    class WebhookTests {

        @Test
        @DisplayName("Should reconcile guest then stay for each event")
        void shouldReconcileGuestThenStay() {
            // Given
            when(apiClient.getReservationDetails("R-1"))
                    .thenReturn(reservationJson("R-1", "MEWS-AMS-01", "G-1", "before"));
            when(apiClient.getGuestDetails("G-1"))
                    .thenReturn("{\"GuestId\":\"G-1\",\"Name\":\"Anna de Vries\",\"Phone\":\"+31612345678\",\"Country\":\"NL\"}");
            when(reconciliationService.upsertGuest(any())).thenReturn(Optional.of(11L));

            // When
            SyncResult result = adapter.handleWebhook(adapter.cleanPayload(webhookJson("R-1")));

            // Then
            assertThat(result.isSuccessful()).isTrue();
            assertThat(result.getReconciled()).isEqualTo(1);

            ArgumentCaptor<VendorGuest> guestCaptor = ArgumentCaptor.forClass(VendorGuest.class);
            ArgumentCaptor<VendorStay> stayCaptor = ArgumentCaptor.forClass(VendorStay.class);
            var inOrder = inOrder(reconciliationService);
            inOrder.verify(reconciliationService).upsertGuest(guestCaptor.capture());
            inOrder.verify(reconciliationService).upsertStay(stayCaptor.capture(), eq(11L));

            assertThat(guestCaptor.getValue().getPhone()).isEqualTo("+31612345678");
            assertThat(guestCaptor.getValue().getCountry()).isEqualTo("NL");

            VendorStay stay = stayCaptor.getValue();
            assertThat(stay.getPmsReservationId()).isEqualTo("R-1");
            assertThat(stay.getPmsHotelId()).isEqualTo("MEWS-AMS-01");
            assertThat(stay.getStatus()).isEqualTo(StayStatus.BEFORE);
            assertThat(stay.getCheckin()).isEqualTo(LocalDate.of(2026, 10, 19));
            assertThat(stay.getCheckout()).isEqualTo(LocalDate.of(2026, 10, 21));
        }

        @Test
        @DisplayName("Should skip an event for an unknown hotel and carry on")
        void shouldSkipUnknownHotel() {
            // Given
            when(apiClient.getReservationDetails("R-1"))
                    .thenReturn(reservationJson("R-1", "MEWS-AMS-01", "G-1", "before"));
            when(apiClient.getReservationDetails("R-2"))
                    .thenReturn(reservationJson("R-2", "MEWS-NOWHERE", "G-2", "before"));
            when(apiClient.getGuestDetails(anyString()))
                    .thenReturn("{\"Name\":\"Guest\",\"Phone\":\"+31600000000\",\"Country\":\"NL\"}");
            when(reconciliationService.upsertGuest(any())).thenReturn(Optional.of(11L));
            lenient().doThrow(new IncorrectHotelIdException("MEWS-NOWHERE"))
                    .when(reconciliationService)
                    .upsertStay(argThat(stay -> stay != null && "R-2".equals(stay.getPmsReservationId())), any());

            // When
            SyncResult result = adapter.handleWebhook(adapter.cleanPayload(webhookJson("R-2", "R-1")));

            // Then
            assertThat(result.isSuccessful()).isTrue();
            assertThat(result.getTotalItems()).isEqualTo(2);
            assertThat(result.getReconciled()).isEqualTo(1);
            assertThat(result.getSkipped()).isEqualTo(1);
            assertThat(result.getSkippedItems()).extracting(SyncResult.SkippedItem::getReference)
                    .containsExactly("R-2");
            verify(reconciliationService, times(2)).upsertStay(any(), any());
        }

        @Test
        @DisplayName("Should skip an event with an unknown status without storing anything for it")
        void shouldSkipInvalidStatus() {
            // Given
            when(apiClient.getReservationDetails("R-1"))
                    .thenReturn(reservationJson("R-1", "MEWS-AMS-01", "G-1", "teleported"));

            // When
            SyncResult result = adapter.handleWebhook(adapter.cleanPayload(webhookJson("R-1")));

            // Then
            assertThat(result.isSuccessful()).isTrue();
            assertThat(result.getSkipped()).isEqualTo(1);
            verifyNoInteractions(reconciliationService);
        }

        @Test
        @DisplayName("Should store a stay without guest when the reservation has no guest")
        void shouldStoreStayWithoutGuest() {
            // Given
            when(apiClient.getReservationDetails("R-1"))
                    .thenReturn(reservationJson("R-1", "MEWS-AMS-01", null, "instay"));

            // When
            SyncResult result = adapter.handleWebhook(adapter.cleanPayload(webhookJson("R-1")));

            // Then
            assertThat(result.isSuccessful()).isTrue();
            verify(apiClient, never()).getGuestDetails(any());
            verify(reconciliationService).upsertStay(any(VendorStay.class), isNull());
        }

        @Test
        @DisplayName("Should abort the batch on an unexpected error")
        void shouldAbortOnUnexpectedError() {
            // Given
            when(apiClient.getReservationDetails("R-1"))
                    .thenReturn(reservationJson("R-1", "MEWS-AMS-01", "G-1", "before"));
            when(apiClient.getGuestDetails("G-1"))
                    .thenReturn("{\"Name\":\"Guest\",\"Phone\":\"+31600000000\",\"Country\":\"NL\"}");
            when(reconciliationService.upsertGuest(any())).thenThrow(new IllegalStateException("database down"));

            // When
            SyncResult result = adapter.handleWebhook(adapter.cleanPayload(webhookJson("R-1", "R-2")));

            // Then
            assertThat(result.isSuccessful()).isFalse();
            assertThat(result.getFailureReason()).contains("database down");
            verify(apiClient, never()).getReservationDetails("R-2");
            verify(reconciliationService, never()).upsertStay(any(), any());
        }

        @Test
        @DisplayName("Should abort the batch when Mews stays unavailable")
        void shouldAbortWhenApiExhausted() {
            // Given
            when(apiClient.getReservationDetails("R-1"))
                    .thenThrow(new PmsApiException("unavailable", "Mews", "R-1"));

            // When
            SyncResult result = adapter.handleWebhook(adapter.cleanPayload(webhookJson("R-1", "R-2")));

            // Then
            assertThat(result.isSuccessful()).isFalse();
            verify(apiClient, times(10)).getReservationDetails("R-1");
            verify(apiClient, never()).getReservationDetails("R-2");
            verifyNoInteractions(reconciliationService);
        }
    }

    @Nested
    @DisplayName("Daily Pull Tests")
    class DailyPullTests {

        @Test
        @DisplayName("Should request reservations checking in on tomorrow's calendar date")
        void shouldPullTomorrowsReservations() {
            // Given
            when(apiClient.getReservationsForCheckinDate("2026-10-19"))
                    .thenReturn("[" + reservationJson("R-1", "MEWS-AMS-01", "G-1", "before") + ","
                            + reservationJson("R-2", "MEWS-AMS-01", "G-2", "before") + "]");
            when(apiClient.getGuestDetails(anyString()))
                    .thenReturn("{\"Name\":\"Guest\",\"Phone\":\"Not available\",\"Country\":\"NL\"}");
            when(reconciliationService.upsertGuest(any())).thenReturn(Optional.empty());

            // When
            SyncResult result = adapter.pullTomorrowsStays();

            // Then
            assertThat(result.isSuccessful()).isTrue();
            assertThat(result.getOperation()).isEqualTo(SyncResult.SyncOperation.DAILY_PULL);
            assertThat(result.getReconciled()).isEqualTo(2);
            verify(reconciliationService, times(2)).upsertStay(any(VendorStay.class), isNull());
        }

        @Test
        @DisplayName("Should count tomorrow from the scheduler zone at its midnight run")
        void shouldPullTomorrowInSchedulerZone() {
            // Given: 00:00 in Amsterdam is still 18 October in UTC
            ZoneId amsterdam = new ClockConfig().clock("Europe/Amsterdam").getZone();
            Clock midnightInAmsterdam = Clock.fixed(Instant.parse("2026-10-18T22:00:00Z"), amsterdam);
            PmsAdapterRegistry registry = new PmsAdapterRegistry(adapterProvider);
            MewsPmsAdapter zonedAdapter = new MewsPmsAdapter(apiClient,
                    new PmsApiCallExecutor(registry, new RetryConfig().pmsApiRetryTemplate(10, 0),
                            new SimpleMeterRegistry()),
                    reconciliationService, new ObjectMapper(), midnightInAmsterdam);
            registry.register(zonedAdapter);

            when(apiClient.getReservationsForCheckinDate("2026-10-20")).thenReturn("[]");

            // When
            SyncResult result = zonedAdapter.pullTomorrowsStays();

            // Then
            assertThat(result.isSuccessful()).isTrue();
            verify(apiClient).getReservationsForCheckinDate("2026-10-20");
        }

        @Test
        @DisplayName("Should skip an unreadable reservation in the list")
        void shouldSkipUnreadableReservation() {
            // Given
            when(apiClient.getReservationsForCheckinDate("2026-10-19"))
                    .thenReturn("[{\"ReservationId\":\"R-1\",\"BreakfastIncluded\":{\"nested\":true}},"
                            + reservationJson("R-2", "MEWS-AMS-01", null, "before") + "]");

            // When
            SyncResult result = adapter.pullTomorrowsStays();

            // Then
            assertThat(result.isSuccessful()).isTrue();
            assertThat(result.getSkipped()).isEqualTo(1);
            assertThat(result.getReconciled()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fail the pull when the reservation list cannot be fetched")
        void shouldFailWhenListUnavailable() {
            // Given
            when(apiClient.getReservationsForCheckinDate(anyString()))
                    .thenThrow(new PmsApiException("unavailable", "Mews"));

            // When
            SyncResult result = adapter.pullTomorrowsStays();

            // Then
            assertThat(result.isSuccessful()).isFalse();
            verify(apiClient, times(10)).getReservationsForCheckinDate("2026-10-19");
            verifyNoInteractions(reconciliationService);
        }
    }

    @Nested
    @DisplayName("Breakfast Tests")
    class BreakfastTests {

        private final Stay stay = Stay.builder().pmsReservationId("R-1").build();

        @Test
        @DisplayName("Should answer from the live reservation")
        void shouldReturnBreakfastFlag() {
            when(apiClient.getReservationDetails("R-1"))
                    .thenReturn("{\"ReservationId\":\"R-1\",\"BreakfastIncluded\":true}");

            assertThat(adapter.stayHasBreakfast(stay)).contains(true);
        }

        @Test
        @DisplayName("Should not guess when Mews leaves the flag out")
        void shouldReturnUnknownWithoutFlag() {
            when(apiClient.getReservationDetails("R-1")).thenReturn("{\"ReservationId\":\"R-1\"}");

            assertThat(adapter.stayHasBreakfast(stay)).isEmpty();
        }

        @Test
        @DisplayName("Should return unknown when Mews stays unavailable")
        void shouldReturnUnknownWhenApiUnavailable() {
            when(apiClient.getReservationDetails("R-1"))
                    .thenThrow(new PmsApiException("unavailable", "Mews", "R-1"));

            assertThat(adapter.stayHasBreakfast(stay)).isEmpty();
        }
    }

    // Helper methods

    private static String webhookJson(String... reservationIds) {
        StringBuilder events = new StringBuilder();
        for (String reservationId : reservationIds) {
            if (events.length() > 0) {
                events.append(',');
            }
            events.append("{\"Name\":\"ReservationUpdated\",\"Value\":{\"ReservationId\":\"")
                    .append(reservationId)
                    .append("\"}}");
        }
        return "{\"HotelId\":\"MEWS-AMS-01\",\"IntegrationId\":\"INT-1\",\"Events\":[" + events + "]}";
    }

    private static String reservationJson(String reservationId, String hotelId, String guestId, String status) {
        return "{\"ReservationId\":\"" + reservationId + "\","
                + "\"HotelId\":\"" + hotelId + "\","
                + (guestId == null ? "" : "\"GuestId\":\"" + guestId + "\",")
                + "\"Status\":\"" + status + "\","
                + "\"CheckInDate\":\"2026-10-19\","
                + "\"CheckOutDate\":\"2026-10-21\","
                + "\"BreakfastIncluded\":true}";
    }
}
