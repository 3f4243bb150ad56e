package com.hospitality.staysync.pms.mews;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hospitality.staysync.exception.PmsApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Mock implementation of the Mews API.
 * <p>
 * Simulates realistic vendor behavior including:
 * - Reservation and guest lookups
 * - Intermittent unavailability (for exercising the retry path)
 * - Network latency simulation
 * <p>
 * Unknown reservation and guest ids answer with an empty JSON object.
 */
@Service
@Slf4j
public class MockMewsApiClient implements MewsApiClient {

    private static final String PMS_NAME = "Mews";

    private final Map<String, MewsReservation> reservations = new ConcurrentHashMap<>();
    private final Map<String, MewsGuest> guests = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Random random = new Random();

    @Value("${pms.mews.mock.failure-rate:0.1}")
    private double failureRate;

    @Value("${pms.mews.mock.latency-ms:0}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;

    // Deterministic failures, consumed before the random ones are considered
    private final AtomicInteger pendingFailures = new AtomicInteger();

    public MockMewsApiClient(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        initializeMockData(LocalDate.now(clock));
    }

    /**
     * Pre-populate some reservations arriving tomorrow, matching the seeded hotels.
     */
    private void initializeMockData(LocalDate today) {
        LocalDate tomorrow = today.plusDays(1);

        addGuest(MewsGuest.builder().guestId("G-1001").name("Anna de Vries")
                .phone("+31612345678").country("NL").build());
        addGuest(MewsGuest.builder().guestId("G-1002").name("Lukas Weber")
                .phone("+4915112345678").country("de").build());
        addGuest(MewsGuest.builder().guestId("G-1003").name("")
                .phone("Not available").country("FR").build());

        addReservation(MewsReservation.builder().reservationId("R-2001").hotelId("MEWS-AMS-01")
                .guestId("G-1001").status("before").checkInDate(tomorrow.toString())
                .checkOutDate(tomorrow.plusDays(2).toString()).breakfastIncluded(true).build());
        addReservation(MewsReservation.builder().reservationId("R-2002").hotelId("MEWS-BER-01")
                .guestId("G-1002").status("before").checkInDate(tomorrow.toString())
                .checkOutDate(tomorrow.plusDays(4).toString()).breakfastIncluded(false).build());
        addReservation(MewsReservation.builder().reservationId("R-2003").hotelId("MEWS-AMS-01")
                .guestId("G-1003").status("before").checkInDate(tomorrow.toString())
                .checkOutDate(tomorrow.plusDays(1).toString()).build());

        log.info("Mock Mews API initialized with {} reservations and {} guests",
                reservations.size(), guests.size());
    }

    @Override
    public String getReservationsForCheckinDate(String checkinDate) throws PmsApiException {
        log.debug("Fetching Mews reservations checking in on {}", checkinDate);
        simulateVendor(checkinDate);

        List<MewsReservation> arriving = reservations.values().stream()
                .filter(reservation -> checkinDate.equals(reservation.getCheckInDate()))
                .collect(Collectors.toList());
        return toJson(arriving);
    }

    @Override
    public String getReservationDetails(String reservationId) throws PmsApiException {
        log.debug("Fetching Mews reservation {}", reservationId);
        simulateVendor(reservationId);

        MewsReservation reservation = reservationId == null ? null : reservations.get(reservationId);
        if (reservation == null) {
            log.warn("Reservation not found in Mews: {}", reservationId);
            return "{}";
        }
        return toJson(reservation);
    }

    @Override
    public String getGuestDetails(String guestId) throws PmsApiException {
        log.debug("Fetching Mews guest {}", guestId);
        simulateVendor(guestId);

        MewsGuest guest = guestId == null ? null : guests.get(guestId);
        if (guest == null) {
            log.warn("Guest not found in Mews: {}", guestId);
            return "{}";
        }
        return toJson(guest);
    }

    private void simulateVendor(String reference) {
        simulateLatency();

        if (simulateOutage) {
            throw new PmsApiException("Mews API is currently unavailable", PMS_NAME, reference);
        }

        if (pendingFailures.getAndUpdate(remaining -> remaining > 0 ? remaining - 1 : 0) > 0) {
            throw new PmsApiException("Mews API rate limit exceeded", PMS_NAME, reference);
        }

        if (random.nextDouble() < failureRate) {
            throw new PmsApiException("Simulated network failure while contacting Mews", PMS_NAME, reference);
        }
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize mock Mews response", e);
        }
    }

    // Methods for testing/simulation control

    public void addReservation(MewsReservation reservation) {
        reservations.put(reservation.getReservationId(), reservation);
    }

    public void addGuest(MewsGuest guest) {
        guests.put(guest.getGuestId(), guest);
    }

    /**
     * Simulate a Mews outage: every call fails until switched off.
     */
    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Mews outage simulation set to: {}", outage);
    }

    /**
     * Make the next {@code count} calls fail, whatever they are.
     */
    public void failNextCalls(int count) {
        pendingFailures.set(count);
    }

    public void setFailureRate(double failureRate) {
        this.failureRate = failureRate;
    }

    public void clearMockData() {
        reservations.clear();
        guests.clear();
        pendingFailures.set(0);
    }
}
