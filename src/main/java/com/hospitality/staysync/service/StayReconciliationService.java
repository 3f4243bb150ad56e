package com.hospitality.staysync.service;

import com.hospitality.staysync.dto.VendorGuest;
import com.hospitality.staysync.dto.VendorStay;
import com.hospitality.staysync.entity.Guest;
import com.hospitality.staysync.entity.Hotel;
import com.hospitality.staysync.entity.Stay;
import com.hospitality.staysync.exception.IncorrectHotelIdException;
import com.hospitality.staysync.exception.InvalidVendorDataException;
import com.hospitality.staysync.repository.GuestRepository;
import com.hospitality.staysync.repository.HotelRepository;
import com.hospitality.staysync.repository.StayRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps vendor guests and stays onto our own Guest and Stay records.
 * <p>
 * Vendor-agnostic: every PMS adapter hands over {@link VendorGuest} and
 * {@link VendorStay} and calls guest first, then stay.
 * <p>
 * Key Design Decisions:
 * 1. Natural keys: guests are matched on phone, stays on the vendor reservation id
 * 2. Idempotency: a repeated upsert rewrites the same record and only moves updated_at
 * 3. Time: every timestamp is read from the injected clock at call time
 */
@Service
@Slf4j
public class StayReconciliationService {

    /**
     * What vendors send in place of a phone number they do not have.
     */
    public static final String PHONE_NOT_AVAILABLE = "Not available";

    private final GuestRepository guestRepository;
    private final StayRepository stayRepository;
    private final HotelRepository hotelRepository;
    private final LanguageResolver languageResolver;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private Counter guestsUpsertedCounter;
    private Counter guestsWithoutPhoneCounter;
    private Counter staysUpsertedCounter;

    public StayReconciliationService(GuestRepository guestRepository,
                                     StayRepository stayRepository,
                                     HotelRepository hotelRepository,
                                     LanguageResolver languageResolver,
                                     Clock clock,
                                     MeterRegistry meterRegistry) {
        this.guestRepository = guestRepository;
        this.stayRepository = stayRepository;
        this.hotelRepository = hotelRepository;
        this.languageResolver = languageResolver;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        guestsUpsertedCounter = Counter.builder("staysync.guests.upserted")
                .description("Guests created or updated from PMS data")
                .register(meterRegistry);

        guestsWithoutPhoneCounter = Counter.builder("staysync.guests.without_phone")
                .description("Vendor guests not stored because they have no usable phone")
                .register(meterRegistry);

        staysUpsertedCounter = Counter.builder("staysync.stays.upserted")
                .description("Stays created or updated from PMS data")
                .register(meterRegistry);
    }

    /**
     * Creates or updates the guest matching the vendor guest's phone number.
     *
     * @return the internal guest id, or empty when the vendor guest has no usable phone
     * @throws InvalidVendorDataException if the name or phone does not fit its column
     */
    @Transactional
    public Optional<Long> upsertGuest(VendorGuest vendorGuest) {
        String language = languageResolver.resolve(vendorGuest.getCountry());
        String phone = vendorGuest.getPhone();

        if (!hasUsablePhone(phone)) {
            log.debug("Vendor guest {} has no usable phone, not storing it", vendorGuest.getPmsGuestId());
            guestsWithoutPhoneCounter.increment();
            return Optional.empty();
        }

        String name = nameOrPlaceholder(vendorGuest.getName());
        requireFits(phone, Guest.PHONE_MAX_LENGTH, "phone", vendorGuest.getPmsGuestId());
        requireFits(name, Guest.NAME_MAX_LENGTH, "name", vendorGuest.getPmsGuestId());

        LocalDateTime now = LocalDateTime.now(clock);
        Guest guest = guestRepository.findByPhone(phone)
                .orElseGet(() -> Guest.builder()
                        .createdAt(now)
                        .build());

        boolean isNew = guest.getId() == null;
        guest.setName(name);
        guest.setPhone(phone);
        guest.setLanguage(language);
        guest.setUpdatedAt(now);

        Guest saved = guestRepository.save(guest);
        guestsUpsertedCounter.increment();

        log.debug("{} guest {} for vendor guest {}",
                isNew ? "Created" : "Updated", saved.getId(), vendorGuest.getPmsGuestId());

        return Optional.ofNullable(saved.getId());
    }

    /**
     * Creates or updates the stay for the vendor reservation id. An existing stay
     * has every mutable field overwritten.
     *
     * @param guestId internal guest id from {@link #upsertGuest}, may be null
     * @throws IncorrectHotelIdException   if the vendor hotel id is unknown; nothing is written
     * @throws InvalidVendorDataException if an id is missing or too long, or the dates are inconsistent
     */
    @Transactional
    public void upsertStay(VendorStay vendorStay, Long guestId) {
        validate(vendorStay);

        Hotel hotel = hotelRepository.findByPmsHotelId(vendorStay.getPmsHotelId())
                .orElseThrow(() -> new IncorrectHotelIdException(vendorStay.getPmsHotelId()));

        LocalDateTime now = LocalDateTime.now(clock);
        Stay stay = stayRepository.findByPmsReservationId(vendorStay.getPmsReservationId())
                .orElseGet(() -> Stay.builder()
                        .createdAt(now)
                        .build());

        boolean isNew = stay.getId() == null;
        stay.setHotel(hotel);
        stay.setPmsReservationId(vendorStay.getPmsReservationId());
        stay.setPmsGuestId(vendorStay.getPmsGuestId());
        stay.setGuest(guestId == null ? null : guestRepository.getReferenceById(guestId));
        stay.setStatus(vendorStay.getStatus());
        stay.setCheckin(vendorStay.getCheckin());
        stay.setCheckout(vendorStay.getCheckout());
        stay.setUpdatedAt(now);

        stayRepository.save(stay);
        staysUpsertedCounter.increment();

        log.debug("{} stay for reservation {} at hotel {} (status {}, guest {})",
                isNew ? "Created" : "Updated",
                vendorStay.getPmsReservationId(),
                hotel.getId(),
                vendorStay.getStatus(),
                guestId);
    }

    private void validate(VendorStay vendorStay) {
        if (vendorStay.getPmsReservationId() == null || vendorStay.getPmsReservationId().isBlank()) {
            throw new InvalidVendorDataException("Stay has no reservation id");
        }
        requireFits(vendorStay.getPmsReservationId(), Stay.VENDOR_ID_MAX_LENGTH,
                "reservation id", vendorStay.getPmsReservationId());
        requireFits(vendorStay.getPmsGuestId(), Stay.VENDOR_ID_MAX_LENGTH,
                "guest id", vendorStay.getPmsReservationId());
        if (vendorStay.getStatus() == null) {
            throw new InvalidVendorDataException(
                    "Stay " + vendorStay.getPmsReservationId() + " has no status");
        }
        if (vendorStay.getCheckin() != null && vendorStay.getCheckout() != null
                && vendorStay.getCheckout().isBefore(vendorStay.getCheckin())) {
            throw new InvalidVendorDataException(String.format(
                    "Stay %s checks out (%s) before it checks in (%s)",
                    vendorStay.getPmsReservationId(), vendorStay.getCheckout(), vendorStay.getCheckin()));
        }
    }

    private static void requireFits(String value, int maxLength, String field, String reference) {
        if (value != null && value.length() > maxLength) {
            throw new InvalidVendorDataException(String.format(
                    "%s has a %s of %d characters, at most %d are stored",
                    reference, field, value.length(), maxLength));
        }
    }

    private static boolean hasUsablePhone(String phone) {
        return phone != null && !phone.isBlank() && !PHONE_NOT_AVAILABLE.equalsIgnoreCase(phone.trim());
    }

    private static String nameOrPlaceholder(String name) {
        return name == null || name.isBlank() ? UUID.randomUUID().toString() : name;
    }
}
