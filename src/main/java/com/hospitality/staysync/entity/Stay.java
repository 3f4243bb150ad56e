package com.hospitality.staysync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One reservation at one of our hotels.
 * <p>
 * The pms_reservation_id is the vendor's reservation identifier and the
 * natural key for reconciliation: one stay per vendor reservation.
 */
@Entity
@Table(name = "stays", indexes = {
        @Index(name = "idx_pms_reservation_id", columnList = "pms_reservation_id", unique = true),
        @Index(name = "idx_stay_checkin", columnList = "checkin")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Stay {

    public static final int VENDOR_ID_MAX_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "hotel_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Hotel hotel;

    @Column(name = "pms_reservation_id", nullable = false, unique = true, length = VENDOR_ID_MAX_LENGTH)
    private String pmsReservationId;

    @Column(name = "pms_guest_id", length = VENDOR_ID_MAX_LENGTH)
    private String pmsGuestId;

    // Absent when the vendor guest had no usable phone
    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "guest_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Guest guest;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private StayStatus status;

    private LocalDate checkin;

    private LocalDate checkout;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
