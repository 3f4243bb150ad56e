package com.hospitality.staysync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A guest, deduplicated on phone number.
 * <p>
 * The phone is the only key PMS vendors give us that holds across reservations,
 * so a guest without one is never stored.
 */
@Entity
@Table(name = "guests", indexes = {
        @Index(name = "idx_guest_phone", columnList = "phone", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Guest {

    public static final int NAME_MAX_LENGTH = 200;
    public static final int PHONE_MAX_LENGTH = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(nullable = false, unique = true, length = PHONE_MAX_LENGTH)
    private String phone;

    @Column(length = 50)
    private String language;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
