package com.hospitality.staysync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A hotel we serve, as known to its PMS.
 * <p>
 * Reference data only: the sync engine reads it to map a vendor hotel id onto
 * our own id and never writes it.
 */
@Entity
@Table(name = "hotels", indexes = {
        @Index(name = "idx_pms_hotel_id", columnList = "pms_hotel_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Hotel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    /**
     * Name of the PMS this hotel runs on, e.g. "mews".
     */
    @Column(name = "pms_name", nullable = false, length = 50)
    private String pmsName;

    @Column(name = "pms_hotel_id", nullable = false, unique = true, length = 100)
    private String pmsHotelId;
}
