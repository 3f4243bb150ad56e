package com.hospitality.staysync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A guest as described by a PMS, already mapped out of the vendor's own field names.
 * Every adapter produces these for the reconciliation engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VendorGuest {

    /**
     * The vendor's id for this guest.
     */
    private String pmsGuestId;

    private String name;

    /**
     * May be empty or "Not available"; such guests are not stored.
     */
    private String phone;

    /**
     * ISO 3166 alpha-2 country code, any case.
     */
    private String country;
}
