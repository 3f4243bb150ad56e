package com.hospitality.staysync.entity;

import com.hospitality.staysync.exception.InvalidVendorDataException;

import java.util.Arrays;

/**
 * Lifecycle status of a stay, as reported by the PMS.
 */
public enum StayStatus {
    /**
     * Reservation confirmed, guest has not arrived yet.
     */
    BEFORE("before"),

    /**
     * Guest is checked in.
     */
    INSTAY("instay"),

    /**
     * Guest has checked out.
     */
    AFTER("after"),

    CANCELLED("cancelled"),

    /**
     * The PMS itself does not know.
     */
    UNKNOWN("unknown");

    private final String vendorCode;

    StayStatus(String vendorCode) {
        this.vendorCode = vendorCode;
    }

    /**
     * Maps a vendor status code (case-insensitive) onto a status.
     *
     * @throws InvalidVendorDataException if the code is missing or unrecognized
     */
    public static StayStatus fromVendorCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidVendorDataException("Stay status is missing");
        }
        return Arrays.stream(values())
                .filter(status -> status.vendorCode.equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidVendorDataException("Unknown stay status: " + code));
    }
}
