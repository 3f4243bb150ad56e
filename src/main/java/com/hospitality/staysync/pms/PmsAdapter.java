package com.hospitality.staysync.pms;

import com.fasterxml.jackson.databind.JsonNode;
import com.hospitality.staysync.dto.SyncResult;
import com.hospitality.staysync.entity.Stay;
import com.hospitality.staysync.exception.MalformedPayloadException;
import org.springframework.util.ClassUtils;

import java.util.Optional;

/**
 * Contract every Property Management System integration implements.
 * <p>
 * Implementations, one per vendor:
 * - MewsPmsAdapter
 * <p>
 * Adapters own their vendor's payload shapes and field names. Everything else
 * (retrying calls, upserting guests and stays) is shared.
 */
public interface PmsAdapter {

    String CLASS_NAME_SUFFIX = "PmsAdapter";

    /**
     * Short vendor name, derived from the implementing class: {@code MewsPmsAdapter} is "Mews".
     * Used as the registry key and as the vendor name for retried calls.
     */
    default String getName() {
        String simpleName = ClassUtils.getUserClass(this).getSimpleName();
        if (simpleName.endsWith(CLASS_NAME_SUFFIX) && simpleName.length() > CLASS_NAME_SUFFIX.length()) {
            return simpleName.substring(0, simpleName.length() - CLASS_NAME_SUFFIX.length());
        }
        return simpleName;
    }

    /**
     * Parses a raw vendor body, from a webhook or from an API response.
     *
     * @throws MalformedPayloadException if the body is empty or not parsable
     */
    JsonNode cleanPayload(String raw) throws MalformedPayloadException;

    /**
     * Reconciles every event of a cleaned webhook payload. Events pointing at an
     * unknown hotel or carrying invalid data are skipped; any other error aborts
     * the batch.
     */
    SyncResult handleWebhook(JsonNode payload);

    /**
     * Pulls and reconciles all reservations checking in tomorrow.
     * Triggered daily at 00:00.
     */
    SyncResult pullTomorrowsStays();

    /**
     * Live lookup, never cached and never stored.
     *
     * @return whether breakfast is included, or empty if the vendor cannot tell us
     */
    Optional<Boolean> stayHasBreakfast(Stay stay);
}
