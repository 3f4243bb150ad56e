package com.hospitality.staysync.controller;

import com.hospitality.staysync.dto.SyncResult;
import com.hospitality.staysync.service.PmsSyncService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * REST API for PMS synchronization.
 * <p>
 * Provides endpoints for:
 * - Receiving PMS webhooks
 * - Triggering the daily pull manually
 * - Live breakfast lookups for a stay
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "PMS Sync", description = "Stay and guest synchronization with Property Management Systems")
public class PmsSyncController {

    private final PmsSyncService syncService;

    @Operation(
            summary = "Receive a PMS webhook",
            description = "Cleans the raw webhook body with the vendor's adapter and reconciles every event in it. Events for unknown hotels or with invalid data are skipped."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Webhook handled",
                    content = @Content(schema = @Schema(implementation = SyncResult.class))),
            @ApiResponse(responseCode = "404", description = "No adapter for this PMS"),
            @ApiResponse(responseCode = "422", description = "Webhook body is empty or malformed"),
            @ApiResponse(responseCode = "502", description = "Batch aborted, e.g. PMS API unavailable")
    })
    @PostMapping(value = "/pms/{pmsName}/webhook", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<SyncResult> receiveWebhook(
            @Parameter(description = "PMS name, e.g. mews") @PathVariable String pmsName,
            @RequestBody(required = false) String payload) {

        SyncResult result = syncService.processWebhook(pmsName, payload);
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @Operation(
            summary = "Pull tomorrow's stays",
            description = "Runs the daily pull for one PMS now. Useful after an outage or before the midnight run."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Pull completed",
                    content = @Content(schema = @Schema(implementation = SyncResult.class))),
            @ApiResponse(responseCode = "404", description = "No adapter for this PMS"),
            @ApiResponse(responseCode = "502", description = "Pull aborted")
    })
    @PostMapping("/pms/{pmsName}/pull")
    public ResponseEntity<SyncResult> pullTomorrowsStays(
            @Parameter(description = "PMS name, e.g. mews") @PathVariable String pmsName) {
        log.info("Manual pull of tomorrow's stays triggered via API for {}", pmsName);
        SyncResult result = syncService.pullTomorrowsStays(pmsName);
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @Operation(
            summary = "Does the stay include breakfast",
            description = "Asks the PMS live; the answer is never stored. breakfastIncluded is null when the PMS cannot tell."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Lookup done"),
            @ApiResponse(responseCode = "404", description = "Stay not found")
    })
    @GetMapping("/stays/{stayId}/breakfast")
    public ResponseEntity<Map<String, Object>> stayHasBreakfast(
            @Parameter(description = "Stay ID") @PathVariable Long stayId) {

        // Map.of rejects null values
        Map<String, Object> body = new HashMap<>();
        body.put("stayId", stayId);
        body.put("breakfastIncluded", syncService.stayHasBreakfast(stayId).orElse(null));
        return ResponseEntity.ok(body);
    }

    private static HttpStatus statusFor(SyncResult result) {
        if (result.isSuccessful()) {
            return HttpStatus.OK;
        }
        return result.isRejected() ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.BAD_GATEWAY;
    }
}
