package com.hospitality.staysync.pms;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hospitality.staysync.dto.SyncResult;
import com.hospitality.staysync.dto.SyncResult.SyncOperation;
import com.hospitality.staysync.exception.IncorrectHotelIdException;
import com.hospitality.staysync.exception.InvalidVendorDataException;
import com.hospitality.staysync.exception.MalformedPayloadException;
import com.hospitality.staysync.service.StayReconciliationService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Shared plumbing for JSON-speaking PMS adapters: payload cleaning, typed
 * parsing and the per-item error policy of a batch.
 * <p>
 * Error policy for a batch:
 * - IncorrectHotelIdException, InvalidVendorDataException: skip the item, continue
 * - anything else (including exhausted API retries): abort, report failure
 */
@Slf4j
public abstract class AbstractPmsAdapter implements PmsAdapter {

    protected final PmsApiCallExecutor callExecutor;
    protected final StayReconciliationService reconciliationService;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected AbstractPmsAdapter(PmsApiCallExecutor callExecutor,
                                 StayReconciliationService reconciliationService,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.callExecutor = callExecutor;
        this.reconciliationService = reconciliationService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public JsonNode cleanPayload(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedPayloadException(getName() + " payload is empty");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException(getName() + " payload is not valid JSON", e);
        }

        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new MalformedPayloadException(getName() + " payload has no content");
        }
        return node;
    }

    /**
     * Converts a cleaned node into a vendor type.
     *
     * @throws InvalidVendorDataException if the node does not fit the type
     */
    protected <T> T readAs(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidVendorDataException(
                    "Cannot read " + getName() + " " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    protected SyncResult startResult(SyncOperation operation) {
        log.info("Starting {} {} sync", getName(), operation);
        return SyncResult.builder()
                .pmsName(getName())
                .operation(operation)
                .startedAt(LocalDateTime.now(clock))
                .build();
    }

    /**
     * Runs {@code reconcile} for each item under the batch error policy, then completes the result.
     */
    protected <T> SyncResult reconcileEach(SyncResult result,
                                           List<T> items,
                                           Function<T, String> referenceOf,
                                           Consumer<T> reconcile) {
        for (T item : items) {
            result.setTotalItems(result.getTotalItems() + 1);
            String reference = referenceOf.apply(item);

            try {
                reconcile.accept(item);
                result.incrementReconciled();
            } catch (IncorrectHotelIdException | InvalidVendorDataException e) {
                log.warn("Skipping {} item {}: {}", getName(), reference, e.getMessage());
                result.addSkipped(reference, e.getMessage());
            } catch (Exception e) {
                log.error("Aborting {} {} at item {}: {}",
                        getName(), result.getOperation(), reference, e.getMessage(), e);
                result.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
                break;
            }
        }

        return complete(result);
    }

    protected SyncResult complete(SyncResult result) {
        result.setCompletedAt(LocalDateTime.now(clock));

        if (result.isSuccessful()) {
            log.info("{} {} sync completed in {}ms: {} items, {} reconciled, {} skipped",
                    getName(),
                    result.getOperation(),
                    result.getDurationMs(),
                    result.getTotalItems(),
                    result.getReconciled(),
                    result.getSkipped());
        } else {
            log.warn("{} {} sync failed after {} of {} items: {}",
                    getName(),
                    result.getOperation(),
                    result.getReconciled() + result.getSkipped(),
                    result.getTotalItems(),
                    result.getFailureReason());
        }
        return result;
    }
}
