package com.hospitality.staysync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.hospitality.staysync.dto.SyncResult;
import com.hospitality.staysync.dto.SyncResult.SyncOperation;
import com.hospitality.staysync.entity.Stay;
import com.hospitality.staysync.exception.MalformedPayloadException;
import com.hospitality.staysync.exception.StayNotFoundException;
import com.hospitality.staysync.exception.UnknownPmsException;
import com.hospitality.staysync.pms.PmsAdapter;
import com.hospitality.staysync.pms.PmsAdapterRegistry;
import com.hospitality.staysync.repository.StayRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for everything that triggers a sync: webhook deliveries, the
 * daily scheduler and manual pulls. Also serves live breakfast lookups.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PmsSyncService {

    private final PmsAdapterRegistry adapterRegistry;
    private final StayRepository stayRepository;
    private final Clock clock;

    /**
     * Cleans a raw webhook body with the vendor's adapter and reconciles its events.
     * A body that cannot be cleaned gives a rejected result; nothing is reconciled.
     *
     * @throws UnknownPmsException if no adapter is registered for {@code pmsName}
     */
    public SyncResult processWebhook(String pmsName, String rawPayload) {
        PmsAdapter adapter = requireAdapter(pmsName);
        log.info("Received {} webhook ({} chars)", adapter.getName(), rawPayload == null ? 0 : rawPayload.length());

        try {
            JsonNode payload = adapter.cleanPayload(rawPayload);
            return adapter.handleWebhook(payload);
        } catch (MalformedPayloadException e) {
            log.warn("Rejected {} webhook: {}", adapter.getName(), e.getMessage());
            LocalDateTime now = LocalDateTime.now(clock);
            SyncResult result = SyncResult.builder()
                    .pmsName(adapter.getName())
                    .operation(SyncOperation.WEBHOOK)
                    .startedAt(now)
                    .completedAt(now)
                    .build();
            result.reject(e.getMessage());
            return result;
        }
    }

    /**
     * @throws UnknownPmsException if no adapter is registered for {@code pmsName}
     */
    public SyncResult pullTomorrowsStays(String pmsName) {
        return requireAdapter(pmsName).pullTomorrowsStays();
    }

    /**
     * Runs the daily pull for every registered PMS. One vendor failing does not
     * keep the others from running.
     */
    public List<SyncResult> pullTomorrowsStaysForAll() {
        List<SyncResult> results = new ArrayList<>();

        for (PmsAdapter adapter : adapterRegistry.getAdapters()) {
            try {
                results.add(adapter.pullTomorrowsStays());
            } catch (Exception e) {
                log.error("Daily pull for {} failed with unexpected error", adapter.getName(), e);
                LocalDateTime now = LocalDateTime.now(clock);
                SyncResult failed = SyncResult.builder()
                        .pmsName(adapter.getName())
                        .operation(SyncOperation.DAILY_PULL)
                        .startedAt(now)
                        .completedAt(now)
                        .build();
                failed.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
                results.add(failed);
            }
        }

        return results;
    }

    /**
     * Asks the PMS of the stay's hotel, live.
     *
     * @return whether breakfast is included, or empty if the PMS cannot tell
     * @throws StayNotFoundException if there is no such stay
     * @throws UnknownPmsException   if the hotel's PMS has no adapter
     */
    public Optional<Boolean> stayHasBreakfast(Long stayId) {
        Stay stay = stayRepository.findById(stayId)
                .orElseThrow(() -> new StayNotFoundException(stayId));

        return requireAdapter(stay.getHotel().getPmsName()).stayHasBreakfast(stay);
    }

    private PmsAdapter requireAdapter(String pmsName) {
        return adapterRegistry.resolve(pmsName)
                .orElseThrow(() -> {
                    log.warn("No PMS adapter registered for {}", pmsName);
                    return new UnknownPmsException(pmsName);
                });
    }
}
