package com.hospitality.staysync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one webhook delivery or one daily pull for one PMS.
 * <p>
 * {@code successful} is false when the batch was aborted; items already
 * reconciled before the abort stay reconciled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {

    private String pmsName;

    private SyncOperation operation;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private boolean successful = true;

    /**
     * The payload was refused before any item was looked at.
     */
    @Builder.Default
    private boolean rejected = false;

    @Builder.Default
    private int totalItems = 0;

    @Builder.Default
    private int reconciled = 0;

    @Builder.Default
    private int skipped = 0;

    @Builder.Default
    private List<SkippedItem> skippedItems = new ArrayList<>();

    private String failureReason;

    public enum SyncOperation {
        WEBHOOK,
        DAILY_PULL
    }

    /**
     * An event or reservation left out of the batch, and why.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkippedItem {
        private String reference;
        private String reason;
    }

    public void incrementReconciled() {
        this.reconciled++;
    }

    public void addSkipped(String reference, String reason) {
        this.skipped++;
        if (this.skippedItems == null) {
            this.skippedItems = new ArrayList<>();
        }
        this.skippedItems.add(SkippedItem.builder()
                .reference(reference)
                .reason(reason)
                .build());
    }

    public void fail(String reason) {
        this.successful = false;
        this.failureReason = reason;
    }

    public void reject(String reason) {
        fail(reason);
        this.rejected = true;
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
