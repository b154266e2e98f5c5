package com.mobifone.updatecenter.entity;

import com.mobifone.updatecenter.dto.response.ItemCounts;
import com.mobifone.updatecenter.entity.enumeration.BatchState;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Table(name = "batch_request")
public class BatchRequest extends AbstractAuditingEntity<String> {
    @Id
    String id;

    String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    BatchState state;

    @Builder.Default
    Integer totalItems = 0;
    @Builder.Default
    Integer completedItems = 0;
    @Builder.Default
    Integer failedItems = 0;
    @Builder.Default
    Integer skippedItems = 0;

    @Builder.Default
    Integer overallProgress = 0;   // 0..100, only moves up while IN_PROGRESS

    LocalDateTime scheduledStart;
    LocalDateTime actualStart;
    LocalDateTime actualEnd;
    Long durationSeconds;

    @Column(columnDefinition = "TEXT")
    String batchManifest;

    String progressHandle;

    @Column(columnDefinition = "TEXT")
    String installNotes;

    @Column(columnDefinition = "TEXT")
    String errorSummary;

    public void transitionTo(BatchState next) {
        if (state == null || !state.canTransitionTo(next)) {
            throw new AppException(ErrorCode.ILLEGAL_STATE_TRANSITION, state + " -> " + next);
        }
        state = next;
    }

    public void advanceProgress(int percent) {
        int bounded = Math.max(0, Math.min(100, percent));
        int current = overallProgress == null ? 0 : overallProgress;
        overallProgress = Math.max(current, bounded);
    }

    @PrePersist
    @PreUpdate
    void checkCounts() {
        int total = totalItems == null ? 0 : totalItems;
        if (nz(completedItems) + nz(failedItems) + nz(skippedItems) > total) {
            throw new AppException(ErrorCode.ITEM_COUNTS_EXCEED_TOTAL, "batch " + id);
        }
    }

    private static int nz(Integer v) {
        return v == null ? 0 : v;
    }

    public void applyCounts(ItemCounts counts) {
        int total = totalItems == null ? 0 : totalItems;
        if (counts.getCompleted() + counts.getFailed() + counts.getSkipped() > total) {
            throw new AppException(ErrorCode.ITEM_COUNTS_EXCEED_TOTAL,
                    counts + " for total " + total + " in batch " + id);
        }
        completedItems = counts.getCompleted();
        failedItems = counts.getFailed();
        skippedItems = counts.getSkipped();
    }
}
