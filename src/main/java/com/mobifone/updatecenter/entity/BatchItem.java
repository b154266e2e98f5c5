package com.mobifone.updatecenter.entity;

import com.mobifone.updatecenter.entity.enumeration.ItemState;
import com.mobifone.updatecenter.entity.enumeration.RiskLevel;
import com.mobifone.updatecenter.entity.enumeration.UpdateLevel;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import com.mobifone.updatecenter.utils.ListStringJsonConverter;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Table(name = "batch_item", indexes = @Index(name = "idx_batch_item_request", columnList = "batch_request_id"))
public class BatchItem {
    /** Install order, ties broken by creation time. */
    public static final Comparator<BatchItem> INSTALL_ORDER = Comparator
            .comparing(BatchItem::getInstallOrder, Comparator.nullsLast(Integer::compareTo))
            .thenComparing(BatchItem::getCreatedAt, Comparator.nullsLast(LocalDateTime::compareTo));

    @Id
    String id;

    @Column(name = "batch_request_id", nullable = false)
    String batchRequestId;

    @Column(nullable = false)
    String packageId;
    String packageName;
    String fromVersion;
    String toVersion;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    UpdateLevel updateLevel;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    RiskLevel riskLevel;

    // in-batch prerequisites (package ids)
    @Builder.Default
    @Convert(converter = ListStringJsonConverter.class)
    @Column(columnDefinition = "TEXT")
    List<String> dependsOn = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    ItemState state;

    Integer installOrder;          // 100, 200, ... sequence the installer is assumed to follow

    @Builder.Default
    Integer progressPercent = 0;

    @Column(columnDefinition = "TEXT")
    String statusMessage;

    @Column(columnDefinition = "TEXT")
    String errorMessage;

    LocalDateTime startTime;
    LocalDateTime endTime;
    Long durationSeconds;

    LocalDateTime createdAt;

    @Version
    Long version;

    public void transitionTo(ItemState next) {
        if (state == null || !state.canTransitionTo(next)) {
            throw new AppException(ErrorCode.ILLEGAL_STATE_TRANSITION, "item " + id + ": " + state + " -> " + next);
        }
        state = next;
    }

    public void markInstalling(LocalDateTime now) {
        transitionTo(ItemState.INSTALLING);
        startTime = now;
        progressPercent = 0;
    }

    public void markCompleted(LocalDateTime now, String message) {
        transitionTo(ItemState.COMPLETED);
        finish(now);
        progressPercent = 100;
        statusMessage = message;
    }

    /** Ground-truth override: the installed version matches, whatever the heuristic concluded. */
    public void forceCompleted(LocalDateTime now, String message) {
        state = ItemState.COMPLETED;
        progressPercent = 100;
        statusMessage = message;
        errorMessage = null;
        if (endTime == null) {
            finish(now);
        }
    }

    public void markFailed(LocalDateTime now, String error) {
        transitionTo(ItemState.FAILED);
        finish(now);
        errorMessage = error;
    }

    public void markSkipped(LocalDateTime now, String reason) {
        transitionTo(ItemState.SKIPPED);
        endTime = now;
        statusMessage = reason;
    }

    private void finish(LocalDateTime now) {
        endTime = now;
        durationSeconds = startTime == null ? 0L : Math.max(0L, Duration.between(startTime, now).getSeconds());
    }
}
