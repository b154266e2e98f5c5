package com.mobifone.updatecenter.entity;

import com.mobifone.updatecenter.dto.response.ItemCounts;
import com.mobifone.updatecenter.entity.enumeration.BatchState;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchRequestTest {

    private BatchRequest batch(BatchState state) {
        return BatchRequest.builder().id("b1").state(state).totalItems(3).build();
    }

    @Test
    @DisplayName("only the documented lifecycle transitions are accepted")
    void transitions() {
        BatchRequest b = batch(BatchState.DRAFT);
        b.transitionTo(BatchState.IN_PROGRESS);
        b.transitionTo(BatchState.PARTIAL);
        assertThat(b.getState()).isEqualTo(BatchState.PARTIAL);

        assertThatThrownBy(() -> b.transitionTo(BatchState.IN_PROGRESS))
                .isInstanceOf(AppException.class)
                .extracting(e -> ((AppException) e).getErrorCode())
                .isEqualTo(ErrorCode.ILLEGAL_STATE_TRANSITION);

        BatchRequest scheduled = batch(BatchState.SCHEDULED);
        assertThatThrownBy(() -> scheduled.transitionTo(BatchState.COMPLETED)).isInstanceOf(AppException.class);
        scheduled.transitionTo(BatchState.IN_PROGRESS);
        assertThat(scheduled.getState()).isEqualTo(BatchState.IN_PROGRESS);
    }

    @Test
    @DisplayName("overall progress is clamped and never goes down")
    void progressIsMonotonic() {
        BatchRequest b = batch(BatchState.IN_PROGRESS);
        b.advanceProgress(40);
        b.advanceProgress(20);
        assertThat(b.getOverallProgress()).isEqualTo(40);
        b.advanceProgress(250);
        assertThat(b.getOverallProgress()).isEqualTo(100);
    }

    @Test
    @DisplayName("item counters may not exceed the total")
    void countsBoundedByTotal() {
        BatchRequest b = batch(BatchState.IN_PROGRESS);
        b.applyCounts(ItemCounts.builder().completed(2).failed(1).build());
        assertThat(b.getCompletedItems()).isEqualTo(2);
        assertThat(b.getFailedItems()).isEqualTo(1);

        assertThatThrownBy(() -> b.applyCounts(ItemCounts.builder().completed(2).failed(1).skipped(1).build()))
                .isInstanceOf(AppException.class)
                .hasMessageContaining(ErrorCode.ITEM_COUNTS_EXCEED_TOTAL.getMessage());
        assertThat(b.getSkippedItems()).isZero();
    }
}
