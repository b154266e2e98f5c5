package com.mobifone.updatecenter.dto.response;

import com.mobifone.updatecenter.entity.enumeration.BatchState;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BatchRequestResponse {
    String id;
    String requestedBy;
    BatchState state;
    Integer totalItems;
    Integer completedItems;
    Integer failedItems;
    Integer skippedItems;
    Integer overallProgress;
    LocalDateTime scheduledStart;
    LocalDateTime actualStart;
    LocalDateTime actualEnd;
    Long durationSeconds;
    String progressHandle;
    String installNotes;
    String errorSummary;
    LocalDateTime createdDate;
}
