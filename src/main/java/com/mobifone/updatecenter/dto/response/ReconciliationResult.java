package com.mobifone.updatecenter.dto.response;

import com.mobifone.updatecenter.entity.enumeration.BatchState;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReconciliationResult {
    String batchId;
    BatchState finalState;
    String summary;
    int completed;
    int failed;
    int skipped;
    long durationSeconds;
}
