package com.mobifone.updatecenter.dto.response;

import com.mobifone.updatecenter.entity.enumeration.BatchState;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BatchAckResponse {
    String batchId;
    BatchState state;
    String progressHandle;
    String message;
}
