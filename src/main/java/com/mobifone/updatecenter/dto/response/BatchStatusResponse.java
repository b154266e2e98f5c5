package com.mobifone.updatecenter.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BatchStatusResponse {
    BatchRequestResponse request;
    List<BatchItemResponse> items;             // by install order
    List<ActivityEntryResponse> recentActivity; // newest first
    ProgressSnapshot progressHandle;            // live read, null when unavailable
}
