package com.mobifone.updatecenter.dto.request;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CreateBatchRequest {
    List<String> candidateIds;      // package ids from the inventory
    LocalDateTime scheduledStart;   // optional, must be in the future
    String notes;                   // optional
}
