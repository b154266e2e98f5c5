package com.mobifone.updatecenter.dto.response;

import com.mobifone.updatecenter.entity.enumeration.BatchState;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BatchCreatedResponse {
    String batchId;
    BatchState state;
    int totalItems;
    List<String> installOrder;
    List<String> warnings;
    String message;
}
