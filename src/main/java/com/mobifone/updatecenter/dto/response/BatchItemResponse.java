package com.mobifone.updatecenter.dto.response;

import com.mobifone.updatecenter.entity.enumeration.ItemState;
import com.mobifone.updatecenter.entity.enumeration.RiskLevel;
import com.mobifone.updatecenter.entity.enumeration.UpdateLevel;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BatchItemResponse {
    String id;
    String packageId;
    String packageName;
    String fromVersion;
    String toVersion;
    UpdateLevel updateLevel;
    RiskLevel riskLevel;
    List<String> dependsOn;
    ItemState state;
    Integer installOrder;
    Integer progressPercent;
    String statusMessage;
    String errorMessage;
    LocalDateTime startTime;
    LocalDateTime endTime;
    Long durationSeconds;
}
