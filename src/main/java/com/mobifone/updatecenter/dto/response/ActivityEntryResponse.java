package com.mobifone.updatecenter.dto.response;

import com.mobifone.updatecenter.entity.enumeration.ActivityPhase;
import com.mobifone.updatecenter.entity.enumeration.ActivityType;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ActivityEntryResponse {
    String id;
    Long sequence;
    LocalDateTime timestamp;
    ActivityType activityType;
    ActivityPhase phase;
    String message;
    String details;
    String batchItemId;
    String packageName;
    Integer progressPercent;
    String relativeTime;    // "just now", "12s ago", "4m ago"
}
