package com.mobifone.updatecenter.dto.response;

import com.mobifone.updatecenter.entity.enumeration.RiskLevel;
import com.mobifone.updatecenter.entity.enumeration.UpdateLevel;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class UpdateSummaryResponse {
    int total;
    int major;
    int minor;
    int patch;
    Map<String, Integer> byVendor;
    Map<RiskLevel, Integer> riskBreakdown;
    List<AvailableUpdate> updates;

    @Data @Builder
    public static class AvailableUpdate {
        String packageId;
        String name;
        String vendor;
        String installedVersion;
        String availableVersion;
        UpdateLevel updateLevel;
        RiskLevel riskLevel;
        int riskScore;
    }
}
