package com.mobifone.updatecenter.configuration;

import com.mobifone.updatecenter.entity.enumeration.RiskLevel;
import com.mobifone.updatecenter.entity.enumeration.UpdateLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Risk scoring knobs. The score is advisory and never blocks a batch.
 */
@Configuration
@ConfigurationProperties(prefix = "batch-install.analyzer")
@Data
public class AnalyzerProperties {
    private int majorWeight = 30;
    private int minorWeight = 15;
    private int patchWeight = 5;
    private int perDependencyWeight = 10;
    private int customizationWeight = 20;

    // upper bounds (exclusive) of the LOW, MEDIUM and HIGH bands
    private int lowBelow = 20;
    private int mediumBelow = 40;
    private int highBelow = 60;

    public int weightOf(UpdateLevel level) {
        if (level == null) return 0;
        switch (level) {
            case MAJOR:
                return majorWeight;
            case MINOR:
                return minorWeight;
            default:
                return patchWeight;
        }
    }

    public RiskLevel band(int score) {
        if (score < lowBelow) return RiskLevel.LOW;
        if (score < mediumBelow) return RiskLevel.MEDIUM;
        if (score < highBelow) return RiskLevel.HIGH;
        return RiskLevel.CRITICAL;
    }
}
