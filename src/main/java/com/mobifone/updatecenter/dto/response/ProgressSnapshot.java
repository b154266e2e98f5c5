package com.mobifone.updatecenter.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mobifone.updatecenter.entity.enumeration.HandleState;
import lombok.*;

// Point-in-time read of the installer's progress handle
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgressSnapshot {

    @JsonProperty("id")
    private String handleId;

    @JsonProperty("state")
    private HandleState state;

    @JsonProperty("message")
    private String message;

    @JsonProperty("percent_complete")
    private Integer percentComplete;   // 0..100, not monotonic

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("output_summary")
    private String outputSummary;

    public int percentOrZero() {
        if (percentComplete == null) return 0;
        return Math.max(0, Math.min(100, percentComplete));
    }
}
