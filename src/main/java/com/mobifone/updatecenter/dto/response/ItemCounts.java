package com.mobifone.updatecenter.dto.response;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ItemCounts {
    int total;
    int queued;
    int installing;
    int completed;
    int failed;
    int skipped;

    public int processed() {
        return completed + failed + skipped;
    }
}
