package com.mobifone.updatecenter.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.ArrayList;
import java.util.List;

// Payload submitted to the installer; the installer owns the field-level format
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class InstallManifest {
    String name;
    String notes;

    @Builder.Default
    List<ManifestPackage> packages = new ArrayList<>();   // install order

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @FieldDefaults(level = AccessLevel.PRIVATE)
    public static class ManifestPackage {
        String id;
        String type;

        @JsonProperty("load_demo_data")
        boolean loadDemoData;

        @JsonProperty("requested_version")
        String requestedVersion;

        String notes;
    }
}
