package com.mobifone.updatecenter.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

// Package as described by the inventory service
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PackageCandidate {

    @JsonProperty("id")
    private String packageId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("vendor")
    private String vendor;

    @JsonProperty("installed_version")
    private String installedVersion;

    @JsonProperty("available_version")
    private String availableVersion;

    @JsonProperty("has_customizations")
    private boolean hasCustomizations;

    @Builder.Default
    @JsonProperty("dependencies")
    private List<String> dependencies = new ArrayList<>();
}
