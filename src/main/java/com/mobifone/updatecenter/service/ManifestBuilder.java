package com.mobifone.updatecenter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.updatecenter.common.Constants;
import com.mobifone.updatecenter.dto.request.InstallManifest;
import com.mobifone.updatecenter.entity.BatchItem;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ManifestBuilder {

    static final String PACKAGE_TYPE = "application";

    ObjectMapper om = new ObjectMapper();

    /** One entry per item, in install order. */
    public InstallManifest build(List<BatchItem> items) {
        List<InstallManifest.ManifestPackage> packages = items.stream()
                .sorted(BatchItem.INSTALL_ORDER)
                .map(item -> InstallManifest.ManifestPackage.builder()
                        .id(item.getPackageId())
                        .type(PACKAGE_TYPE)
                        .loadDemoData(false)
                        .requestedVersion(item.getToVersion())
                        .notes(item.getPackageName() + " " + item.getFromVersion() + " → " + item.getToVersion())
                        .build())
                .collect(Collectors.toList());

        return InstallManifest.builder()
                .name(Constants.BATCH.MANIFEST_NAME)
                .notes(Constants.BATCH.MANIFEST_NOTES)
                .packages(packages)
                .build();
    }

    public String toJson(InstallManifest manifest) {
        try {
            return om.writeValueAsString(manifest);
        } catch (Exception e) {
            throw new AppException(ErrorCode.INVALID_MANIFEST, e.getMessage(), e);
        }
    }

    public InstallManifest fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new AppException(ErrorCode.INVALID_MANIFEST, "manifest is empty");
        }
        try {
            return om.readValue(json, InstallManifest.class);
        } catch (Exception e) {
            throw new AppException(ErrorCode.INVALID_MANIFEST, e.getMessage(), e);
        }
    }
}
