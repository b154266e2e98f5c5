package com.mobifone.updatecenter.service;

import com.mobifone.updatecenter.dto.request.InstallManifest;
import com.mobifone.updatecenter.entity.BatchItem;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestBuilderTest {

    private final ManifestBuilder builder = new ManifestBuilder();

    private BatchItem item(String pkg, int order) {
        return BatchItem.builder().packageId(pkg).packageName(pkg.toUpperCase())
                .fromVersion("1.0.0").toVersion("1.1.0").installOrder(order).build();
    }

    @Test
    void packagesFollowInstallOrder() {
        InstallManifest manifest = builder.build(List.of(item("b", 200), item("a", 100)));

        assertThat(manifest.getName()).isEqualTo("Update Center Batch Install");
        assertThat(manifest.getPackages()).extracting(InstallManifest.ManifestPackage::getId).containsExactly("a", "b");
        InstallManifest.ManifestPackage first = manifest.getPackages().get(0);
        assertThat(first.getType()).isEqualTo("application");
        assertThat(first.isLoadDemoData()).isFalse();
        assertThat(first.getRequestedVersion()).isEqualTo("1.1.0");
        assertThat(first.getNotes()).isEqualTo("A 1.0.0 → 1.1.0");
    }

    @Test
    void jsonUsesInstallerFieldNames() {
        String json = builder.toJson(builder.build(List.of(item("a", 100))));

        assertThat(json).contains("\"requested_version\":\"1.1.0\"", "\"load_demo_data\":false");
        assertThat(builder.fromJson(json).getPackages()).hasSize(1);
    }

    @Test
    void unreadableManifestIsRejected() {
        assertThatThrownBy(() -> builder.fromJson("{not json"))
                .isInstanceOf(AppException.class)
                .matches(e -> ((AppException) e).getErrorCode() == ErrorCode.INVALID_MANIFEST);
        assertThatThrownBy(() -> builder.fromJson(null)).isInstanceOf(AppException.class);
    }
}
