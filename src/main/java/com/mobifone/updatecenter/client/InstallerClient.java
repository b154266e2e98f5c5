package com.mobifone.updatecenter.client;

import com.mobifone.updatecenter.dto.request.InstallManifest;
import com.mobifone.updatecenter.dto.response.ProgressSnapshot;

import java.util.Optional;

public interface InstallerClient {

    /**
     * Hands the manifest to the installer.
     *
     * @return opaque reference to the installer's progress handle
     * @throws com.mobifone.updatecenter.exception.AppException with {@code INSTALLER_SUBMISSION_FAILED}
     */
    String submit(InstallManifest manifest);

    /** @return the current snapshot, or empty when the handle does not (yet) exist */
    Optional<ProgressSnapshot> readHandle(String handleRef);
}
