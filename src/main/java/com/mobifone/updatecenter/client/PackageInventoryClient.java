package com.mobifone.updatecenter.client;

import com.mobifone.updatecenter.dto.response.PackageCandidate;

import java.util.List;
import java.util.Optional;

public interface PackageInventoryClient {

    Optional<PackageCandidate> findCandidate(String candidateId);

    List<String> dependenciesOf(String packageId);

    boolean hasCustomizations(String packageId);

    String displayName(String packageId);

    /** Installed version as the inventory sees it right now. */
    Optional<String> currentVersion(String packageId);

    List<PackageCandidate> listAvailableUpdates();
}
