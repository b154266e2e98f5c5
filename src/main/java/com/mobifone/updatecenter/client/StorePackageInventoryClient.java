package com.mobifone.updatecenter.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.updatecenter.common.Constants;
import com.mobifone.updatecenter.dto.response.PackageCandidate;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import com.mobifone.updatecenter.webClient.ApiStrategy;
import com.mobifone.updatecenter.webClient.ApiStrategyFactory;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class StorePackageInventoryClient implements PackageInventoryClient {

    ApiStrategyFactory apiStrategyFactory;
    ObjectMapper om = new ObjectMapper();

    private ApiStrategy store() {
        return apiStrategyFactory.getStrategy(Constants.STORE.NAME_SERVICE);
    }

    @Override
    public Optional<PackageCandidate> findCandidate(String candidateId) {
        if (candidateId == null || candidateId.isBlank()) return Optional.empty();
        try {
            return store().fetchIfExists(Constants.STORE.ENDPOINT.PACKAGE, candidateId)
                    .map(body -> read(body, PackageCandidate.class));
        } catch (AppException e) {
            throw e;
        } catch (Exception e) {
            throw new AppException(ErrorCode.INVENTORY_UNAVAILABLE, candidateId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> dependenciesOf(String packageId) {
        return findCandidate(packageId)
                .map(PackageCandidate::getDependencies)
                .orElse(Collections.emptyList());
    }

    @Override
    public boolean hasCustomizations(String packageId) {
        return findCandidate(packageId).map(PackageCandidate::isHasCustomizations).orElse(false);
    }

    @Override
    public String displayName(String packageId) {
        return findCandidate(packageId)
                .map(PackageCandidate::getName)
                .filter(n -> !n.isBlank())
                .orElse(packageId);
    }

    @Override
    public Optional<String> currentVersion(String packageId) {
        return findCandidate(packageId).map(PackageCandidate::getInstalledVersion);
    }

    @Override
    public List<PackageCandidate> listAvailableUpdates() {
        try {
            String body = store().callApi(HttpMethod.GET, Constants.STORE.ENDPOINT.AVAILABLE_UPDATES, null);
            if (body == null || body.isBlank()) return Collections.emptyList();
            return om.readValue(body, new TypeReference<List<PackageCandidate>>() {});
        } catch (Exception e) {
            log.error("Listing available updates failed: {}", e.getMessage());
            throw new AppException(ErrorCode.INVENTORY_UNAVAILABLE, e.getMessage(), e);
        }
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return om.readValue(body, type);
        } catch (Exception e) {
            throw new AppException(ErrorCode.INVENTORY_UNAVAILABLE, "unreadable " + type.getSimpleName(), e);
        }
    }
}
