package com.mobifone.updatecenter.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.updatecenter.common.Constants;
import com.mobifone.updatecenter.dto.request.InstallManifest;
import com.mobifone.updatecenter.dto.response.ProgressSnapshot;
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

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class StoreInstallerClient implements InstallerClient {

    ApiStrategyFactory apiStrategyFactory;
    ObjectMapper om = new ObjectMapper();

    private ApiStrategy store() {
        return apiStrategyFactory.getStrategy(Constants.STORE.NAME_SERVICE);
    }

    @Override
    public String submit(InstallManifest manifest) {
        String body;
        try {
            body = store().callApi(HttpMethod.POST, Constants.STORE.ENDPOINT.BATCH_INSTALL, manifest);
        } catch (AppException e) {
            throw e;
        } catch (Exception e) {
            log.error("Batch install submission failed: {}", e.getMessage());
            throw new AppException(ErrorCode.INSTALLER_SUBMISSION_FAILED, e.getMessage(), e);
        }

        String handle = extractHandle(body);
        if (handle == null) {
            throw new AppException(ErrorCode.INSTALLER_SUBMISSION_FAILED, "no progress handle in response");
        }
        log.info("Installer accepted manifest '{}' with {} package(s), handle={}",
                manifest.getName(), manifest.getPackages().size(), handle);
        return handle;
    }

    @Override
    public Optional<ProgressSnapshot> readHandle(String handleRef) {
        Optional<String> body;
        try {
            body = store().fetchIfExists(Constants.STORE.ENDPOINT.PROGRESS, handleRef);
        } catch (Exception e) {
            throw new AppException(ErrorCode.INSTALLER_UNAVAILABLE, handleRef + ": " + e.getMessage(), e);
        }
        return body.filter(b -> !b.isBlank()).map(b -> parseSnapshot(handleRef, b));
    }

    private ProgressSnapshot parseSnapshot(String handleRef, String body) {
        try {
            return om.readValue(body, ProgressSnapshot.class);
        } catch (Exception e) {
            throw new AppException(ErrorCode.INSTALLER_UNAVAILABLE, "unreadable snapshot for " + handleRef, e);
        }
    }

    // installer answers {"progressId": "..."} or {"progress_id": "..."}, sometimes wrapped in "result"
    private String extractHandle(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode root = om.readTree(body);
            JsonNode node = root.has("result") && root.get("result").isObject() ? root.get("result") : root;
            for (String field : new String[]{"progressId", "progress_id"}) {
                JsonNode v = node.get(field);
                if (v != null && !v.isNull() && !v.asText().isBlank()) {
                    return v.asText();
                }
            }
            return null;
        } catch (Exception e) {
            throw new AppException(ErrorCode.INSTALLER_SUBMISSION_FAILED, "unreadable installer response", e);
        }
    }
}
