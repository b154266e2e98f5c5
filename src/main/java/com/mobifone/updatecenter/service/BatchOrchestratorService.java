package com.mobifone.updatecenter.service;

import com.mobifone.updatecenter.client.InstallerClient;
import com.mobifone.updatecenter.client.PackageInventoryClient;
import com.mobifone.updatecenter.common.Constants;
import com.mobifone.updatecenter.configuration.AuditorAwareImpl;
import com.mobifone.updatecenter.dto.request.CreateBatchRequest;
import com.mobifone.updatecenter.dto.request.InstallManifest;
import com.mobifone.updatecenter.dto.response.*;
import com.mobifone.updatecenter.entity.BatchItem;
import com.mobifone.updatecenter.entity.BatchRequest;
import com.mobifone.updatecenter.entity.enumeration.*;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import com.mobifone.updatecenter.exception.ErrorType;
import com.mobifone.updatecenter.mapper.BatchMapper;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class BatchOrchestratorService {

    private static final int MAX_MESSAGE_LEN = 1000;
    private static final int DEFAULT_PAGE_SIZE = 20;

    BatchStoreService store;
    ActivityLogService activityLog;
    UpdateAnalyzerService analyzer;
    PackageInventoryClient inventory;
    InstallerClient installer;
    ManifestBuilder manifestBuilder;
    ProgressReconcilerService reconciler;
    BatchMapper batchMapper;
    AuditorAware<String> auditorAware;

    private String stripAnsi(String s) {
        if (s == null) return null;
        return s.replaceAll("\\u001B\\[[;\\d]*m", "");
    }

    private String clamp(String s, int max) {
        if (s == null) return null;
        String clean = stripAnsi(s);
        if (clean.length() <= max) return clean;
        return clean.substring(0, max - 15) + "...(truncated)";
    }

    private String currentActor() {
        return auditorAware.getCurrentAuditor().orElse(AuditorAwareImpl.SYSTEM);
    }

    // ===========================================================
    // CREATE
    // ===========================================================

    /**
     * Validates the selection, then persists the request, its items in dependency order and
     * the install manifest. Nothing is written when validation fails. Does not submit.
     */
    public BatchCreatedResponse createBatch(CreateBatchRequest req) {
        List<String> ids = normalize(req.getCandidateIds());
        if (ids.isEmpty()) {
            throw new AppException(ErrorCode.EMPTY_CANDIDATE_SET);
        }
        LocalDateTime now = LocalDateTime.now();
        if (req.getScheduledStart() != null && !req.getScheduledStart().isAfter(now)) {
            throw new AppException(ErrorCode.SCHEDULED_START_IN_PAST, String.valueOf(req.getScheduledStart()));
        }

        // --- resolve candidates, drop those already up to date ---
        Map<String, PackageCandidate> updatable = new LinkedHashMap<>();
        Map<String, UpdateLevel> levels = new HashMap<>();
        for (String id : ids) {
            PackageCandidate c = inventory.findCandidate(id)
                    .orElseThrow(() -> new AppException(ErrorCode.UNKNOWN_CANDIDATE, id));
            Optional<UpdateLevel> level = analyzer.getUpdateLevel(c.getInstalledVersion(), c.getAvailableVersion());
            if (level.isEmpty()) {
                log.info("Skipping {}: already at {}", id, c.getInstalledVersion());
                continue;
            }
            updatable.put(id, c);
            levels.put(id, level.get());
        }
        if (updatable.isEmpty()) {
            throw new AppException(ErrorCode.NO_UPDATES_IN_SELECTION, String.join(",", ids));
        }

        // --- install order ---
        List<String> updatableIds = new ArrayList<>(updatable.keySet());
        DependencyAnalysisResponse analysis = null;
        List<String> order = updatableIds;
        try {
            analysis = analyzer.analyzeDependencies(updatableIds);
            order = analysis.getOrder();
        } catch (Exception e) {
            log.warn("Dependency analysis failed, keeping selection order: {}", e.getMessage());
        }

        // --- request ---
        BatchRequest request = store.createRequest(BatchRequest.builder()
                .requestedBy(currentActor())
                .state(req.getScheduledStart() != null ? BatchState.SCHEDULED : BatchState.DRAFT)
                .totalItems(updatable.size())
                .scheduledStart(req.getScheduledStart())
                .installNotes(req.getNotes())
                .build());
        String batchId = request.getId();

        activityLog.log(batchId, null, ActivityType.START, ActivityPhase.PREPARATION,
                "Batch request created with " + updatable.size() + " package(s)");

        // --- items ---
        Set<String> inSet = new HashSet<>(updatableIds);
        List<BatchItem> items = new ArrayList<>();
        int installOrder = Constants.BATCH.INSTALL_ORDER_STEP;
        for (String id : order) {
            PackageCandidate c = updatable.get(id);
            UpdateLevel level = levels.get(id);
            List<String> deps = analysis == null
                    ? List.of()
                    : analysis.getDependencyMap().getOrDefault(id, List.of());
            items.add(BatchItem.builder()
                    .batchRequestId(batchId)
                    .packageId(id)
                    .packageName(c.getName() == null || c.getName().isBlank() ? id : c.getName())
                    .fromVersion(c.getInstalledVersion())
                    .toVersion(c.getAvailableVersion())
                    .updateLevel(level)
                    .riskLevel(analyzer.assessRisk(c, level))
                    .dependsOn(deps.stream().filter(inSet::contains).collect(Collectors.toList()))
                    .state(ItemState.QUEUED)
                    .installOrder(installOrder)
                    .createdAt(now)
                    .build());
            installOrder += Constants.BATCH.INSTALL_ORDER_STEP;
        }
        items = store.createItems(items);

        // --- manifest ---
        InstallManifest manifest = manifestBuilder.build(items);
        String manifestJson = manifestBuilder.toJson(manifest);
        store.mutateRequest(batchId, r -> r.setBatchManifest(manifestJson));
        activityLog.log(batchId, null, ActivityType.INFO, ActivityPhase.PREPARATION,
                "Batch manifest built with " + manifest.getPackages().size() + " package(s)");

        List<String> warnings = new ArrayList<>();
        if (analysis != null) {
            warnings.addAll(analysis.getConflicts());
            warnings.addAll(analysis.getWarnings());
        }
        for (String w : warnings) {
            activityLog.log(batchId, null, ActivityType.WARNING, ActivityPhase.VALIDATION, w);
        }

        log.info("[batch {}] created by {} with {} package(s), state={}",
                batchId, request.getRequestedBy(), items.size(), request.getState());
        return BatchCreatedResponse.builder()
                .batchId(batchId)
                .state(request.getState())
                .totalItems(items.size())
                .installOrder(items.stream().map(BatchItem::getPackageId).collect(Collectors.toList()))
                .warnings(warnings)
                .message("Batch request created successfully")
                .build();
    }

    // ===========================================================
    // EXECUTE
    // ===========================================================

    public BatchAckResponse executeBatchInstall(String batchId) {
        BatchRequest batch = store.getRequest(batchId);
        if (batch.getState() == BatchState.IN_PROGRESS || reconciler.isRunning(batchId)) {
            throw new AppException(ErrorCode.BATCH_ALREADY_RUNNING, batchId);
        }
        if (!batch.getState().canTransitionTo(BatchState.IN_PROGRESS)) {
            throw new AppException(ErrorCode.BATCH_NOT_EXECUTABLE, batchId + " is " + batch.getState());
        }

        LocalDateTime now = LocalDateTime.now();
        // re-checked on the fresh row: a concurrent execute loses here
        batch = store.mutateRequest(batchId, r -> {
            if (r.getState() == BatchState.IN_PROGRESS) {
                throw new AppException(ErrorCode.BATCH_ALREADY_RUNNING, batchId);
            }
            if (!r.getState().canTransitionTo(BatchState.IN_PROGRESS)) {
                throw new AppException(ErrorCode.BATCH_NOT_EXECUTABLE, batchId + " is " + r.getState());
            }
            r.transitionTo(BatchState.IN_PROGRESS);
            r.setActualStart(now);
        });

        activityLog.log(batchId, null, ActivityType.START, ActivityPhase.INSTALLATION, "Batch installation started");
        List<BatchItem> installing = store.transitionItems(batchId, EnumSet.of(ItemState.QUEUED),
                it -> it.markInstalling(now));
        installing.forEach(activityLog::logItemInstallStart);

        String handle;
        try {
            InstallManifest manifest = manifestBuilder.fromJson(batch.getBatchManifest());
            handle = installer.submit(manifest);
        } catch (Exception e) {
            String error = clamp(Optional.ofNullable(e.getMessage()).orElse(e.getClass().getSimpleName()), MAX_MESSAGE_LEN);
            log.error("[batch {}] submission failed: {}", batchId, error);
            AppException submissionError = e instanceof AppException && ((AppException) e).getType() == ErrorType.SUBMISSION
                    ? (AppException) e
                    : new AppException(ErrorCode.INSTALLER_SUBMISSION_FAILED, error, e);
            try {
                recordSubmissionFailure(batchId, error);
            } catch (Exception recordError) {
                log.error("[batch {}] could not record submission failure", batchId, recordError);
                submissionError.addSuppressed(recordError);
            }
            throw submissionError;
        }

        store.mutateRequest(batchId, r -> r.setProgressHandle(handle));
        activityLog.log(batchId, null, ActivityType.INFO, ActivityPhase.INSTALLATION,
                "Batch install submitted. Progress handle: " + handle);
        log.info("[batch {}] submitted {} package(s), handle={}", batchId, installing.size(), handle);

        if (!reconciler.start(batchId, handle)) {
            log.warn("[batch {}] progress reconciler was not started", batchId);
        }

        // a rejected reconciler finalizes the batch, so report what is persisted
        BatchRequest current = store.getRequest(batchId);
        return BatchAckResponse.builder()
                .batchId(batchId)
                .state(current.getState())
                .progressHandle(handle)
                .message(current.getState() == BatchState.IN_PROGRESS
                        ? "Installation started"
                        : "Installation submitted but not monitored: " + current.getErrorSummary())
                .build();
    }

    private void recordSubmissionFailure(String batchId, String error) {
        LocalDateTime now = LocalDateTime.now();
        store.transitionItems(batchId, EnumSet.of(ItemState.INSTALLING), it -> it.markFailed(now, error));
        ItemCounts counts = store.countItems(batchId);
        store.mutateRequest(batchId, r -> {
            // a cancel may have landed while the submit was in flight: keep CANCELLED, still record the error
            if (!r.getState().isTerminal()) {
                r.applyCounts(counts);
                r.transitionTo(BatchState.FAILED);
                r.setActualEnd(now);
                if (r.getActualStart() != null) {
                    r.setDurationSeconds(Math.max(0L, Duration.between(r.getActualStart(), now).getSeconds()));
                }
            }
            r.setErrorSummary(error);
        });
        activityLog.log(batchId, null, ActivityType.ERROR, ActivityPhase.INSTALLATION,
                "Batch installation failed: " + error);
    }

    // ===========================================================
    // CANCEL
    // ===========================================================

    /**
     * Marks a running batch CANCELLED. Cooperative only: the installer keeps going and the
     * reconciler stops at its next iteration.
     */
    public BatchAckResponse cancelBatchInstall(String batchId) {
        store.getRequest(batchId);
        LocalDateTime now = LocalDateTime.now();
        String actor = currentActor();

        store.mutateRequest(batchId, r -> {
            if (r.getState() != BatchState.IN_PROGRESS) {
                throw new AppException(ErrorCode.BATCH_NOT_CANCELLABLE, batchId + " is " + r.getState());
            }
            r.transitionTo(BatchState.CANCELLED);
            r.setActualEnd(now);
            if (r.getActualStart() != null) {
                r.setDurationSeconds(Math.max(0L, Duration.between(r.getActualStart(), now).getSeconds()));
            }
        });
        List<BatchItem> skipped = store.transitionItems(batchId, EnumSet.of(ItemState.QUEUED, ItemState.INSTALLING),
                it -> it.markSkipped(now, "Cancelled by " + actor));
        BatchRequest saved = store.recountRequest(batchId);

        activityLog.log(batchId, null, ActivityType.WARNING, ActivityPhase.INSTALLATION,
                "Batch installation cancelled by " + actor);
        log.info("[batch {}] cancelled by {}, {} item(s) skipped", batchId, actor, skipped.size());

        return BatchAckResponse.builder()
                .batchId(batchId)
                .state(saved.getState())
                .progressHandle(saved.getProgressHandle())
                .message("Batch installation cancelled")
                .build();
    }

    // ===========================================================
    // QUERIES
    // ===========================================================

    public BatchStatusResponse getBatchStatus(String batchId) {
        BatchRequest batch = store.getRequest(batchId);
        return BatchStatusResponse.builder()
                .request(batchMapper.toBatchRequestResponse(batch))
                .items(batchMapper.toBatchItemResponses(store.items(batchId)))
                .recentActivity(activityLog.recent(batchId))
                .progressHandle(readHandleQuietly(batch))
                .build();
    }

    private ProgressSnapshot readHandleQuietly(BatchRequest batch) {
        if (batch.getProgressHandle() == null || batch.getProgressHandle().isBlank()) return null;
        try {
            return installer.readHandle(batch.getProgressHandle()).orElse(null);
        } catch (Exception e) {
            log.warn("[batch {}] live handle read failed: {}", batch.getId(), e.getMessage());
            return null;
        }
    }

    public List<ActivityEntryResponse> getActivityFeed(String batchId, LocalDateTime since, Integer limit, ActivityType type) {
        store.getRequest(batchId);
        return activityLog.getFeed(batchId, since, limit, type);
    }

    /** Executed batches (drafts excluded), newest first; {@code page} is 1-based. */
    public PagedResponse<BatchRequestResponse> listHistory(BatchState state, int page, int size) {
        int currentPage = Math.max(page, 1);
        int pageSize = size <= 0 ? DEFAULT_PAGE_SIZE : size;
        Pageable pageable = PageRequest.of(currentPage - 1, pageSize);

        Page<BatchRequest> result = store.history(state, pageable);
        return PagedResponse.<BatchRequestResponse>builder()
                .data(result.getContent().stream().map(batchMapper::toBatchRequestResponse).collect(Collectors.toList()))
                .page(currentPage)
                .size(pageSize)
                .totalElements(result.getTotalElements())
                .totalPages(result.getTotalPages())
                .build();
    }

    public DependencyAnalysisResponse analyzeDependencies(List<String> candidateIds) {
        return analyzer.analyzeDependencies(candidateIds);
    }

    public UpdateSummaryResponse getUpdateSummary() {
        return analyzer.getUpdateSummary();
    }

    private static List<String> normalize(List<String> candidateIds) {
        if (candidateIds == null) return List.of();
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String id : candidateIds) {
            if (id != null && !id.isBlank()) unique.add(id.trim());
        }
        return new ArrayList<>(unique);
    }
}
