package com.mobifone.updatecenter.service;

import com.mobifone.updatecenter.client.InstallerClient;
import com.mobifone.updatecenter.client.PackageInventoryClient;
import com.mobifone.updatecenter.configuration.ReconcilerProperties;
import com.mobifone.updatecenter.dto.response.ItemCounts;
import com.mobifone.updatecenter.dto.response.ProgressSnapshot;
import com.mobifone.updatecenter.dto.response.ReconciliationResult;
import com.mobifone.updatecenter.entity.BatchItem;
import com.mobifone.updatecenter.entity.BatchRequest;
import com.mobifone.updatecenter.entity.enumeration.*;
import com.mobifone.updatecenter.exception.ErrorCode;
import com.mobifone.updatecenter.utils.DurationFormatter;
import com.mobifone.updatecenter.utils.ProgressMessageClassifier;
import com.mobifone.updatecenter.utils.ReconcilerRegistry;
import com.mobifone.updatecenter.utils.VersionComparator;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Follows one executed batch until it reaches a terminal state.
 * <p>
 * The installer only exposes an overall percentage and a free-text message, so per-item
 * state is estimated while running and then corrected against the installed versions
 * once the handle is terminal. Every exit path finalizes the batch: nothing stays
 * IN_PROGRESS after the loop returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ProgressReconcilerService {

    static final String INSTALLED_OK = "Installed successfully";

    BatchStoreService store;
    ActivityLogService activityLog;
    InstallerClient installer;
    PackageInventoryClient inventory;
    ReconcilerRegistry registry;
    ReconcilerProperties properties;
    Executor reconcilerExecutor;

    enum Outcome { HANDLE_COMPLETE, HANDLE_FAILED, CANCELLED, FORCED }

    // ====== launch ======

    /**
     * Schedules reconciliation on the reconciler executor.
     *
     * @return false when a reconciler is already registered for the batch
     */
    public boolean start(String batchId, String progressHandle) {
        Instant deadline = Instant.now().plus(properties.getMaxRunTime());
        if (!registry.register(batchId, progressHandle, deadline)) {
            log.warn("[batch {}] reconciler already running, not starting another", batchId);
            return false;
        }
        try {
            reconcilerExecutor.execute(() -> runGuarded(batchId, progressHandle));
        } catch (RejectedExecutionException e) {
            registry.release(batchId);
            log.error("[batch {}] reconciler could not be scheduled", batchId, e);
            finalizeForced(batchId, ErrorCode.MONITOR_CRASHED.getMessage() + ": executor rejected the task");
            return false;
        }
        log.info("[batch {}] reconciler scheduled for handle {}", batchId, progressHandle);
        return true;
    }

    public boolean isRunning(String batchId) {
        return registry.isActive(batchId);
    }

    void runGuarded(String batchId, String progressHandle) {
        try {
            reconcile(batchId, progressHandle);
        } catch (Exception e) {
            log.error("[batch {}] progress monitor crashed", batchId, e);
            try {
                finalizeForced(batchId, ErrorCode.MONITOR_CRASHED.getMessage() + ": " + e.getMessage());
            } catch (Exception inner) {
                log.error("[batch {}] forced finalization failed", batchId, inner);
            }
        } finally {
            registry.release(batchId);
        }
    }

    // ====== polling loop ======

    public ReconciliationResult reconcile(String batchId, String progressHandle) {
        Duration maxRunTime = properties.getMaxRunTime();
        // the budget runs from start(), so time spent waiting for a thread counts against it
        ReconcilerRegistry.Registration registration = registry.get(batchId);
        Instant deadline = registration != null ? registration.getDeadline() : Instant.now().plus(maxRunTime);
        String lastMessage = "";
        int lastMilestone = 0;
        int misses = 0;

        activityLog.log(batchId, null, ActivityType.INFO, ActivityPhase.INSTALLATION,
                "Progress monitor started. Tracking handle: " + progressHandle);
        log.info("[batch {}] progress monitor started, handle={}", batchId, progressHandle);

        while (true) {
            if (Instant.now().isAfter(deadline)) {
                activityLog.log(batchId, null, ActivityType.WARNING, ActivityPhase.INSTALLATION,
                        "Progress monitor timed out after " + DurationFormatter.format(maxRunTime.getSeconds()));
                log.warn("[batch {}] monitor timed out after {}", batchId, maxRunTime);
                return finalizeForced(batchId, ErrorCode.MONITOR_TIMEOUT.getMessage());
            }

            BatchRequest batch = store.getRequest(batchId);
            if (batch.getState() == BatchState.CANCELLED) {
                log.info("[batch {}] cancelled locally, monitor stops", batchId);
                return finalizeBatch(batchId, Outcome.CANCELLED, "Cancelled");
            }
            if (batch.getState().isTerminal()) {
                return resultOf(batch, "Already finalized");
            }

            Optional<ProgressSnapshot> read;
            try {
                read = installer.readHandle(progressHandle);
            } catch (Exception e) {
                log.warn("[batch {}] handle read failed: {}", batchId, e.getMessage());
                read = Optional.empty();
            }

            if (read.isEmpty()) {
                misses++;
                if (misses >= properties.getHandleLookupAttempts()) {
                    activityLog.log(batchId, null, ActivityType.ERROR, ActivityPhase.INSTALLATION,
                            "Progress handle not found after " + misses + " attempts");
                    log.warn("[batch {}] handle {} not found after {} attempts", batchId, progressHandle, misses);
                    return finalizeForced(batchId, ErrorCode.PROGRESS_HANDLE_NOT_FOUND.getMessage());
                }
                if (!pause(properties.getHandleLookupInterval())) {
                    return finalizeForced(batchId, ErrorCode.MONITOR_INTERRUPTED.getMessage());
                }
                continue;
            }
            misses = 0;

            ProgressSnapshot snap = read.get();
            HandleState state = snap.getState() == null ? HandleState.STARTING : snap.getState();
            int percent = snap.percentOrZero();
            String message = snap.getMessage() == null ? "" : snap.getMessage();
            log.debug("[batch {}] poll state={} percent={} message='{}'", batchId, state, percent, message);

            if (!message.equals(lastMessage)) {
                activityLog.log(batchId, null, ProgressMessageClassifier.classify(message), ActivityPhase.INSTALLATION,
                        message, ActivityLogService.Extras.builder()
                                .progressPercent(percent)
                                .details(snap.getOutputSummary())
                                .build());
                lastMessage = message;
                applyEstimate(batchId, message, percent);
            }

            int boundary = (percent / 10) * 10;
            if (boundary > lastMilestone) {
                lastMilestone = boundary;
                store.mutateRequest(batchId, r -> {
                    if (r.getState() == BatchState.IN_PROGRESS) r.advanceProgress(boundary);
                });
                activityLog.logProgressMilestone(batchId, boundary);
            }

            if (state.isTerminal()) {
                if (snap.getErrorMessage() != null && !snap.getErrorMessage().isBlank()) {
                    activityLog.log(batchId, null, ActivityType.ERROR, ActivityPhase.POST_INSTALL,
                            "Installation error: " + snap.getErrorMessage());
                }
                syncFinalItemStates(batchId);
                Outcome outcome = state == HandleState.COMPLETE ? Outcome.HANDLE_COMPLETE : Outcome.HANDLE_FAILED;
                String summary = snap.getOutputSummary() != null && !snap.getOutputSummary().isBlank()
                        ? snap.getOutputSummary() : message;
                return finalizeBatch(batchId, outcome, summary);
            }

            Duration interval = state == HandleState.STARTING
                    ? properties.getPollIntervalStarting()
                    : properties.getPollIntervalRunning();
            if (!pause(interval)) {
                return finalizeForced(batchId, ErrorCode.MONITOR_INTERRUPTED.getMessage());
            }
        }
    }

    private boolean pause(Duration interval) {
        try {
            Thread.sleep(Math.max(1L, interval.toMillis()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ====== item estimation ======

    private void applyEstimate(String batchId, String message, int percent) {
        List<BatchItem> installing = store.itemsInState(batchId, ItemState.INSTALLING);
        if (installing.isEmpty()) return;

        ItemProgressEstimator.Plan plan = ItemProgressEstimator.estimate(installing, percent);
        LocalDateTime now = LocalDateTime.now();
        int newlyCompleted = 0;

        for (String itemId : plan.getCompletedItemIds()) {
            boolean[] moved = {false};
            BatchItem saved = store.mutateItem(itemId, it -> {
                moved[0] = it.getState() == ItemState.INSTALLING;
                if (moved[0]) it.markCompleted(now, INSTALLED_OK);
            });
            if (moved[0]) {
                activityLog.logItemInstallComplete(saved);
                newlyCompleted++;
            }
        }
        if (plan.getCurrentItemId() != null) {
            store.mutateItem(plan.getCurrentItemId(), it -> {
                if (it.getState() == ItemState.INSTALLING) {
                    it.setProgressPercent(plan.getCurrentItemPercent());
                    it.setStatusMessage(message);
                }
            });
        }

        BatchRequest recounted = store.recountRequest(batchId);
        if (newlyCompleted > 0) {
            int processed = recounted.getCompletedItems() + recounted.getFailedItems() + recounted.getSkippedItems();
            activityLog.logBatchProgress(batchId, processed, recounted.getTotalItems());
        }
        log.debug("[batch {}] estimate at {}%: {} newly done, current={} ({}%)", batchId, percent,
                newlyCompleted, plan.getCurrentItemId(), plan.getCurrentItemPercent());
    }

    // ====== ground truth ======

    /** Installed versions are authoritative over whatever the estimate concluded. */
    void syncFinalItemStates(String batchId) {
        LocalDateTime now = LocalDateTime.now();
        for (BatchItem item : store.items(batchId)) {
            String installed = installedVersion(batchId, item);
            String expected = item.getToVersion();

            if (VersionComparator.matches(installed, expected)) {
                if (item.getState() != ItemState.COMPLETED) {
                    BatchItem saved = store.mutateItem(item.getId(), it -> it.forceCompleted(now, INSTALLED_OK));
                    activityLog.logItemInstallComplete(saved);
                }
            } else if (item.getState() == ItemState.INSTALLING) {
                String error = ErrorCode.VERSION_MISMATCH.getMessage() + ". Expected " + expected
                        + ", found " + (installed == null ? "unknown" : installed);
                boolean[] moved = {false};
                BatchItem saved = store.mutateItem(item.getId(), it -> {
                    moved[0] = it.getState() == ItemState.INSTALLING;
                    if (moved[0]) it.markFailed(now, error);
                });
                if (moved[0]) {
                    activityLog.logItemInstallFailed(saved, "Version not updated to " + expected);
                    log.warn("[batch {}] {}: {}", batchId, item.getPackageName(), error);
                }
            }
        }
    }

    private String installedVersion(String batchId, BatchItem item) {
        try {
            return inventory.currentVersion(item.getPackageId()).orElse(null);
        } catch (Exception e) {
            log.warn("[batch {}] cannot read installed version of {}: {}", batchId, item.getPackageId(), e.getMessage());
            return null;
        }
    }

    // ====== finalization ======

    ReconciliationResult finalizeForced(String batchId, String cause) {
        LocalDateTime now = LocalDateTime.now();
        store.transitionItems(batchId, EnumSet.of(ItemState.QUEUED, ItemState.INSTALLING), it -> {
            if (it.getState() == ItemState.INSTALLING) {
                it.markFailed(now, cause);
            } else {
                it.markSkipped(now, cause);
            }
        });
        return finalizeBatch(batchId, Outcome.FORCED, cause);
    }

    private ReconciliationResult finalizeBatch(String batchId, Outcome requested, String cause) {
        BatchRequest current = store.getRequest(batchId);
        if (current.getState().isTerminal() && current.getState() != BatchState.CANCELLED) {
            return resultOf(current, "Already finalized");
        }

        ItemCounts counts = store.countItems(batchId);
        LocalDateTime now = LocalDateTime.now();
        Outcome[] effective = {requested};

        BatchRequest saved = store.mutateRequest(batchId, r -> {
            effective[0] = r.getState() == BatchState.CANCELLED ? Outcome.CANCELLED : requested;
            if (r.getActualEnd() == null) r.setActualEnd(now);
            LocalDateTime begin = r.getActualStart() == null ? r.getActualEnd() : r.getActualStart();
            r.setDurationSeconds(Math.max(0L, Duration.between(begin, r.getActualEnd()).getSeconds()));
            // counts read above may predate the cancel; the cancelled row is recounted below instead
            if (effective[0] == Outcome.CANCELLED) return;

            r.applyCounts(counts);
            r.transitionTo(resolveFinalState(effective[0], counts));
            r.advanceProgress(100);
            if (effective[0] == Outcome.FORCED) {
                r.setErrorSummary(cause);
            } else if (counts.getFailed() > 0) {
                r.setErrorSummary(counts.getFailed() + " package(s) failed to install");
            } else if (effective[0] == Outcome.HANDLE_FAILED) {
                r.setErrorSummary(cause);
            }
        });

        if (effective[0] == Outcome.CANCELLED) {
            saved = store.recountRequest(batchId);
            activityLog.log(batchId, null, ActivityType.INFO, ActivityPhase.CLEANUP,
                    "Progress monitor stopped: batch was cancelled");
        } else {
            activityLog.logBatchComplete(batchId, counts, saved.getDurationSeconds());
        }
        log.info("[batch {}] finalized as {} ({} completed, {} failed, {} skipped)",
                batchId, saved.getState(), saved.getCompletedItems(), saved.getFailedItems(), saved.getSkippedItems());
        return resultOf(saved, cause);
    }

    static BatchState resolveFinalState(Outcome outcome, ItemCounts counts) {
        switch (outcome) {
            case CANCELLED:
                return BatchState.CANCELLED;
            case FORCED:
                return BatchState.FAILED;
            default:
                break;
        }
        if (counts.getFailed() > 0 && counts.getCompleted() > 0) return BatchState.PARTIAL;
        if (outcome == Outcome.HANDLE_FAILED || counts.getFailed() > 0) return BatchState.FAILED;
        return BatchState.COMPLETED;
    }

    private ReconciliationResult resultOf(BatchRequest r, String summary) {
        return ReconciliationResult.builder()
                .batchId(r.getId())
                .finalState(r.getState())
                .summary(summary)
                .completed(r.getCompletedItems())
                .failed(r.getFailedItems())
                .skipped(r.getSkippedItems())
                .durationSeconds(r.getDurationSeconds() == null ? 0L : r.getDurationSeconds())
                .build();
    }
}
