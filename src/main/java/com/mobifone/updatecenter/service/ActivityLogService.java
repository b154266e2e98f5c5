package com.mobifone.updatecenter.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobifone.updatecenter.common.Constants;
import com.mobifone.updatecenter.dto.response.ActivityEntryResponse;
import com.mobifone.updatecenter.dto.response.ItemCounts;
import com.mobifone.updatecenter.entity.ActivityLogEntry;
import com.mobifone.updatecenter.entity.BatchItem;
import com.mobifone.updatecenter.entity.enumeration.ActivityPhase;
import com.mobifone.updatecenter.entity.enumeration.ActivityType;
import com.mobifone.updatecenter.mapper.BatchMapper;
import com.mobifone.updatecenter.repository.ActivityLogRepository;
import com.mobifone.updatecenter.utils.DurationFormatter;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only activity trail per batch.
 * <p>
 * Holds no counters: the next sequence is derived from the store ({@code max + 1}) while a
 * per-batch stripe lock is held, so entries of one batch are numbered 1, 2, 3, ... without
 * gaps. Callers must not wrap {@link #log} in their own transaction, otherwise the insert
 * would only become visible after the lock is released.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ActivityLogService {

    static final int STRIPES = 64;
    static final int MAX_INSERT_ATTEMPTS = 3;
    static final int MAX_MESSAGE_LEN = 1000;
    static final int MAX_DETAIL_LEN = 4000;

    ActivityLogRepository activityRepo;
    BatchMapper mapper;

    ObjectMapper om = new ObjectMapper();
    Object[] locks = newLocks();

    @Value
    @Builder
    public static class Extras {
        public static final Extras NONE = Extras.builder().build();

        String details;
        String packageName;
        Integer progressPercent;
    }

    private static Object[] newLocks() {
        Object[] l = new Object[STRIPES];
        for (int i = 0; i < STRIPES; i++) l[i] = new Object();
        return l;
    }

    private Object lockFor(String batchId) {
        return locks[Math.floorMod(batchId.hashCode(), STRIPES)];
    }

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

    // ====== core append ======

    public ActivityLogEntry log(String batchId, String itemId, ActivityType type, ActivityPhase phase, String message) {
        return log(batchId, itemId, type, phase, message, Extras.NONE);
    }

    public ActivityLogEntry log(String batchId, String itemId, ActivityType type, ActivityPhase phase,
                                String message, Extras extras) {
        Extras x = extras == null ? Extras.NONE : extras;
        Integer percent = x.getProgressPercent() == null ? null : Math.max(0, Math.min(100, x.getProgressPercent()));

        synchronized (lockFor(batchId)) {
            DataIntegrityViolationException last = null;
            for (int attempt = 1; attempt <= MAX_INSERT_ATTEMPTS; attempt++) {
                long next = activityRepo.findMaxSequence(batchId) + 1;
                ActivityLogEntry entry = ActivityLogEntry.builder()
                        .batchRequestId(batchId)
                        .batchItemId(itemId)
                        .packageName(x.getPackageName())
                        .sequence(next)
                        .timestamp(LocalDateTime.now())
                        .activityType(type)
                        .phase(phase)
                        .message(clamp(message, MAX_MESSAGE_LEN))
                        .details(clamp(x.getDetails(), MAX_DETAIL_LEN))
                        .progressPercent(percent)
                        .build();
                try {
                    ActivityLogEntry saved = activityRepo.save(entry);
                    log.debug("[batch {}] #{} {}/{} {}", batchId, next, type, phase, entry.getMessage());
                    return saved;
                } catch (DataIntegrityViolationException e) {
                    // another process took this sequence number
                    log.warn("[batch {}] sequence {} already taken (attempt {}/{})",
                            batchId, next, attempt, MAX_INSERT_ATTEMPTS);
                    last = e;
                }
            }
            throw last;
        }
    }

    // ====== item helpers ======

    public void logItemInstallStart(BatchItem item) {
        log(item.getBatchRequestId(), item.getId(), ActivityType.START, ActivityPhase.INSTALLATION,
                "Starting installation: " + item.getPackageName() + " " + item.getFromVersion() + " → " + item.getToVersion(),
                Extras.builder().packageName(item.getPackageName()).progressPercent(0).build());
    }

    public void logItemInstallComplete(BatchItem item) {
        long seconds = item.getDurationSeconds() == null ? 0L : item.getDurationSeconds();
        log(item.getBatchRequestId(), item.getId(), ActivityType.SUCCESS, ActivityPhase.INSTALLATION,
                item.getPackageName() + " updated to " + item.getToVersion() + " (" + DurationFormatter.format(seconds) + ")",
                Extras.builder().packageName(item.getPackageName()).progressPercent(100).build());
    }

    public void logItemInstallFailed(BatchItem item, String error) {
        log(item.getBatchRequestId(), item.getId(), ActivityType.ERROR, ActivityPhase.INSTALLATION,
                "Failed to install " + item.getPackageName() + ": " + error,
                Extras.builder().packageName(item.getPackageName()).details(error).build());
    }

    // ====== batch helpers ======

    public void logBatchProgress(String batchId, int processed, int total) {
        int pct = total > 0 ? Math.round(processed * 100f / total) : 0;
        log(batchId, null, ActivityType.MILESTONE, ActivityPhase.INSTALLATION,
                processed + " of " + total + " packages processed (" + pct + "%)",
                Extras.builder().progressPercent(pct).build());
    }

    public void logProgressMilestone(String batchId, int percent) {
        log(batchId, null, ActivityType.MILESTONE, ActivityPhase.INSTALLATION,
                "Overall progress reached " + percent + "%",
                Extras.builder().progressPercent(percent).build());
    }

    public void logBatchComplete(String batchId, ItemCounts counts, long durationSeconds) {
        String msg = "Batch installation complete. "
                + counts.getCompleted() + " succeeded, "
                + counts.getFailed() + " failed, "
                + counts.getSkipped() + " skipped. "
                + "Total time: " + DurationFormatter.format(durationSeconds);

        ActivityType type = counts.getFailed() > 0 ? ActivityType.WARNING : ActivityType.COMPLETE;
        log(batchId, null, type, ActivityPhase.CLEANUP, msg,
                Extras.builder().progressPercent(100).details(summaryJson(counts, durationSeconds)).build());
    }

    private String summaryJson(ItemCounts counts, long durationSeconds) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("completed", counts.getCompleted());
        summary.put("failed", counts.getFailed());
        summary.put("skipped", counts.getSkipped());
        summary.put("total", counts.getCompleted() + counts.getFailed() + counts.getSkipped());
        summary.put("durationSeconds", durationSeconds);
        try {
            return om.writeValueAsString(summary);
        } catch (Exception e) {
            log.warn("Cannot serialize batch summary: {}", e.getMessage());
            return summary.toString();
        }
    }

    // ====== reads ======

    /** Entries newest first; {@code since} and {@code type} are optional. */
    public List<ActivityEntryResponse> getFeed(String batchId, LocalDateTime since, Integer limit, ActivityType type) {
        int size = (limit == null || limit <= 0) ? Constants.BATCH.DEFAULT_FEED_LIMIT
                : Math.min(limit, Constants.BATCH.MAX_FEED_LIMIT);
        List<ActivityLogEntry> rows = activityRepo.findFeed(batchId, since, type, PageRequest.of(0, size));
        LocalDateTime now = LocalDateTime.now();
        List<ActivityEntryResponse> out = mapper.toActivityEntryResponses(rows);
        out.forEach(r -> r.setRelativeTime(DurationFormatter.relative(r.getTimestamp(), now)));
        return out;
    }

    public List<ActivityEntryResponse> recent(String batchId) {
        return getFeed(batchId, null, Constants.BATCH.RECENT_ACTIVITY_LIMIT, null);
    }

    /** Full trail in append order. */
    public List<ActivityLogEntry> replay(String batchId) {
        return activityRepo.findByBatchRequestIdOrderBySequenceAsc(batchId);
    }
}
