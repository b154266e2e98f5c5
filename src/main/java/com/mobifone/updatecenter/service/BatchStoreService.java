package com.mobifone.updatecenter.service;

import com.mobifone.updatecenter.dto.response.ItemCounts;
import com.mobifone.updatecenter.entity.BatchItem;
import com.mobifone.updatecenter.entity.BatchRequest;
import com.mobifone.updatecenter.entity.enumeration.BatchState;
import com.mobifone.updatecenter.entity.enumeration.ItemState;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import com.mobifone.updatecenter.repository.BatchItemRepository;
import com.mobifone.updatecenter.repository.BatchRequestRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Persistence facade for batch requests and their items.
 * <p>
 * All updates go through {@link #mutateRequest} / {@link #mutateItem}: the latest row is
 * re-read, mutated and saved in one short transaction, and the whole step is retried when
 * the optimistic version check fails. Entity methods enforce the lifecycle invariants.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class BatchStoreService {

    static final int MAX_ATTEMPTS = 3;

    BatchRequestRepository requestRepo;
    BatchItemRepository itemRepo;
    TransactionTemplate tx;

    // ====== create / read ======

    @Transactional
    public BatchRequest createRequest(BatchRequest request) {
        if (request.getId() == null) {
            request.setId(UUID.randomUUID().toString());
        }
        return requestRepo.save(request);
    }

    @Transactional
    public List<BatchItem> createItems(List<BatchItem> items) {
        for (BatchItem item : items) {
            if (item.getId() == null) item.setId(UUID.randomUUID().toString());
        }
        return itemRepo.saveAll(items);
    }

    @Transactional(readOnly = true)
    public BatchRequest getRequest(String batchId) {
        return requestRepo.findById(batchId)
                .orElseThrow(() -> new AppException(ErrorCode.BATCH_NOT_FOUND, batchId));
    }

    @Transactional(readOnly = true)
    public List<BatchItem> items(String batchId) {
        return itemRepo.findByBatchRequestIdOrderByInstallOrderAscCreatedAtAsc(batchId);
    }

    @Transactional(readOnly = true)
    public List<BatchItem> itemsInState(String batchId, ItemState state) {
        return itemRepo.findByBatchRequestIdAndStateOrderByInstallOrderAscCreatedAtAsc(batchId, state);
    }

    @Transactional(readOnly = true)
    public ItemCounts countItems(String batchId) {
        Map<ItemState, Integer> byState = new EnumMap<>(ItemState.class);
        List<BatchItem> all = itemRepo.findByBatchRequestIdOrderByInstallOrderAscCreatedAtAsc(batchId);
        for (BatchItem item : all) {
            byState.merge(item.getState(), 1, Integer::sum);
        }
        return ItemCounts.builder()
                .total(all.size())
                .queued(byState.getOrDefault(ItemState.QUEUED, 0))
                .installing(byState.getOrDefault(ItemState.INSTALLING, 0))
                .completed(byState.getOrDefault(ItemState.COMPLETED, 0))
                .failed(byState.getOrDefault(ItemState.FAILED, 0))
                .skipped(byState.getOrDefault(ItemState.SKIPPED, 0))
                .build();
    }

    @Transactional(readOnly = true)
    public Page<BatchRequest> history(BatchState state, Pageable pageable) {
        return requestRepo.searchHistory(BatchState.DRAFT, state, pageable);
    }

    // ====== read-modify-write ======

    public BatchRequest mutateRequest(String batchId, Consumer<BatchRequest> mutation) {
        return withRetry("batch " + batchId, () -> tx.execute(status -> {
            BatchRequest fresh = requestRepo.findById(batchId)
                    .orElseThrow(() -> new AppException(ErrorCode.BATCH_NOT_FOUND, batchId));
            mutation.accept(fresh);
            return requestRepo.saveAndFlush(fresh);
        }));
    }

    public BatchItem mutateItem(String itemId, Consumer<BatchItem> mutation) {
        return withRetry("item " + itemId, () -> tx.execute(status -> {
            BatchItem fresh = itemRepo.findById(itemId)
                    .orElseThrow(() -> new AppException(ErrorCode.BATCH_NOT_FOUND, "item " + itemId));
            mutation.accept(fresh);
            return itemRepo.saveAndFlush(fresh);
        }));
    }

    /**
     * Applies {@code mutation} to every item of the batch currently in one of {@code from}.
     * The state is re-checked on the fresh row, items that moved meanwhile are left alone.
     *
     * @return the items that were changed
     */
    public List<BatchItem> transitionItems(String batchId, Set<ItemState> from, Consumer<BatchItem> mutation) {
        List<BatchItem> changed = new ArrayList<>();
        for (BatchItem candidate : items(batchId)) {
            if (!from.contains(candidate.getState())) continue;
            boolean[] applied = {false};
            BatchItem saved = mutateItem(candidate.getId(), fresh -> {
                applied[0] = from.contains(fresh.getState());
                if (applied[0]) {
                    mutation.accept(fresh);
                }
            });
            if (applied[0]) changed.add(saved);
        }
        return changed;
    }

    /** Recomputes completed/failed/skipped from the items. */
    public BatchRequest recountRequest(String batchId) {
        ItemCounts counts = countItems(batchId);
        return mutateRequest(batchId, r -> r.applyCounts(counts));
    }

    private <T> T withRetry(String what, Supplier<T> step) {
        OptimisticLockingFailureException last = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return step.get();
            } catch (OptimisticLockingFailureException e) {
                log.warn("Concurrent update on {} (attempt {}/{})", what, attempt, MAX_ATTEMPTS);
                last = e;
            }
        }
        throw last;
    }
}
