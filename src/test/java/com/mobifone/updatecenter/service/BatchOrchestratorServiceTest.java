package com.mobifone.updatecenter.service;

import com.mobifone.updatecenter.client.InstallerClient;
import com.mobifone.updatecenter.client.PackageInventoryClient;
import com.mobifone.updatecenter.configuration.AnalyzerProperties;
import com.mobifone.updatecenter.dto.request.CreateBatchRequest;
import com.mobifone.updatecenter.dto.response.*;
import com.mobifone.updatecenter.entity.BatchItem;
import com.mobifone.updatecenter.entity.BatchRequest;
import com.mobifone.updatecenter.entity.enumeration.*;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import com.mobifone.updatecenter.exception.ErrorType;
import com.mobifone.updatecenter.mapper.BatchMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BatchOrchestratorService Unit Tests")
class BatchOrchestratorServiceTest {

    @Mock
    private BatchStoreService store;
    @Mock
    private ActivityLogService activityLog;
    @Mock
    private PackageInventoryClient inventory;
    @Mock
    private InstallerClient installer;
    @Mock
    private ProgressReconcilerService reconciler;

    private final ManifestBuilder manifestBuilder = new ManifestBuilder();
    private BatchOrchestratorService orchestrator;
    private BatchRequest held;

    @BeforeEach
    void setUp() {
        orchestrator = new BatchOrchestratorService(store, activityLog,
                new UpdateAnalyzerService(inventory, new AnalyzerProperties()),
                inventory, installer, manifestBuilder, reconciler,
                Mappers.getMapper(BatchMapper.class), () -> Optional.of("alice"));

        candidate("alpha", "1.0.0", "1.1.0");
        candidate("beta", "2.0.0", "3.0.0");
        candidate("gamma", "4.2.0", "4.2.0");
        lenient().when(inventory.dependenciesOf(anyString())).thenReturn(List.of());
        lenient().when(inventory.dependenciesOf("alpha")).thenReturn(List.of("beta"));
        lenient().when(inventory.displayName(anyString())).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(store.mutateRequest(anyString(), any())).thenAnswer(inv -> {
            Consumer<BatchRequest> mutation = inv.getArgument(1);
            mutation.accept(held);
            return held;
        });
    }

    private void candidate(String id, String installed, String available) {
        lenient().when(inventory.findCandidate(id)).thenReturn(Optional.of(PackageCandidate.builder()
                .packageId(id).name(id.toUpperCase()).installedVersion(installed).availableVersion(available).build()));
    }

    private void hold(BatchRequest request) {
        held = request;
        lenient().when(store.getRequest(request.getId())).thenReturn(request);
        lenient().when(store.countItems(request.getId())).thenReturn(ItemCounts.builder().total(2).build());
        lenient().when(store.recountRequest(request.getId())).thenReturn(request);
    }

    private BatchRequest stored(BatchState state) {
        BatchItem a = BatchItem.builder().packageId("alpha").packageName("ALPHA")
                .fromVersion("1.0.0").toVersion("1.1.0").installOrder(100).build();
        return BatchRequest.builder().id("b1").state(state).totalItems(2)
                .batchManifest(manifestBuilder.toJson(manifestBuilder.build(List.of(a)))).build();
    }

    private static ErrorCode codeOf(Throwable e) {
        return ((AppException) e).getErrorCode();
    }

    // ===== create =====

    @Test
    @DisplayName("createBatch: invalid selections are rejected before anything is written")
    void createBatch_validationWritesNothing() {
        assertThatThrownBy(() -> orchestrator.createBatch(CreateBatchRequest.builder().candidateIds(List.of(" ")).build()))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.EMPTY_CANDIDATE_SET));

        when(inventory.findCandidate("ghost")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> orchestrator.createBatch(CreateBatchRequest.builder().candidateIds(List.of("alpha", "ghost")).build()))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.UNKNOWN_CANDIDATE));

        assertThatThrownBy(() -> orchestrator.createBatch(CreateBatchRequest.builder().candidateIds(List.of("gamma")).build()))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.NO_UPDATES_IN_SELECTION));

        CreateBatchRequest past = CreateBatchRequest.builder().candidateIds(List.of("alpha"))
                .scheduledStart(LocalDateTime.now().minusMinutes(1)).build();
        assertThatThrownBy(() -> orchestrator.createBatch(past))
                .isInstanceOf(AppException.class)
                .satisfies(e -> assertThat(((AppException) e).getType()).isEqualTo(ErrorType.VALIDATION));

        verifyNoInteractions(store, activityLog);
    }

    @Test
    @DisplayName("createBatch: prerequisites first, up-to-date packages dropped, manifest stored")
    @SuppressWarnings("unchecked")
    void createBatch_ordersItemsAndStoresManifest() {
        when(store.createRequest(any())).thenAnswer(inv -> {
            BatchRequest r = inv.getArgument(0);
            r.setId("b1");
            held = r;
            return r;
        });
        when(store.createItems(anyList())).thenAnswer(inv -> inv.getArgument(0));

        BatchCreatedResponse created = orchestrator.createBatch(CreateBatchRequest.builder()
                .candidateIds(List.of("alpha", "beta", "gamma", "alpha")).notes("monthly").build());

        assertThat(created.getBatchId()).isEqualTo("b1");
        assertThat(created.getState()).isEqualTo(BatchState.DRAFT);
        assertThat(created.getInstallOrder()).containsExactly("beta", "alpha");
        assertThat(held.getTotalItems()).isEqualTo(2);
        assertThat(held.getRequestedBy()).isEqualTo("alice");
        assertThat(held.getInstallNotes()).isEqualTo("monthly");
        assertThat(manifestBuilder.fromJson(held.getBatchManifest()).getPackages())
                .extracting(p -> p.getId()).containsExactly("beta", "alpha");

        ArgumentCaptor<List<BatchItem>> items = ArgumentCaptor.forClass(List.class);
        verify(store).createItems(items.capture());
        assertThat(items.getValue()).extracting(BatchItem::getInstallOrder).containsExactly(100, 200);
        assertThat(items.getValue()).allMatch(i -> i.getState() == ItemState.QUEUED);
        BatchItem alpha = items.getValue().get(1);
        assertThat(alpha.getDependsOn()).containsExactly("beta");
        assertThat(alpha.getUpdateLevel()).isEqualTo(UpdateLevel.MINOR);
        assertThat(items.getValue().get(0).getUpdateLevel()).isEqualTo(UpdateLevel.MAJOR);

        verify(activityLog).log("b1", null, ActivityType.START, ActivityPhase.PREPARATION,
                "Batch request created with 2 package(s)");
        verifyNoInteractions(installer);
    }

    @Test
    void createBatch_futureStartIsScheduled() {
        when(store.createRequest(any())).thenAnswer(inv -> {
            BatchRequest r = inv.getArgument(0);
            r.setId("b1");
            held = r;
            return r;
        });
        when(store.createItems(anyList())).thenAnswer(inv -> inv.getArgument(0));

        BatchCreatedResponse created = orchestrator.createBatch(CreateBatchRequest.builder()
                .candidateIds(List.of("beta")).scheduledStart(LocalDateTime.now().plusHours(1)).build());

        assertThat(created.getState()).isEqualTo(BatchState.SCHEDULED);
    }

    // ===== execute =====

    @Test
    @DisplayName("executeBatchInstall: a running batch is a conflict and is not resubmitted")
    void execute_alreadyRunning() {
        hold(stored(BatchState.IN_PROGRESS));

        assertThatThrownBy(() -> orchestrator.executeBatchInstall("b1"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.BATCH_ALREADY_RUNNING))
                .satisfies(e -> assertThat(((AppException) e).getType()).isEqualTo(ErrorType.CONFLICT));
        verifyNoInteractions(installer);
    }

    @Test
    void execute_terminalBatchIsNotExecutable() {
        hold(stored(BatchState.COMPLETED));

        assertThatThrownBy(() -> orchestrator.executeBatchInstall("b1"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.BATCH_NOT_EXECUTABLE));
        verifyNoInteractions(installer);
    }

    @Test
    @DisplayName("executeBatchInstall: submission failure leaves the batch FAILED and starts no monitor")
    void execute_submissionFailureIsRecorded() {
        hold(stored(BatchState.DRAFT));
        when(installer.submit(any())).thenThrow(new AppException(ErrorCode.INSTALLER_SUBMISSION_FAILED, "HTTP 500"));

        assertThatThrownBy(() -> orchestrator.executeBatchInstall("b1"))
                .satisfies(e -> assertThat(((AppException) e).getType()).isEqualTo(ErrorType.SUBMISSION));

        assertThat(held.getState()).isEqualTo(BatchState.FAILED);
        assertThat(held.getErrorSummary()).contains("HTTP 500");
        assertThat(held.getActualEnd()).isNotNull();
        verify(reconciler, never()).start(anyString(), anyString());
        verify(activityLog).log(eq("b1"), isNull(), eq(ActivityType.ERROR), eq(ActivityPhase.INSTALLATION),
                startsWith("Batch installation failed: "));
    }

    @Test
    void execute_submitsAndStartsReconciler() {
        hold(stored(BatchState.DRAFT));
        BatchItem alpha = BatchItem.builder().id("i1").batchRequestId("b1").packageName("ALPHA")
                .fromVersion("1.0.0").toVersion("1.1.0").state(ItemState.INSTALLING).build();
        when(store.transitionItems(eq("b1"), any(), any())).thenReturn(List.of(alpha));
        when(installer.submit(any())).thenReturn("pw-1");
        when(reconciler.start("b1", "pw-1")).thenReturn(true);

        BatchAckResponse ack = orchestrator.executeBatchInstall("b1");

        assertThat(ack.getState()).isEqualTo(BatchState.IN_PROGRESS);
        assertThat(ack.getProgressHandle()).isEqualTo("pw-1");
        assertThat(held.getState()).isEqualTo(BatchState.IN_PROGRESS);
        assertThat(held.getProgressHandle()).isEqualTo("pw-1");
        assertThat(held.getActualStart()).isNotNull();
        verify(activityLog).log("b1", null, ActivityType.START, ActivityPhase.INSTALLATION, "Batch installation started");
        verify(activityLog).logItemInstallStart(alpha);
        verify(reconciler).start("b1", "pw-1");
    }

    @Test
    @DisplayName("executeBatchInstall: a monitor that could not be scheduled is reported, not acknowledged as started")
    void execute_rejectedReconcilerReportsPersistedState() {
        hold(stored(BatchState.DRAFT));
        when(installer.submit(any())).thenReturn("pw-1");
        when(reconciler.start("b1", "pw-1")).thenAnswer(inv -> {
            held.transitionTo(BatchState.FAILED);
            held.setErrorSummary("Progress monitor failed: executor rejected the task");
            return false;
        });

        BatchAckResponse ack = orchestrator.executeBatchInstall("b1");

        assertThat(ack.getState()).isEqualTo(BatchState.FAILED);
        assertThat(ack.getProgressHandle()).isEqualTo("pw-1");
        assertThat(ack.getMessage()).isNotEqualTo("Installation started").contains("executor rejected the task");
    }

    // ===== cancel =====

    @Test
    void cancel_onlyRunningBatches() {
        hold(stored(BatchState.DRAFT));

        assertThatThrownBy(() -> orchestrator.cancelBatchInstall("b1"))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.BATCH_NOT_CANCELLABLE));
        assertThat(held.getState()).isEqualTo(BatchState.DRAFT);
        verify(activityLog, never()).log(anyString(), any(), any(), any(), anyString());
    }

    @Test
    void cancel_runningBatchRecordsActor() {
        BatchRequest running = stored(BatchState.IN_PROGRESS);
        running.setActualStart(LocalDateTime.now().minusMinutes(2));
        hold(running);

        BatchAckResponse ack = orchestrator.cancelBatchInstall("b1");

        assertThat(ack.getState()).isEqualTo(BatchState.CANCELLED);
        assertThat(held.getDurationSeconds()).isGreaterThanOrEqualTo(119L);
        verify(store).transitionItems(eq("b1"), eq(java.util.EnumSet.of(ItemState.QUEUED, ItemState.INSTALLING)), any());
        verify(activityLog).log("b1", null, ActivityType.WARNING, ActivityPhase.INSTALLATION,
                "Batch installation cancelled by alice");
    }

    // ===== queries =====

    @Test
    void getBatchStatus_toleratesUnreadableHandle() {
        BatchRequest running = stored(BatchState.IN_PROGRESS);
        running.setProgressHandle("pw-1");
        hold(running);
        when(installer.readHandle("pw-1")).thenThrow(new AppException(ErrorCode.INSTALLER_UNAVAILABLE, "down"));

        BatchStatusResponse status = orchestrator.getBatchStatus("b1");

        assertThat(status.getRequest().getId()).isEqualTo("b1");
        assertThat(status.getProgressHandle()).isNull();
    }

    @Test
    void listHistory_pagesAreOneBased() {
        when(store.history(isNull(), any())).thenAnswer(inv -> {
            Pageable p = inv.getArgument(1);
            return new PageImpl<>(List.of(stored(BatchState.COMPLETED)), p, 11);
        });

        PagedResponse<BatchRequestResponse> page = orchestrator.listHistory(null, 2, 10);

        verify(store).history(null, PageRequest.of(1, 10));
        assertThat(page.getPage()).isEqualTo(2);
        assertThat(page.getTotalPages()).isEqualTo(2);
        assertThat(page.getData()).hasSize(1);
    }

    @Test
    void activityFeedOfUnknownBatchIsNotFound() {
        when(store.getRequest("nope")).thenThrow(new AppException(ErrorCode.BATCH_NOT_FOUND, "nope"));

        assertThatThrownBy(() -> orchestrator.getActivityFeed("nope", null, null, null))
                .satisfies(e -> assertThat(((AppException) e).getType()).isEqualTo(ErrorType.NOT_FOUND));
        verifyNoInteractions(activityLog);
    }
}
