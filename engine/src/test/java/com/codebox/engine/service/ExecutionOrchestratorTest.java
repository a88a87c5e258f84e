package com.codebox.engine.service;

import com.codebox.engine.api.dto.SubmitExecutionRequest;
import com.codebox.engine.config.CodeboxProperties;
import com.codebox.engine.model.CodeTemplate;
import com.codebox.engine.model.ExecutionRequest;
import com.codebox.engine.model.ExecutionResult;
import com.codebox.engine.model.ExecutionStatus;
import com.codebox.engine.model.Language;
import com.codebox.engine.model.TemplateVisibility;
import com.codebox.engine.policy.PolicyStore;
import com.codebox.engine.policy.SecurityPolicy;
import com.codebox.engine.sandbox.Cancellation;
import com.codebox.engine.sandbox.SandboxExecutor;
import com.codebox.engine.template.TemplateAccessDeniedException;
import com.codebox.engine.template.TemplateCatalog;
import com.codebox.engine.validation.StaticValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExecutionOrchestrator.
 *
 * The sandbox, ledger and template catalog are mocked; validation and the
 * worker pool are real, so rejection and capacity behaviour are exercised
 * as they run in production.
 */
@ExtendWith(MockitoExtension.class)
class ExecutionOrchestratorTest {

    @Mock PolicyStore     policyStore;
    @Mock SandboxExecutor executor;
    @Mock ExecutionLedger ledger;
    @Mock TemplateCatalog templates;

    SimpleMeterRegistry meters;
    ExecutionWorkerPool pool;
    RunningExecutions   running;
    ExecutionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        lenient().when(policyStore.current()).thenReturn(SecurityPolicy.defaults());
        meters  = new SimpleMeterRegistry();
        running = new RunningExecutions();
        pool    = pool(2, 2);
        orchestrator = new ExecutionOrchestrator(policyStore, new StaticValidator(), executor,
                pool, ledger, templates, running, meters);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    // ------------------------------------------------------------------
    // Happy paths
    // ------------------------------------------------------------------

    @Test
    void quick_cleanSource_executedAndNotRecorded() {
        when(executor.execute(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));

        ExecutionResult result = orchestrator.submit(submit("print(1)", "general_purpose", "quick", null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
        verify(executor).execute(any(), eq(SecurityPolicy.defaults()), any());
        verifyNoInteractions(ledger);
        assertThat(meters.counter("codebox.executions",
                "language", "general_purpose", "status", "success", "mode", "quick").count()).isEqualTo(1.0);
    }

    @Test
    void tracked_cleanSource_recordedInLedger() {
        when(executor.execute(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));

        ExecutionResult result = orchestrator.submit(submit("print(1)", "python", "tracked", "alice"));

        ArgumentCaptor<ExecutionRequest> req = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(ledger).record(req.capture(), eq(result));
        assertThat(req.getValue().callerId()).isEqualTo("alice");
        assertThat(req.getValue().language()).isEqualTo(Language.GENERAL_PURPOSE);
        assertThat(running.size()).isZero();
    }

    @Test
    void trackedRun_staysRegisteredUntilLedgerRowIsWritten() {
        UUID id = UUID.randomUUID();
        when(executor.execute(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));
        doAnswer(inv -> {
            assertThat(orchestrator.runningExecutions("alice")).containsExactly(id);
            assertThatThrownBy(() -> orchestrator.submit(new SubmitExecutionRequest(
                    "print(2)", "python", "tracked", "alice", null, id, null)))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessageContaining("already running");
            return null;
        }).when(ledger).record(any(), any());

        orchestrator.submit(new SubmitExecutionRequest("print(1)", "python", "tracked", "alice", null, id, null));

        verify(ledger, times(1)).record(any(), any());
        verify(executor, times(1)).execute(any(), any(), any());
        assertThat(running.size()).isZero();
    }

    @Test
    void submissionId_becomesExecutionId() {
        UUID chosen = UUID.randomUUID();
        when(executor.execute(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));

        ExecutionResult result = orchestrator.submit(new SubmitExecutionRequest(
                "print(1)", "general_purpose", "quick", null, null, chosen, null));

        assertThat(result.executionId()).isEqualTo(chosen);
    }

    // ------------------------------------------------------------------
    // Rejections never spawn
    // ------------------------------------------------------------------

    @Test
    void forbiddenImport_rejectedWithoutSpawn_andStillRecordedWhenTracked() {
        ExecutionResult result = orchestrator.submit(submit("import os\nos.listdir('.')", "general_purpose", "tracked", "bob"));

        assertThat(result.status()).isEqualTo(ExecutionStatus.REJECTED_BY_VALIDATOR);
        assertThat(result.reason()).isEqualTo("forbidden_construct(os)");
        assertThat(result.exitCode()).isNull();
        verifyNoInteractions(executor);
        verify(ledger).record(any(), eq(result));
    }

    @Test
    void disabledLanguage_rejectedWithoutSpawn() {
        when(policyStore.current()).thenReturn(new SecurityPolicy(30, 1 << 20, 1024, 1024,
                Set.of(), Set.of(), false, EnumSet.of(Language.GENERAL_PURPOSE)));

        ExecutionResult result = orchestrator.submit(submit("with entry { print(1); }", "dsl", "quick", null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.REJECTED_BY_VALIDATOR);
        assertThat(result.reason()).isEqualTo("language_disabled");
        verifyNoInteractions(executor);
    }

    // ------------------------------------------------------------------
    // Invalid requests
    // ------------------------------------------------------------------

    @Test
    void unknownLanguage_invalidRequest() {
        assertThatThrownBy(() -> orchestrator.submit(submit("x", "cobol", "quick", null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("cobol");
    }

    @Test
    void missingMode_invalidRequest() {
        assertThatThrownBy(() -> orchestrator.submit(submit("x", "python", null, null)))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void trackedWithoutCaller_invalidRequest() {
        assertThatThrownBy(() -> orchestrator.submit(submit("print(1)", "python", "tracked", " ")))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("caller_id");
        verifyNoInteractions(executor, ledger);
    }

    @Test
    void noSourceAndNoTemplate_invalidRequest() {
        assertThatThrownBy(() -> orchestrator.submit(submit("  ", "python", "quick", null)))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void reusedSubmissionId_invalidRequest() {
        UUID used = UUID.randomUUID();
        when(ledger.exists(used)).thenReturn(true);

        assertThatThrownBy(() -> orchestrator.submit(new SubmitExecutionRequest(
                "print(1)", "python", "tracked", "alice", null, used, null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("already used");
        verifyNoInteractions(executor);
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    @Test
    void templateRef_withoutSource_runsTemplateSource() {
        UUID templateId = UUID.randomUUID();
        CodeTemplate template = new CodeTemplate("hello", Language.DSL,
                "with entry { print(\"hi\"); }", TemplateVisibility.PUBLIC, "instructor-1");
        when(templates.fetch(templateId, "alice")).thenReturn(template);
        when(executor.execute(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));

        orchestrator.submit(new SubmitExecutionRequest(null, null, "quick", "alice", templateId, null, null));

        ArgumentCaptor<ExecutionRequest> req = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(executor).execute(req.capture(), any(), any());
        assertThat(req.getValue().language()).isEqualTo(Language.DSL);
        assertThat(req.getValue().sourceText()).contains("print(\"hi\")");
        assertThat(req.getValue().templateRef()).isEqualTo(templateId);
    }

    @Test
    void privateTemplateOfAnotherCaller_propagatesAccessDenied() {
        UUID templateId = UUID.randomUUID();
        when(templates.fetch(templateId, "mallory"))
                .thenThrow(new TemplateAccessDeniedException(templateId, "mallory"));

        assertThatThrownBy(() -> orchestrator.submit(
                new SubmitExecutionRequest("", "python", "quick", "mallory", templateId, null, null)))
                .isInstanceOf(TemplateAccessDeniedException.class);
        verifyNoInteractions(executor);
    }

    // ------------------------------------------------------------------
    // Failure handling
    // ------------------------------------------------------------------

    @Test
    void ledgerFailure_resultStillReturned() {
        when(executor.execute(any(), any(), any())).thenAnswer(inv -> success(inv.getArgument(0)));
        doThrow(new DataAccessResourceFailureException("db down")).when(ledger).record(any(), any());

        ExecutionResult result = orchestrator.submit(submit("print(1)", "python", "tracked", "alice"));

        assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
    }

    @Test
    void executorThrows_internalError() {
        when(executor.execute(any(), any(), any())).thenThrow(new IllegalStateException("bug"));

        ExecutionResult result = orchestrator.submit(submit("print(1)", "python", "quick", null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.INTERNAL_ERROR);
        assertThat(result.reason()).doesNotContain("bug");
    }

    // ------------------------------------------------------------------
    // Capacity and cancellation
    // ------------------------------------------------------------------

    @Test
    void fullPoolAndQueue_capacityExceeded() throws Exception {
        pool.shutdown();
        pool = pool(1, 1);
        orchestrator = new ExecutionOrchestrator(policyStore, new StaticValidator(), executor,
                pool, ledger, templates, running, meters);

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(executor.execute(any(), any(), any())).thenAnswer(inv -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return success(inv.getArgument(0));
        });

        CompletableFuture<ExecutionResult> first  = CompletableFuture.supplyAsync(
                () -> orchestrator.submit(submit("print(1)", "python", "quick", null)));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<ExecutionResult> second = CompletableFuture.supplyAsync(
                () -> orchestrator.submit(submit("print(2)", "python", "quick", null)));
        await().atMost(5, TimeUnit.SECONDS).until(() -> pool.queuedCount() == 1);

        assertThatThrownBy(() -> orchestrator.submit(submit("print(3)", "python", "quick", null)))
                .isInstanceOf(CapacityExceededException.class);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(second.get(5, TimeUnit.SECONDS).status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(meters.counter("codebox.executions",
                "language", "general_purpose", "status", "capacity_exceeded", "mode", "quick").count())
                .isEqualTo(1.0);
    }

    @Test
    void cancel_trackedExecution_byOwner() throws Exception {
        UUID id = UUID.randomUUID();
        CountDownLatch started = new CountDownLatch(1);
        when(executor.execute(any(), any(), any())).thenAnswer(inv -> {
            ExecutionRequest req = inv.getArgument(0);
            Cancellation c = inv.getArgument(2);
            started.countDown();
            await().atMost(5, TimeUnit.SECONDS).until(c::isCancelled);
            return new ExecutionResult(req.executionId(), ExecutionStatus.CANCELLED, "cancelled by caller",
                    "", false, "", false, 143, 50L, null, Instant.now());
        });

        CompletableFuture<ExecutionResult> run = CompletableFuture.supplyAsync(() -> orchestrator.submit(
                new SubmitExecutionRequest("print(1)", "python", "tracked", "alice", null, id, null)));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(orchestrator.runningExecutions("alice")).containsExactly(id);
        assertThat(orchestrator.cancel(id, "bob")).isEqualTo(CancelOutcome.FORBIDDEN);
        assertThat(orchestrator.cancel(id, "alice")).isEqualTo(CancelOutcome.CANCEL_REQUESTED);

        assertThat(run.get(5, TimeUnit.SECONDS).status()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(orchestrator.cancel(id, "alice")).isEqualTo(CancelOutcome.NOT_RUNNING);
        assertThat(orchestrator.runningExecutions("alice")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ExecutionWorkerPool pool(int workers, int queue) {
        CodeboxProperties props = new CodeboxProperties();
        props.getPool().setWorkers(workers);
        props.getPool().setQueueCapacity(queue);
        return new ExecutionWorkerPool(props, new SimpleMeterRegistry());
    }

    private static SubmitExecutionRequest submit(String source, String language, String mode, String caller) {
        return new SubmitExecutionRequest(source, language, mode, caller, null, null, null);
    }

    private static ExecutionResult success(ExecutionRequest req) {
        return new ExecutionResult(req.executionId(), ExecutionStatus.SUCCESS, null,
                "1\n", false, "", false, 0, 12L, 4_000_000L, Instant.now());
    }
}
