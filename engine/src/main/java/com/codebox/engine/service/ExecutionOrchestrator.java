package com.codebox.engine.service;

import com.codebox.engine.api.dto.SubmitExecutionRequest;
import com.codebox.engine.model.CodeTemplate;
import com.codebox.engine.model.ExecutionMode;
import com.codebox.engine.model.ExecutionRequest;
import com.codebox.engine.model.ExecutionResult;
import com.codebox.engine.model.ExecutionStatus;
import com.codebox.engine.model.Language;
import com.codebox.engine.policy.PolicyStore;
import com.codebox.engine.policy.SecurityPolicy;
import com.codebox.engine.sandbox.Cancellation;
import com.codebox.engine.sandbox.SandboxExecutor;
import com.codebox.engine.template.TemplateCatalog;
import com.codebox.engine.validation.StaticValidator;
import com.codebox.engine.validation.ValidationOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Entry point for every submission.
 *
 * Flow per call:
 *  1. Build an {@link ExecutionRequest} from caller input (resolving a
 *     template when only a templateRef is given)
 *  2. Snapshot the active policy once; the whole call uses that snapshot
 *  3. Static validation; a rejection never spawns a process
 *  4. Run in the bounded worker pool; a full pool is capacity_exceeded
 *  5. Tracked mode: record in the ledger (attempts include rejections)
 *     before the id leaves the running set
 *
 * The wall-clock limit starts when a worker spawns the process, so a
 * submission that waited in the queue returns later than
 * max_wall_clock_seconds after the call. A submission that finds the
 * queue full is refused instead of waiting.
 *
 * Every outcome of the submitted code is a returned {@link ExecutionResult}.
 * Exceptions are reserved for requests that were never executed:
 * {@link InvalidRequestException}, {@link CapacityExceededException} and the
 * template exceptions.
 */
@Service
public class ExecutionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    private static final String INTERNAL_REASON = "the execution could not be completed";

    private final PolicyStore         policyStore;
    private final StaticValidator     validator;
    private final SandboxExecutor     executor;
    private final ExecutionWorkerPool pool;
    private final ExecutionLedger     ledger;
    private final TemplateCatalog     templates;
    private final RunningExecutions   running;
    private final MeterRegistry       meterRegistry;

    public ExecutionOrchestrator(PolicyStore policyStore,
                                 StaticValidator validator,
                                 SandboxExecutor executor,
                                 ExecutionWorkerPool pool,
                                 ExecutionLedger ledger,
                                 TemplateCatalog templates,
                                 RunningExecutions running,
                                 MeterRegistry meterRegistry) {
        this.policyStore   = policyStore;
        this.validator     = validator;
        this.executor      = executor;
        this.pool          = pool;
        this.ledger        = ledger;
        this.templates     = templates;
        this.running       = running;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * @throws InvalidRequestException       malformed submission
     * @throws CapacityExceededException     worker pool and queue are full
     * @throws com.codebox.engine.template.TemplateNotFoundException     templateRef unknown
     * @throws com.codebox.engine.template.TemplateAccessDeniedException templateRef not visible to the caller
     */
    public ExecutionResult submit(SubmitExecutionRequest raw) {
        ExecutionRequest request = buildRequest(raw);
        SecurityPolicy policy = policyStore.current();

        MDC.put("executionId", request.executionId().toString());
        if (request.callerId() != null) MDC.put("callerId", request.callerId());
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = ExecutionStatus.INTERNAL_ERROR.wireName();
        try {
            ExecutionResult result;
            ValidationOutcome outcome = validator.validate(request, policy);
            if (!outcome.accepted()) {
                log.info("Rejected {} submission: {}", request.language().wireName(), outcome.reasonText());
                result = ExecutionResult.rejected(request.executionId(), outcome.reasonText());
                if (request.tracked()) {
                    recordQuietly(request, result);
                }
            } else {
                result = runIsolated(request, policy);
            }
            status = result.status().wireName();

            log.info("Execution finished: status={} wallClockMs={} mode={}",
                    status, result.wallClockMs(), request.mode().wireName());
            return result;
        } catch (InvalidRequestException e) {
            status = ExecutionStatus.INVALID_REQUEST.wireName();
            throw e;
        } catch (CapacityExceededException e) {
            status = ExecutionStatus.CAPACITY_EXCEEDED.wireName();
            log.warn("Refused submission: {}", e.getMessage());
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("codebox.execution.duration",
                    "language", request.language().wireName()));
            meterRegistry.counter("codebox.executions",
                    "language", request.language().wireName(),
                    "status",   status,
                    "mode",     request.mode().wireName()).increment();
            MDC.remove("executionId");
            MDC.remove("callerId");
        }
    }

    private ExecutionResult runIsolated(ExecutionRequest request, SecurityPolicy policy) {
        Cancellation cancellation = new Cancellation();
        if (request.tracked()
                && !running.register(request.executionId(), request.callerId(), cancellation)) {
            throw new InvalidRequestException("submission_id " + request.executionId() + " is already running");
        }
        try {
            Future<ExecutionResult> future = pool.submit(() -> {
                if (cancellation.isCancelled()) {
                    return ExecutionResult.cancelled(request.executionId());
                }
                return executor.execute(request, policy, cancellation);
            });
            ExecutionResult result = await(future, request, cancellation);
            // The id stays registered until its ledger row exists, so a reused
            // submission_id is refused by one check or the other.
            if (request.tracked()) {
                recordQuietly(request, result);
            }
            return result;
        } finally {
            if (request.tracked()) {
                running.remove(request.executionId());
            }
        }
    }

    private static ExecutionResult await(Future<ExecutionResult> future, ExecutionRequest request,
                                         Cancellation cancellation) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            // The calling thread is going away; stop the run instead of leaving it unattended.
            cancellation.cancel();
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for execution {}", request.executionId());
            return ExecutionResult.internalError(request.executionId(), INTERNAL_REASON, 0L);
        } catch (ExecutionException e) {
            log.error("Execution {} failed in the worker", request.executionId(), e.getCause());
            return ExecutionResult.internalError(request.executionId(), INTERNAL_REASON, 0L);
        }
    }

    private void recordQuietly(ExecutionRequest request, ExecutionResult result) {
        try {
            ledger.record(request, result);
        } catch (RuntimeException e) {
            // The caller still gets the result; the attempt is missing from the ledger.
            log.error("Could not record execution {} for caller {}",
                    request.executionId(), request.callerId(), e);
        }
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /** Cancel an in-flight tracked execution owned by {@code callerId}. */
    public CancelOutcome cancel(UUID executionId, String callerId) {
        return running.get(executionId)
                .map(entry -> {
                    if (!entry.callerId().equals(callerId)) {
                        log.warn("Caller {} tried to cancel execution {} owned by another caller",
                                callerId, executionId);
                        return CancelOutcome.FORBIDDEN;
                    }
                    entry.cancellation().cancel();
                    log.info("Cancellation requested for execution {}", executionId);
                    return CancelOutcome.CANCEL_REQUESTED;
                })
                .orElse(CancelOutcome.NOT_RUNNING);
    }

    /** Ids of the caller's tracked executions that are queued or running. */
    public List<UUID> runningExecutions(String callerId) {
        return running.idsFor(callerId);
    }

    // ------------------------------------------------------------------
    // Request construction
    // ------------------------------------------------------------------

    ExecutionRequest buildRequest(SubmitExecutionRequest raw) {
        if (raw == null) {
            throw new InvalidRequestException("request body is required");
        }
        ExecutionMode mode = ExecutionMode.parse(raw.mode())
                .orElseThrow(() -> new InvalidRequestException(
                        "mode must be one of quick, tracked (got " + raw.mode() + ")"));
        String callerId = blankToNull(raw.callerId());
        if (mode == ExecutionMode.TRACKED && callerId == null) {
            throw new InvalidRequestException("caller_id is required for tracked executions");
        }
        Language language = raw.language() == null ? null
                : Language.parse(raw.language())
                        .orElseThrow(() -> new InvalidRequestException("unknown language: " + raw.language()));

        String source = raw.sourceText();
        if (source == null || source.isBlank()) {
            if (raw.templateRef() == null) {
                throw new InvalidRequestException("source_text or template_ref is required");
            }
            CodeTemplate template = templates.fetch(raw.templateRef(), callerId);
            if (language != null && language != template.getLanguage()) {
                throw new InvalidRequestException("template " + raw.templateRef() + " is "
                        + template.getLanguage().wireName() + ", not " + language.wireName());
            }
            source   = template.getSourceText();
            language = template.getLanguage();
        }
        if (language == null) {
            throw new InvalidRequestException("language is required");
        }

        UUID executionId = raw.submissionId() != null ? raw.submissionId() : UUID.randomUUID();
        if (raw.submissionId() != null && mode == ExecutionMode.TRACKED && ledger.exists(executionId)) {
            throw new InvalidRequestException("submission_id " + executionId + " was already used");
        }
        return new ExecutionRequest(executionId, source, language, mode, callerId, raw.templateRef(), raw.stdin());
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
