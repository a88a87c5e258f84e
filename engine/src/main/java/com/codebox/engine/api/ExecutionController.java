package com.codebox.engine.api;

import com.codebox.engine.api.dto.ExecutionRecordResponse;
import com.codebox.engine.api.dto.SubmitExecutionRequest;
import com.codebox.engine.model.ExecutionResult;
import com.codebox.engine.model.Language;
import com.codebox.engine.service.CancelOutcome;
import com.codebox.engine.service.CapacityExceededException;
import com.codebox.engine.service.ExecutionLedger;
import com.codebox.engine.service.ExecutionOrchestrator;
import com.codebox.engine.service.InvalidRequestException;
import com.codebox.engine.template.TemplateAccessDeniedException;
import com.codebox.engine.template.TemplateNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for code execution.
 *
 * POST   /executions                      - submit and wait for the result
 * DELETE /executions/{id}?caller_id=      - cancel an in-flight tracked execution
 * GET    /executions/{id}?caller_id=      - one ledger entry
 * GET    /executions?caller_id=&language=&limit= - newest-first ledger history
 *
 * Every outcome of running the code, including validator rejection and
 * timeouts, is HTTP 200 with the status in the body. Only submissions that
 * never ran get another HTTP status, with the same flat body shape.
 */
@RestController
@RequestMapping("/executions")
public class ExecutionController {

    private final ExecutionOrchestrator orchestrator;
    private final ExecutionLedger       ledger;

    public ExecutionController(ExecutionOrchestrator orchestrator, ExecutionLedger ledger) {
        this.orchestrator = orchestrator;
        this.ledger       = ledger;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/executions \
     *     -H "Content-Type: application/json" \
     *     -d '{"source_text":"print(1+1)","language":"general_purpose","mode":"quick"}'
     */
    @PostMapping
    public ResponseEntity<ExecutionResult> submit(@RequestBody SubmitExecutionRequest req) {
        try {
            return ResponseEntity.ok(orchestrator.submit(req));
        } catch (InvalidRequestException e) {
            return ResponseEntity.badRequest().body(ExecutionResult.invalidRequest(e.getMessage()));
        } catch (CapacityExceededException e) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(ExecutionResult.capacityExceeded(req.submissionId(), "engine at capacity, retry later"));
        } catch (TemplateNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ExecutionResult.invalidRequest(e.getMessage()));
        } catch (TemplateAccessDeniedException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ExecutionResult.invalidRequest(e.getMessage()));
        }
    }

    /**
     * HTTP 202 - cancellation requested, the submit call will return status cancelled
     * HTTP 403 - the execution belongs to another caller
     * HTTP 404 - nothing in flight under this id
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable UUID id,
                                                      @RequestParam("caller_id") String callerId) {
        CancelOutcome outcome = orchestrator.cancel(id, callerId);
        return switch (outcome) {
            case CANCEL_REQUESTED -> ResponseEntity.accepted()
                    .body(Map.of("execution_id", id, "status", "cancel_requested"));
            case FORBIDDEN -> throw new ResponseStatusException(HttpStatus.FORBIDDEN,
                    "Execution " + id + " belongs to another caller");
            case NOT_RUNNING -> throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "No running execution " + id);
        };
    }

    @GetMapping("/{id}")
    public ExecutionRecordResponse get(@PathVariable UUID id,
                                       @RequestParam("caller_id") String callerId) {
        return ledger.find(id, callerId)
                .map(ExecutionRecordResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Execution not found: " + id));
    }

    @GetMapping
    public List<ExecutionRecordResponse> history(@RequestParam("caller_id") String callerId,
                                                 @RequestParam(required = false) String language,
                                                 @RequestParam(required = false) Integer limit) {
        Language filter = null;
        if (language != null && !language.isBlank()) {
            filter = Language.parse(language).orElseThrow(() ->
                    new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown language: " + language));
        }
        return ledger.history(callerId, filter, limit).stream()
                .map(ExecutionRecordResponse::from)
                .toList();
    }
}
