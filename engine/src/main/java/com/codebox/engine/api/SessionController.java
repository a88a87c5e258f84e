package com.codebox.engine.api;

import com.codebox.engine.api.dto.SessionStatsResponse;
import com.codebox.engine.service.ExecutionLedger;
import com.codebox.engine.service.ExecutionOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * GET /sessions/{callerId} - aggregate stats over the caller's tracked
 * executions, plus the ids still in flight. 404 before the first tracked run.
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final ExecutionLedger       ledger;
    private final ExecutionOrchestrator orchestrator;

    public SessionController(ExecutionLedger ledger, ExecutionOrchestrator orchestrator) {
        this.ledger       = ledger;
        this.orchestrator = orchestrator;
    }

    @GetMapping("/{callerId}")
    public SessionStatsResponse get(@PathVariable String callerId) {
        return ledger.stats(callerId)
                .map(s -> SessionStatsResponse.from(s, orchestrator.runningExecutions(callerId)))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No tracked executions for caller " + callerId));
    }
}
