package com.codebox.engine.api.dto;

import java.util.UUID;

/**
 * Request body for POST /executions.
 *
 * Required: language, mode, and either sourceText or templateRef.
 * callerId is required for mode "tracked". submissionId lets the caller fix
 * the execution id up front so it can cancel the run while it is in flight.
 * language and mode stay strings here so that unknown values surface as
 * invalid_request rather than a JSON parse failure.
 */
public record SubmitExecutionRequest(String sourceText,
                                     String language,
                                     String mode,
                                     String callerId,
                                     UUID   templateRef,
                                     UUID   submissionId,
                                     String stdin) {
}
