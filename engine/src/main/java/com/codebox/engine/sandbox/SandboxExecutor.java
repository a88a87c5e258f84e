package com.codebox.engine.sandbox;

import com.codebox.engine.model.ExecutionRequest;
import com.codebox.engine.model.ExecutionResult;
import com.codebox.engine.policy.SecurityPolicy;

/**
 * Runs one already-validated request in isolation and reports what happened.
 *
 * Implementations never throw for anything the submitted code does, nor for
 * their own infrastructure failures: every path ends in an
 * {@link ExecutionResult}, with status internal_error for the latter.
 */
public interface SandboxExecutor {

    /**
     * @param request      validated request
     * @param policy       snapshot taken by the caller at the start of the submission
     * @param cancellation handle through which the run can be cancelled while in flight
     */
    ExecutionResult execute(ExecutionRequest request, SecurityPolicy policy, Cancellation cancellation);

    default ExecutionResult execute(ExecutionRequest request, SecurityPolicy policy) {
        return execute(request, policy, Cancellation.none());
    }
}
