package com.codebox.engine.service;

public enum CancelOutcome {
    /** The execution was in flight; its process tree is being torn down. */
    CANCEL_REQUESTED,
    /** Unknown id, already finished, or a quick execution. */
    NOT_RUNNING,
    /** The execution belongs to another caller. */
    FORBIDDEN
}
