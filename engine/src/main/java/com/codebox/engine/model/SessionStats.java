package com.codebox.engine.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Rolling per-caller aggregate over tracked executions.
 *
 * Updated in the same transaction as the ledger insert, under the caller's
 * lock (see ExecutionLedger), so the counters never lose an update.
 *
 * DB table: session_stats  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "session_stats")
public class SessionStats {

    @Id
    @Column(name = "caller_id")
    private String callerId;

    @Column(name = "total_attempts", nullable = false)
    private long totalAttempts = 0;

    @Column(name = "total_successes", nullable = false)
    private long totalSuccesses = 0;

    @Column(name = "total_failures", nullable = false)
    private long totalFailures = 0;

    // Sum of wall_clock_ms over all attempts; the average is derived from it.
    @Column(name = "total_wall_clock_ms", nullable = false)
    private long totalWallClockMs = 0;

    @Column(name = "first_execution_at", nullable = false)
    private Instant firstExecutionAt;

    @Column(name = "last_execution_at", nullable = false)
    private Instant lastExecutionAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected SessionStats() {}   // required by JPA

    public SessionStats(String callerId) {
        this.callerId         = callerId;
        this.firstExecutionAt = Instant.now();
        this.lastExecutionAt  = this.firstExecutionAt;
    }

    // ------------------------------------------------------------------
    // Mutation
    // ------------------------------------------------------------------

    /** Fold one finished attempt into the aggregate. */
    public void recordAttempt(ExecutionResult result) {
        if (totalAttempts == 0) {
            firstExecutionAt = result.createdAt();
        }
        totalAttempts++;
        if (result.success()) {
            totalSuccesses++;
        } else {
            totalFailures++;
        }
        totalWallClockMs += result.wallClockMs();
        if (lastExecutionAt == null || result.createdAt().isAfter(lastExecutionAt)) {
            lastExecutionAt = result.createdAt();
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String  getCallerId()         { return callerId; }
    public long    getTotalAttempts()    { return totalAttempts; }
    public long    getTotalSuccesses()   { return totalSuccesses; }
    public long    getTotalFailures()    { return totalFailures; }
    public long    getTotalWallClockMs() { return totalWallClockMs; }
    public Instant getFirstExecutionAt() { return firstExecutionAt; }
    public Instant getLastExecutionAt()  { return lastExecutionAt; }

    public double getAverageWallClockMs() {
        return totalAttempts == 0 ? 0.0 : (double) totalWallClockMs / totalAttempts;
    }

    /** Percentage of attempts that finished with status SUCCESS. */
    public double getSuccessRate() {
        return totalAttempts == 0 ? 0.0 : totalSuccesses * 100.0 / totalAttempts;
    }
}
