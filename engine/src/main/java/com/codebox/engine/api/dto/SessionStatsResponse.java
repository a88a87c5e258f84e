package com.codebox.engine.api.dto;

import com.codebox.engine.model.SessionStats;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record SessionStatsResponse(
        String     callerId,
        long       totalAttempts,
        long       totalSuccesses,
        long       totalFailures,
        double     averageWallClockMs,
        double     successRate,
        Instant    firstExecutionAt,
        Instant    lastExecutionAt,
        List<UUID> runningExecutions) {

    public static SessionStatsResponse from(SessionStats s, List<UUID> running) {
        return new SessionStatsResponse(
                s.getCallerId(),
                s.getTotalAttempts(),
                s.getTotalSuccesses(),
                s.getTotalFailures(),
                s.getAverageWallClockMs(),
                s.getSuccessRate(),
                s.getFirstExecutionAt(),
                s.getLastExecutionAt(),
                running);
    }
}
