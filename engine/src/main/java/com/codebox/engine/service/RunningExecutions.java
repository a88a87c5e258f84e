package com.codebox.engine.service;

import com.codebox.engine.sandbox.Cancellation;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of tracked executions between dispatch and completion, keyed by
 * execution id. Entries are removed by the submitting thread in a finally
 * block, so a finished execution can never be cancelled.
 */
@Component
public class RunningExecutions {

    public record Entry(String callerId, Cancellation cancellation) {}

    private final Map<UUID, Entry> running = new ConcurrentHashMap<>();

    /** @return false if an execution with this id is already in flight */
    boolean register(UUID executionId, String callerId, Cancellation cancellation) {
        return running.putIfAbsent(executionId, new Entry(callerId, cancellation)) == null;
    }

    void remove(UUID executionId) {
        running.remove(executionId);
    }

    Optional<Entry> get(UUID executionId) {
        return Optional.ofNullable(running.get(executionId));
    }

    public List<UUID> idsFor(String callerId) {
        return running.entrySet().stream()
                .filter(e -> e.getValue().callerId().equals(callerId))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public int size() {
        return running.size();
    }
}
