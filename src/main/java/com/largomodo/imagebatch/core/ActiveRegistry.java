package com.largomodo.imagebatch.core;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide table of operations that are QUEUED, RUNNING or PAUSED.
 * <p>
 * Lets pause/resume/cancel reach an in-flight operation without re-reading
 * storage and blocks deletion of running work. Safe for concurrent use by any
 * number of drivers and callers.
 */
public final class ActiveRegistry {

    private final ConcurrentMap<String, OperationRun> runs = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the id is already registered
     */
    public void register(OperationRun run) {
        OperationRun previous = runs.putIfAbsent(run.id(), run);
        if (previous != null) {
            throw new IllegalStateException("Operation " + run.id() + " is already active");
        }
    }

    public Optional<OperationRun> get(String operationId) {
        return Optional.ofNullable(runs.get(operationId));
    }

    /**
     * @return true if the id was registered
     */
    public boolean unregister(String operationId) {
        return runs.remove(operationId) != null;
    }

    public boolean isActive(String operationId) {
        return runs.containsKey(operationId);
    }

    public List<String> listActive() {
        return runs.keySet().stream().sorted().toList();
    }

    public List<OperationRun> runs() {
        return runs.values().stream()
                .sorted(Comparator.comparing(OperationRun::id))
                .toList();
    }

    public int size() {
        return runs.size();
    }
}
