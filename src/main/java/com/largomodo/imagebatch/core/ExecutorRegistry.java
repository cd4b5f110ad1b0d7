package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.OperationType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each operation type to the executor that processes its images.
 * <p>
 * Resolved once when an operation is created (unknown types are rejected) and
 * once per run by the driver, never per image.
 */
public final class ExecutorRegistry {

    private final Map<OperationType, ImageOperationExecutor> executors;

    private ExecutorRegistry(Map<OperationType, ImageOperationExecutor> executors) {
        this.executors = executors;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ImageOperationExecutor> find(OperationType type) {
        return Optional.ofNullable(executors.get(type));
    }

    /**
     * @throws IllegalArgumentException if no executor is registered for {@code type}
     */
    public ImageOperationExecutor resolve(OperationType type) {
        ImageOperationExecutor executor = executors.get(type);
        if (executor == null) {
            throw new IllegalArgumentException("No executor registered for operation type " + type
                    + ". Supported: " + executors.keySet());
        }
        return executor;
    }

    public Set<OperationType> supportedTypes() {
        return Set.copyOf(executors.keySet());
    }

    public static final class Builder {
        private final Map<OperationType, ImageOperationExecutor> executors = new EnumMap<>(OperationType.class);

        public Builder register(OperationType type, ImageOperationExecutor executor) {
            if (executor == null) {
                throw new IllegalArgumentException("executor must not be null for " + type);
            }
            executors.put(type, executor);
            return this;
        }

        public ExecutorRegistry build() {
            return new ExecutorRegistry(new EnumMap<>(executors));
        }
    }
}
