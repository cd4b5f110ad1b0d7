package com.largomodo.imagebatch.core.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller input for creating a batch operation.
 * <p>
 * Compact constructor enforces the synchronous validation rules (non-blank name,
 * parallelism of at least one) so invalid requests never reach the store.
 *
 * @param name                  display name, must not be blank
 * @param description           free-form description
 * @param type                  per-image operation to run
 * @param targetImages          target images in processing-candidate order
 * @param configuration         opaque payload forwarded to the executor
 * @param templateId            optional template identifier, forwarded
 * @param profileId             optional profile identifier, forwarded
 * @param priority              advisory ordering hint for queries
 * @param maxParallelOperations upper bound on concurrently running images, at least 1
 * @param continueOnError       false aborts remaining fan-out on the first image failure
 * @param startImmediately      start the operation as part of creation
 * @param tags                  free-form labels
 * @param createdBy             creator, defaults to the {@code user.name} system property
 */
public record CreateOperationRequest(String name,
                                     String description,
                                     OperationType type,
                                     List<TargetImage> targetImages,
                                     Map<String, Object> configuration,
                                     String templateId,
                                     String profileId,
                                     int priority,
                                     int maxParallelOperations,
                                     boolean continueOnError,
                                     boolean startImmediately,
                                     List<String> tags,
                                     String createdBy) {

    public CreateOperationRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (maxParallelOperations < 1) {
            throw new IllegalArgumentException(
                    "maxParallelOperations must be at least 1, got: " + maxParallelOperations);
        }
        description = description == null ? "" : description;
        targetImages = targetImages == null ? List.of() : List.copyOf(targetImages);
        configuration = configuration == null ? Map.of() : configuration;
        tags = tags == null ? List.of() : List.copyOf(tags);
        createdBy = createdBy == null || createdBy.isBlank() ? System.getProperty("user.name", "") : createdBy;
    }

    public static Builder builder(String name, OperationType type) {
        return new Builder(name, type);
    }

    /**
     * Fluent builder; defaults mirror {@link BatchOperation}.
     */
    public static final class Builder {
        private final String name;
        private final OperationType type;
        private final List<TargetImage> images = new ArrayList<>();
        private final Map<String, Object> configuration = new LinkedHashMap<>();
        private final List<String> tags = new ArrayList<>();
        private String description = "";
        private String templateId;
        private String profileId;
        private int priority = BatchOperation.DEFAULT_PRIORITY;
        private int maxParallelOperations = BatchOperation.DEFAULT_MAX_PARALLEL;
        private boolean continueOnError = true;
        private boolean startImmediately;
        private String createdBy;

        private Builder(String name, OperationType type) {
            this.name = name;
            this.type = type;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder image(String imagePath) {
            images.add(new TargetImage(imagePath));
            return this;
        }

        public Builder image(String imagePath, int imageIndex) {
            images.add(new TargetImage(imagePath, imageIndex));
            return this;
        }

        public Builder images(List<String> imagePaths) {
            imagePaths.forEach(this::image);
            return this;
        }

        public Builder configuration(String key, Object value) {
            configuration.put(key, value);
            return this;
        }

        public Builder configuration(Map<String, Object> values) {
            configuration.putAll(values);
            return this;
        }

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder profileId(String profileId) {
            this.profileId = profileId;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxParallelOperations(int maxParallelOperations) {
            this.maxParallelOperations = maxParallelOperations;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder startImmediately(boolean startImmediately) {
            this.startImmediately = startImmediately;
            return this;
        }

        public Builder tag(String tag) {
            tags.add(tag);
            return this;
        }

        public Builder tags(List<String> values) {
            tags.addAll(values);
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public CreateOperationRequest build() {
            return new CreateOperationRequest(name, description, type, images, new LinkedHashMap<>(configuration),
                    templateId, profileId, priority, maxParallelOperations, continueOnError, startImmediately,
                    tags, createdBy);
        }
    }
}
