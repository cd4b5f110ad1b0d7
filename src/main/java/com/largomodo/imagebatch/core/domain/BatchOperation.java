package com.largomodo.imagebatch.core.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persisted description of a batch job and its per-image sub-tasks.
 * <p>
 * Pure state, no behavior beyond copying. The whole document is the persistence
 * unit: every mutation is followed by a full re-serialization of the record.
 * Callers outside the engine only ever see copies.
 */
@JsonPropertyOrder({"id", "name", "description", "type", "status", "createdAt", "startedAt", "completedAt",
        "durationMs", "createdBy", "targetImages", "configuration", "templateId", "profileId", "priority",
        "maxParallelOperations", "continueOnError", "progressPercentage", "statusMessage", "summary",
        "errorMessage", "tags"})
public class BatchOperation {

    public static final int DEFAULT_PRIORITY = 5;
    public static final int DEFAULT_MAX_PARALLEL = 2;

    private String id = UUID.randomUUID().toString();
    private String name = "";
    private String description = "";
    private OperationType type = OperationType.CUSTOM;
    private OperationStatus status = OperationStatus.PENDING;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;
    private String createdBy = "";
    private List<TargetImage> targetImages = new ArrayList<>();
    private Map<String, Object> configuration = new LinkedHashMap<>();
    private String templateId;
    private String profileId;
    private int priority = DEFAULT_PRIORITY;
    private int maxParallelOperations = DEFAULT_MAX_PARALLEL;
    private boolean continueOnError = true;
    private int progressPercentage;
    private String statusMessage = "";
    private OperationSummary summary = new OperationSummary();
    private String errorMessage;
    private List<String> tags = new ArrayList<>();

    /**
     * Deep copy of the record. Configuration and metadata values are shared,
     * the engine never mutates them.
     */
    public BatchOperation copy() {
        BatchOperation copy = new BatchOperation();
        copy.id = id;
        copy.name = name;
        copy.description = description;
        copy.type = type;
        copy.status = status;
        copy.createdAt = createdAt;
        copy.startedAt = startedAt;
        copy.completedAt = completedAt;
        copy.durationMs = durationMs;
        copy.createdBy = createdBy;
        List<TargetImage> images = new ArrayList<>(targetImages.size());
        for (TargetImage image : targetImages) {
            images.add(image.copy());
        }
        copy.targetImages = images;
        copy.configuration = new LinkedHashMap<>(configuration);
        copy.templateId = templateId;
        copy.profileId = profileId;
        copy.priority = priority;
        copy.maxParallelOperations = maxParallelOperations;
        copy.continueOnError = continueOnError;
        copy.progressPercentage = progressPercentage;
        copy.statusMessage = statusMessage;
        copy.summary = summary.copy();
        copy.errorMessage = errorMessage;
        copy.tags = new ArrayList<>(tags);
        return copy;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public OperationType getType() {
        return type;
    }

    public void setType(OperationType type) {
        this.type = type;
    }

    public OperationStatus getStatus() {
        return status;
    }

    public void setStatus(OperationStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public List<TargetImage> getTargetImages() {
        return targetImages;
    }

    public void setTargetImages(List<TargetImage> targetImages) {
        this.targetImages = targetImages == null ? new ArrayList<>() : targetImages;
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    public void setConfiguration(Map<String, Object> configuration) {
        this.configuration = configuration == null ? new LinkedHashMap<>() : configuration;
    }

    public String getTemplateId() {
        return templateId;
    }

    public void setTemplateId(String templateId) {
        this.templateId = templateId;
    }

    public String getProfileId() {
        return profileId;
    }

    public void setProfileId(String profileId) {
        this.profileId = profileId;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public int getMaxParallelOperations() {
        return maxParallelOperations;
    }

    public void setMaxParallelOperations(int maxParallelOperations) {
        this.maxParallelOperations = maxParallelOperations;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public void setContinueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
    }

    public int getProgressPercentage() {
        return progressPercentage;
    }

    public void setProgressPercentage(int progressPercentage) {
        this.progressPercentage = progressPercentage;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public void setStatusMessage(String statusMessage) {
        this.statusMessage = statusMessage;
    }

    public OperationSummary getSummary() {
        return summary;
    }

    public void setSummary(OperationSummary summary) {
        this.summary = summary == null ? new OperationSummary() : summary;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags == null ? new ArrayList<>() : tags;
    }

    @Override
    public String toString() {
        return "BatchOperation{" + id + " '" + name + "' " + type + " " + status + "}";
    }
}
