package com.largomodo.imagebatch.core.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of work within a batch operation: a single image to process.
 * <p>
 * Mutable bean so Jackson can bind it directly. Instances attached to a running
 * operation are only touched by the operation's single writer (see
 * {@link com.largomodo.imagebatch.core.OperationRun#update}).
 */
@JsonPropertyOrder({"imagePath", "imageIndex", "status", "progressPercentage", "statusMessage",
        "errorMessage", "failureKind", "startedAt", "completedAt", "durationMs", "bytesProcessed", "metadata"})
public class TargetImage {

    private String imagePath = "";
    private int imageIndex = 1;
    private ImageStatus status = ImageStatus.PENDING;
    private int progressPercentage;
    private String statusMessage = "";
    private String errorMessage;
    private FailureKind failureKind;
    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;
    private long bytesProcessed;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public TargetImage() {
    }

    public TargetImage(String imagePath) {
        this(imagePath, 1);
    }

    public TargetImage(String imagePath, int imageIndex) {
        this.imagePath = imagePath;
        this.imageIndex = imageIndex;
    }

    /**
     * Returns a deep copy. Metadata values are shared (treated as immutable).
     */
    public TargetImage copy() {
        TargetImage copy = new TargetImage(imagePath, imageIndex);
        copy.status = status;
        copy.progressPercentage = progressPercentage;
        copy.statusMessage = statusMessage;
        copy.errorMessage = errorMessage;
        copy.failureKind = failureKind;
        copy.startedAt = startedAt;
        copy.completedAt = completedAt;
        copy.durationMs = durationMs;
        copy.bytesProcessed = bytesProcessed;
        copy.metadata = new LinkedHashMap<>(metadata);
        return copy;
    }

    /**
     * Put the image back into its never-attempted state, keeping identity and metadata.
     */
    public void resetToPending() {
        status = ImageStatus.PENDING;
        progressPercentage = 0;
        statusMessage = "";
        errorMessage = null;
        failureKind = null;
        startedAt = null;
        completedAt = null;
        durationMs = 0;
        bytesProcessed = 0;
    }

    public String getImagePath() {
        return imagePath;
    }

    public void setImagePath(String imagePath) {
        this.imagePath = imagePath;
    }

    public int getImageIndex() {
        return imageIndex;
    }

    public void setImageIndex(int imageIndex) {
        this.imageIndex = imageIndex;
    }

    public ImageStatus getStatus() {
        return status;
    }

    public void setStatus(ImageStatus status) {
        this.status = status;
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

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public void setFailureKind(FailureKind failureKind) {
        this.failureKind = failureKind;
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

    public long getBytesProcessed() {
        return bytesProcessed;
    }

    public void setBytesProcessed(long bytesProcessed) {
        this.bytesProcessed = bytesProcessed;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new LinkedHashMap<>() : metadata;
    }

    @Override
    public String toString() {
        return "TargetImage{" + imagePath + " #" + imageIndex + " " + status + "}";
    }
}
