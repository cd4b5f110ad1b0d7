package com.largomodo.imagebatch.core.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Aggregate outcome counts for one operation, derived from its target images.
 *
 * @see com.largomodo.imagebatch.core.ProgressAggregator
 */
@JsonPropertyOrder({"totalImages", "successfulImages", "failedImages", "skippedImages", "cancelledImages",
        "successRate", "averageDurationMs", "totalBytesProcessed"})
public class OperationSummary {

    private int totalImages;
    private int successfulImages;
    private int failedImages;
    private int skippedImages;
    private int cancelledImages;
    private double successRate;
    private double averageDurationMs;
    private long totalBytesProcessed;

    public OperationSummary copy() {
        OperationSummary copy = new OperationSummary();
        copy.totalImages = totalImages;
        copy.successfulImages = successfulImages;
        copy.failedImages = failedImages;
        copy.skippedImages = skippedImages;
        copy.cancelledImages = cancelledImages;
        copy.successRate = successRate;
        copy.averageDurationMs = averageDurationMs;
        copy.totalBytesProcessed = totalBytesProcessed;
        return copy;
    }

    public int getTotalImages() {
        return totalImages;
    }

    public void setTotalImages(int totalImages) {
        this.totalImages = totalImages;
    }

    public int getSuccessfulImages() {
        return successfulImages;
    }

    public void setSuccessfulImages(int successfulImages) {
        this.successfulImages = successfulImages;
    }

    public int getFailedImages() {
        return failedImages;
    }

    public void setFailedImages(int failedImages) {
        this.failedImages = failedImages;
    }

    public int getSkippedImages() {
        return skippedImages;
    }

    public void setSkippedImages(int skippedImages) {
        this.skippedImages = skippedImages;
    }

    public int getCancelledImages() {
        return cancelledImages;
    }

    public void setCancelledImages(int cancelledImages) {
        this.cancelledImages = cancelledImages;
    }

    public double getSuccessRate() {
        return successRate;
    }

    public void setSuccessRate(double successRate) {
        this.successRate = successRate;
    }

    public double getAverageDurationMs() {
        return averageDurationMs;
    }

    public void setAverageDurationMs(double averageDurationMs) {
        this.averageDurationMs = averageDurationMs;
    }

    public long getTotalBytesProcessed() {
        return totalBytesProcessed;
    }

    public void setTotalBytesProcessed(long totalBytesProcessed) {
        this.totalBytesProcessed = totalBytesProcessed;
    }

    @Override
    public String toString() {
        return "total=" + totalImages + ", successful=" + successfulImages + ", failed=" + failedImages
                + ", skipped=" + skippedImages + ", cancelled=" + cancelledImages
                + ", successRate=" + successRate + "%";
    }
}
