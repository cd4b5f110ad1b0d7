package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.BatchOperation;
import com.largomodo.imagebatch.core.domain.ImageStatus;
import com.largomodo.imagebatch.core.domain.OperationStatus;
import com.largomodo.imagebatch.core.domain.OperationSummary;
import com.largomodo.imagebatch.core.domain.TargetImage;

import java.util.List;

/**
 * Derives progress and outcome figures for an operation from its target images.
 * <p>
 * Pure functions over the image list. Callers holding the operation's write lock
 * use {@link #refresh(BatchOperation)} after every sub-task transition.
 */
public final class ProgressAggregator {

    private ProgressAggregator() {
    }

    /**
     * Count images by terminal status and derive rates.
     * <p>
     * {@code successRate} is a percentage rounded to two decimals (0 for an empty list).
     * {@code averageDurationMs} averages only images that have a completion time.
     */
    public static OperationSummary summarize(List<TargetImage> images) {
        OperationSummary summary = new OperationSummary();
        int completedWithTime = 0;
        long durationTotal = 0;
        long bytesTotal = 0;

        for (TargetImage image : images) {
            switch (image.getStatus()) {
                case COMPLETED -> {
                    summary.setSuccessfulImages(summary.getSuccessfulImages() + 1);
                    bytesTotal += image.getBytesProcessed();
                }
                case FAILED -> summary.setFailedImages(summary.getFailedImages() + 1);
                case SKIPPED -> summary.setSkippedImages(summary.getSkippedImages() + 1);
                case CANCELLED -> summary.setCancelledImages(summary.getCancelledImages() + 1);
                case PENDING, RUNNING -> {
                    // not yet counted
                }
            }
            if (image.getCompletedAt() != null) {
                completedWithTime++;
                durationTotal += image.getDurationMs();
            }
        }

        int total = images.size();
        summary.setTotalImages(total);
        summary.setSuccessRate(total > 0 ? round2(summary.getSuccessfulImages() * 100.0 / total) : 0);
        summary.setAverageDurationMs(completedWithTime > 0 ? (double) durationTotal / completedWithTime : 0);
        summary.setTotalBytesProcessed(bytesTotal);
        return summary;
    }

    /**
     * Share of images in a terminal status, floored to a whole percentage.
     * Only pending/running to terminal transitions move it, so it never decreases during a run.
     */
    public static int progressPercentage(List<TargetImage> images) {
        if (images.isEmpty()) {
            return 0;
        }
        long finished = images.stream().filter(i -> i.getStatus().isTerminal()).count();
        return (int) (finished * 100 / images.size());
    }

    /**
     * Final status for an operation that was neither cancelled nor aborted by an orchestration error.
     * <p>
     * Any failed image yields FAILED when {@code continueOnError} is false (the fan-out was
     * aborted), COMPLETED_WITH_ERRORS otherwise. No failures yields COMPLETED.
     */
    public static OperationStatus outcome(List<TargetImage> images, boolean continueOnError) {
        boolean anyFailed = images.stream().anyMatch(i -> i.getStatus() == ImageStatus.FAILED);
        if (!anyFailed) {
            return OperationStatus.COMPLETED;
        }
        return continueOnError ? OperationStatus.COMPLETED_WITH_ERRORS : OperationStatus.FAILED;
    }

    /**
     * Recompute summary and progress on the record in place.
     */
    public static void refresh(BatchOperation operation) {
        List<TargetImage> images = operation.getTargetImages();
        operation.setSummary(summarize(images));
        operation.setProgressPercentage(progressPercentage(images));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
