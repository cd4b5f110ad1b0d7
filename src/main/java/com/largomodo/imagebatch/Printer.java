package com.largomodo.imagebatch;

import com.largomodo.imagebatch.core.domain.BatchOperation;
import com.largomodo.imagebatch.core.domain.OperationQueryResult;
import com.largomodo.imagebatch.core.domain.OperationStatistics;
import com.largomodo.imagebatch.core.domain.OperationSummary;
import com.largomodo.imagebatch.core.domain.TargetImage;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering of operations for the command line.
 */
final class Printer {

    private Printer() {
    }

    static void summary(PrintWriter out, BatchOperation operation) {
        OperationSummary summary = operation.getSummary();
        out.printf(Locale.ROOT, "Operation %s finished %s in %d ms%n",
                operation.getId(), operation.getStatus(), operation.getDurationMs());
        out.printf(Locale.ROOT, "  %d successful, %d failed, %d skipped, %d cancelled of %d (%.2f%% success)%n",
                summary.getSuccessfulImages(), summary.getFailedImages(), summary.getSkippedImages(),
                summary.getCancelledImages(), summary.getTotalImages(), summary.getSuccessRate());
        if (operation.getErrorMessage() != null) {
            out.println("  Error: " + operation.getErrorMessage());
        }
        out.flush();
    }

    static void details(PrintWriter out, BatchOperation operation) {
        out.println("Id:          " + operation.getId());
        out.println("Name:        " + operation.getName());
        out.println("Type:        " + operation.getType());
        out.println("Status:      " + operation.getStatus() + " (" + operation.getStatusMessage() + ")");
        out.println("Progress:    " + operation.getProgressPercentage() + "%");
        out.println("Created:     " + operation.getCreatedAt() + " by " + operation.getCreatedBy());
        if (operation.getStartedAt() != null) {
            out.println("Started:     " + operation.getStartedAt());
        }
        if (operation.getCompletedAt() != null) {
            out.println("Completed:   " + operation.getCompletedAt() + " (" + operation.getDurationMs() + " ms)");
        }
        out.println("Parallelism: " + operation.getMaxParallelOperations()
                + (operation.isContinueOnError() ? "" : ", stop on error"));
        if (!operation.getTags().isEmpty()) {
            out.println("Tags:        " + String.join(", ", operation.getTags()));
        }
        if (operation.getErrorMessage() != null) {
            out.println("Error:       " + operation.getErrorMessage());
        }
        out.println("Images:");
        for (TargetImage image : operation.getTargetImages()) {
            out.printf(Locale.ROOT, "  %-9s %s [%d]%s%n", image.getStatus(), image.getImagePath(), image.getImageIndex(),
                    image.getErrorMessage() == null ? "" : " - " + image.getErrorMessage());
        }
        out.flush();
    }

    static void table(PrintWriter out, OperationQueryResult result) {
        out.printf(Locale.ROOT, "%-36s  %-21s  %-17s  %4s  %s%n", "ID", "STATUS", "TYPE", "PROG", "NAME");
        for (BatchOperation operation : result.operations()) {
            out.printf(Locale.ROOT, "%-36s  %-21s  %-17s  %3d%%  %s%n", operation.getId(), operation.getStatus(),
                    operation.getType(), operation.getProgressPercentage(), operation.getName());
        }
        out.printf(Locale.ROOT, "Page %d of %d (%d operations)%n",
                result.pageNumber(), Math.max(1, result.totalPages()), result.totalCount());
        out.flush();
    }

    static void statistics(PrintWriter out, OperationStatistics statistics) {
        out.println("Operations:       " + statistics.totalOperations());
        out.println("Completed:        " + statistics.completedOperations());
        out.println("Failed:           " + statistics.failedOperations());
        out.println("Running:          " + statistics.runningOperations());
        out.println("Images processed: " + statistics.totalImagesProcessed());
        out.printf(Locale.ROOT, "Success rate:     %.2f%%%n", statistics.successRate());
        out.printf(Locale.ROOT, "Average duration: %.0f ms%n", statistics.averageDurationMs());
        statistics.operationsByStatus().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> out.println("  " + e.getKey() + ": " + e.getValue()));
        out.flush();
    }
}
