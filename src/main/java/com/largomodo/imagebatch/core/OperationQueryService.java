package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.BatchOperation;
import com.largomodo.imagebatch.core.domain.OperationQuery;
import com.largomodo.imagebatch.core.domain.OperationQueryResult;
import com.largomodo.imagebatch.core.domain.OperationStatistics;
import com.largomodo.imagebatch.core.domain.OperationStatus;
import com.largomodo.imagebatch.core.domain.OperationType;

import java.io.IOException;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Read-only filtering, sorting, paging and statistics over stored operations.
 * <p>
 * Works on the persisted snapshots, so active operations appear with their last
 * written state.
 */
public class OperationQueryService {

    private final OperationStore store;

    public OperationQueryService(OperationStore store) {
        this.store = store;
    }

    /**
     * @throws OperationStoreException if the store cannot be listed
     */
    public OperationQueryResult query(OperationQuery query) {
        List<BatchOperation> matching = loadAll().stream()
                .filter(matches(query))
                .sorted(comparator(query.sortBy(), query.sortDirection()))
                .toList();

        int totalCount = matching.size();
        int pageSize = query.pageSize();
        int totalPages = (totalCount + pageSize - 1) / pageSize;
        long from = (long) (query.pageNumber() - 1) * pageSize;
        List<BatchOperation> page = matching.stream()
                .skip(from)
                .limit(pageSize)
                .toList();

        return new OperationQueryResult(page, totalCount, query.pageNumber(), pageSize, totalPages,
                query.pageNumber() < totalPages, query.pageNumber() > 1);
    }

    /**
     * Aggregate figures over operations created within {@code [from, to]}; either bound may be null.
     */
    public OperationStatistics statistics(Instant from, Instant to) {
        List<BatchOperation> operations = loadAll().stream()
                .filter(op -> from == null || (op.getCreatedAt() != null && !op.getCreatedAt().isBefore(from)))
                .filter(op -> to == null || (op.getCreatedAt() != null && !op.getCreatedAt().isAfter(to)))
                .toList();

        int total = operations.size();
        int completed = countStatus(operations, OperationStatus.COMPLETED);
        int failed = countStatus(operations, OperationStatus.FAILED);
        int running = countStatus(operations, OperationStatus.RUNNING);
        int imagesProcessed = operations.stream()
                .mapToInt(op -> op.getSummary().getSuccessfulImages() + op.getSummary().getFailedImages())
                .sum();
        double successRate = total > 0 ? Math.round(completed * 10000.0 / total) / 100.0 : 0;
        double averageDuration = operations.stream()
                .filter(op -> op.getCompletedAt() != null)
                .mapToLong(BatchOperation::getDurationMs)
                .average()
                .orElse(0);

        Map<OperationType, Integer> byType = new EnumMap<>(OperationType.class);
        Map<OperationStatus, Integer> byStatus = new EnumMap<>(OperationStatus.class);
        for (BatchOperation op : operations) {
            byType.merge(op.getType(), 1, Integer::sum);
            byStatus.merge(op.getStatus(), 1, Integer::sum);
        }

        return new OperationStatistics(total, completed, failed, running, imagesProcessed,
                successRate, averageDuration, byType, byStatus);
    }

    static Predicate<BatchOperation> matches(OperationQuery query) {
        Predicate<BatchOperation> filter = op -> true;
        if (query.status() != null) {
            filter = filter.and(op -> op.getStatus() == query.status());
        }
        if (query.type() != null) {
            filter = filter.and(op -> op.getType() == query.type());
        }
        if (query.createdBy() != null && !query.createdBy().isBlank()) {
            filter = filter.and(op -> query.createdBy().equalsIgnoreCase(op.getCreatedBy()));
        }
        if (query.tag() != null && !query.tag().isBlank()) {
            filter = filter.and(op -> op.getTags().stream().anyMatch(t -> t.equalsIgnoreCase(query.tag())));
        }
        if (query.nameContains() != null && !query.nameContains().isBlank()) {
            String needle = query.nameContains().toLowerCase(Locale.ROOT);
            filter = filter.and(op -> op.getName() != null
                    && op.getName().toLowerCase(Locale.ROOT).contains(needle));
        }
        if (query.createdFrom() != null) {
            filter = filter.and(op -> op.getCreatedAt() != null && !op.getCreatedAt().isBefore(query.createdFrom()));
        }
        if (query.createdTo() != null) {
            filter = filter.and(op -> op.getCreatedAt() != null && !op.getCreatedAt().isAfter(query.createdTo()));
        }
        return filter;
    }

    static Comparator<BatchOperation> comparator(String sortBy, OperationQuery.SortDirection direction) {
        Comparator<BatchOperation> comparator = switch (sortBy.toLowerCase(Locale.ROOT)) {
            case "name" -> Comparator.comparing(BatchOperation::getName,
                    Comparator.nullsFirst(String.CASE_INSENSITIVE_ORDER));
            case "type" -> Comparator.comparing(BatchOperation::getType);
            case "status" -> Comparator.comparing(BatchOperation::getStatus);
            case "priority" -> Comparator.comparingInt(BatchOperation::getPriority);
            default -> Comparator.comparing(BatchOperation::getCreatedAt,
                    Comparator.nullsFirst(Comparator.naturalOrder()));
        };
        // Stable tie-break so paging is deterministic
        comparator = comparator.thenComparing(BatchOperation::getId);
        return direction == OperationQuery.SortDirection.ASC ? comparator : comparator.reversed();
    }

    private static int countStatus(List<BatchOperation> operations, OperationStatus status) {
        return (int) operations.stream().filter(op -> op.getStatus() == status).count();
    }

    private List<BatchOperation> loadAll() {
        try {
            return store.listAll();
        } catch (IOException e) {
            throw new OperationStoreException("Failed to list batch operations", e);
        }
    }
}
