package com.largomodo.imagebatch.core.domain;

import java.util.List;

/**
 * One page of query results. Counts and page flags refer to the filtered set.
 */
public record OperationQueryResult(List<BatchOperation> operations,
                                   int totalCount,
                                   int pageNumber,
                                   int pageSize,
                                   int totalPages,
                                   boolean hasNextPage,
                                   boolean hasPreviousPage) {

    public OperationQueryResult {
        operations = List.copyOf(operations);
    }
}
