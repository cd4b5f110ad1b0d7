package com.largomodo.imagebatch.core.domain;

import java.time.Instant;

/**
 * Filter, sort and paging parameters for listing stored operations.
 * <p>
 * Null filter fields match everything. Paging values are clamped rather than
 * rejected: page number to at least 1, page size to {@code 1..MAX_PAGE_SIZE}.
 */
public record OperationQuery(OperationStatus status,
                             OperationType type,
                             String createdBy,
                             String tag,
                             String nameContains,
                             Instant createdFrom,
                             Instant createdTo,
                             int pageNumber,
                             int pageSize,
                             String sortBy,
                             SortDirection sortDirection) {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 500;

    public OperationQuery {
        pageNumber = Math.max(1, pageNumber);
        pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, pageSize));
        sortBy = sortBy == null || sortBy.isBlank() ? "createdAt" : sortBy;
        sortDirection = sortDirection == null ? SortDirection.DESC : sortDirection;
    }

    public static OperationQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public enum SortDirection {
        ASC,
        DESC
    }

    public static final class Builder {
        private OperationStatus status;
        private OperationType type;
        private String createdBy;
        private String tag;
        private String nameContains;
        private Instant createdFrom;
        private Instant createdTo;
        private int pageNumber = 1;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private String sortBy = "createdAt";
        private SortDirection sortDirection = SortDirection.DESC;

        public Builder status(OperationStatus status) {
            this.status = status;
            return this;
        }

        public Builder type(OperationType type) {
            this.type = type;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder nameContains(String nameContains) {
            this.nameContains = nameContains;
            return this;
        }

        public Builder createdFrom(Instant createdFrom) {
            this.createdFrom = createdFrom;
            return this;
        }

        public Builder createdTo(Instant createdTo) {
            this.createdTo = createdTo;
            return this;
        }

        public Builder page(int pageNumber, int pageSize) {
            this.pageNumber = pageNumber;
            this.pageSize = pageSize;
            return this;
        }

        public Builder sortBy(String sortBy, SortDirection direction) {
            this.sortBy = sortBy;
            this.sortDirection = direction;
            return this;
        }

        public OperationQuery build() {
            return new OperationQuery(status, type, createdBy, tag, nameContains, createdFrom, createdTo,
                    pageNumber, pageSize, sortBy, sortDirection);
        }
    }
}
