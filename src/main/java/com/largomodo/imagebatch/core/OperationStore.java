package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.BatchOperation;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Whole-document persistence for operation records, keyed by operation id.
 * <p>
 * Core package depends on this abstraction, service package provides the file
 * implementation. Implementations must tolerate concurrent calls for different
 * ids; calls for the same id are serialized by the engine.
 */
public interface OperationStore {

    /**
     * Write the full record, replacing any previous snapshot for its id.
     * A concurrent reader must see either the old or the new document, never a mix.
     *
     * @throws IOException if the snapshot cannot be written
     */
    void save(BatchOperation operation) throws IOException;

    /**
     * @return the stored record, or empty if no snapshot exists for the id
     * @throws IOException if a snapshot exists but cannot be read
     */
    Optional<BatchOperation> load(String operationId) throws IOException;

    /**
     * Load every readable snapshot. Unreadable entries are skipped.
     *
     * @throws IOException if the store itself cannot be enumerated
     */
    List<BatchOperation> listAll() throws IOException;

    /**
     * @return true if a snapshot existed and was removed
     * @throws IOException if removal fails
     */
    boolean delete(String operationId) throws IOException;
}
